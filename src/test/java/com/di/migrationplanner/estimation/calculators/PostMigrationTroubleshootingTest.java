package com.di.migrationplanner.estimation.calculators;

import com.di.migrationplanner.estimation.Estimation;
import com.di.migrationplanner.estimation.EstimationError;
import com.di.migrationplanner.estimation.EstimationException;
import com.di.migrationplanner.estimation.Param;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

import static com.di.migrationplanner.estimation.calculators.PostMigrationTroubleshooting.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PostMigrationTroubleshooting Tests")
class PostMigrationTroubleshootingTest {

    // ============================================================================
    // Name / Keys
    // ============================================================================

    @Test
    @DisplayName("Name is non-empty and keys contain vm_count")
    void testNameAndKeys() {
        PostMigrationTroubleshooting calc = PostMigrationTroubleshooting.withDefaults();
        assertFalse(calc.name().isBlank());
        assertFalse(calc.keys().isEmpty());
        assertTrue(calc.keys().contains(PARAM_VM_COUNT));
    }

    @Test
    @DisplayName("Builder without options keeps built-in defaults")
    void testBuilderDefaults() {
        PostMigrationTroubleshooting calc = PostMigrationTroubleshooting.builder().build();
        assertEquals(60.0, calc.getTroubleshootMinsPerVm());
        assertEquals(10, calc.getEngineerCount());
        assertEquals(8.0, calc.getWorkHoursPerDay());
    }

    // ============================================================================
    // Calculation
    // ============================================================================

    @Test
    @DisplayName("10 VMs with defaults -> 60 minutes, 1 work days")
    void testCalculate_WithDefaults() {
        Estimation result = PostMigrationTroubleshooting.withDefaults()
                .calculate(Param.registry(Param.of(PARAM_VM_COUNT, 10)));

        // 10 VMs * 60 min / 10 engineers = 60 min
        assertEquals(Duration.ofMinutes(60), result.getDuration());
        assertTrue(result.getReason().contains("1 work days"), result.getReason());
    }

    @Test
    @DisplayName("Constructor options change minutes per VM and engineer count")
    void testCalculate_WithCustomOptions() {
        PostMigrationTroubleshooting calc = PostMigrationTroubleshooting.builder()
                .troubleshootMinsPerVm(30.0)
                .engineerCount(3)
                .build();

        Estimation result = calc.calculate(Param.registry(Param.of(PARAM_VM_COUNT, 12)));

        // 12 * 30 / 3 = 120 min
        assertEquals(Duration.ofMinutes(120), result.getDuration());
        assertFalse(result.getReason().isEmpty());
    }

    @Test
    @DisplayName("Shorter work day increases the work-day count but not the duration")
    void testCalculate_WorkDaysCustomHours() {
        PostMigrationTroubleshooting calc = PostMigrationTroubleshooting.builder().workHoursPerDay(4.0).build();

        // 100 * 60 / 10 = 600 min; ceil(600 / 240) = 3
        Estimation result = calc.calculate(Param.registry(Param.of(PARAM_VM_COUNT, 100)));

        assertEquals(Duration.ofMinutes(600), result.getDuration());
        assertTrue(result.getReason().contains("3 work days"), result.getReason());
    }

    @ParameterizedTest(name = "{0} VMs -> {1} work days")
    @CsvSource({
            "5, 1",    // 30 min, well under a day
            "80, 1",   // exactly 480 min
            "81, 2",   // 486 min
            "160, 2",  // exactly two days
            "0, 0"     // nothing to do
    })
    @DisplayName("Work days are the ceiling of real-time minutes over an 8h day")
    void testCalculate_WorkDayBoundaries(int vmCount, int expectedDays) {
        Estimation result = PostMigrationTroubleshooting.withDefaults()
                .calculate(Param.registry(Param.of(PARAM_VM_COUNT, vmCount)));
        assertTrue(result.getReason().contains("(" + expectedDays + " work days"), result.getReason());
    }

    @Test
    @DisplayName("Zero VMs yields zero duration")
    void testCalculate_ZeroVms() {
        Estimation result = PostMigrationTroubleshooting.withDefaults()
                .calculate(Param.registry(Param.of(PARAM_VM_COUNT, 0)));
        assertEquals(Duration.ZERO, result.getDuration());
    }

    @Test
    @DisplayName("Duration is exactly vms * minsPerVm / engineers")
    void testCalculate_ExactFormula() {
        PostMigrationTroubleshooting calc = PostMigrationTroubleshooting.builder()
                .troubleshootMinsPerVm(45.0)
                .engineerCount(4)
                .build();
        // 7 * 45 / 4 = 78.75 min
        Estimation result = calc.calculate(Param.registry(Param.of(PARAM_VM_COUNT, 7)));
        assertEquals(Duration.ofSeconds(78 * 60 + 45), result.getDuration());
    }

    @Test
    @DisplayName("Fractional and long VM counts are accepted as numbers")
    void testCalculate_NumericTypes() {
        PostMigrationTroubleshooting calc = PostMigrationTroubleshooting.withDefaults();
        assertEquals(Duration.ofMinutes(60), calc.calculate(Param.registry(Param.of(PARAM_VM_COUNT, 10L))).getDuration());
        assertEquals(Duration.ofMinutes(60), calc.calculate(Param.registry(Param.of(PARAM_VM_COUNT, 10.0))).getDuration());
    }

    // ============================================================================
    // Parameter precedence
    // ============================================================================

    @Test
    @DisplayName("Params override built-in defaults")
    void testCalculate_ParamsOverrideDefaults() {
        Estimation result = PostMigrationTroubleshooting.withDefaults().calculate(Param.registry(
                Param.of(PARAM_VM_COUNT, 20),
                Param.of(PARAM_TROUBLESHOOT_MINS_PER_VM, 45.0),
                Param.of(PARAM_POST_MIGRATION_ENGINEERS, 5)));

        // 20 * 45 / 5 = 180 min
        assertEquals(Duration.ofMinutes(180), result.getDuration());
    }

    @Test
    @DisplayName("Params override constructor options")
    void testCalculate_ParamsOverrideOptions() {
        PostMigrationTroubleshooting calc = PostMigrationTroubleshooting.builder()
                .troubleshootMinsPerVm(30.0)
                .engineerCount(3)
                .build();

        Estimation result = calc.calculate(Param.registry(
                Param.of(PARAM_VM_COUNT, 15),
                Param.of(PARAM_TROUBLESHOOT_MINS_PER_VM, 50.0),
                Param.of(PARAM_POST_MIGRATION_ENGINEERS, 6)));

        // 15 * 50 / 6 = 125 min
        assertEquals(Duration.ofMinutes(125), result.getDuration());
    }

    @Test
    @DisplayName("Partial override keeps the other value at the built-in default")
    void testCalculate_PartialOverride() {
        Estimation result = PostMigrationTroubleshooting.withDefaults().calculate(Param.registry(
                Param.of(PARAM_VM_COUNT, 20),
                Param.of(PARAM_TROUBLESHOOT_MINS_PER_VM, 30.0)));

        // 20 * 30 / 10 = 60 min
        assertEquals(Duration.ofMinutes(60), result.getDuration());
    }

    @Test
    @DisplayName("Partial override keeps the other value at the configured option, not the built-in default")
    void testCalculate_PartialOverrideKeepsConfiguredOption() {
        PostMigrationTroubleshooting calc = PostMigrationTroubleshooting.builder().engineerCount(4).build();

        Estimation result = calc.calculate(Param.registry(
                Param.of(PARAM_VM_COUNT, 8),
                Param.of(PARAM_TROUBLESHOOT_MINS_PER_VM, 30.0)));

        // 8 * 30 / 4 = 60 min (would be 24 min with the default 10 engineers)
        assertEquals(Duration.ofMinutes(60), result.getDuration());
    }

    @Test
    @DisplayName("Engineer override rescues a misconfigured zero engineer count")
    void testCalculate_EngineerOverrideRescuesBadOption() {
        PostMigrationTroubleshooting calc = PostMigrationTroubleshooting.builder().engineerCount(0).build();
        Estimation result = calc.calculate(Param.registry(
                Param.of(PARAM_VM_COUNT, 10),
                Param.of(PARAM_POST_MIGRATION_ENGINEERS, 2)));
        assertEquals(Duration.ofMinutes(300), result.getDuration());
    }

    @Test
    @DisplayName("Unknown keys are ignored")
    void testCalculate_IgnoresUnknownKeys() {
        Estimation result = PostMigrationTroubleshooting.withDefaults().calculate(Param.registry(
                Param.of(PARAM_VM_COUNT, 10),
                Param.of("total_disk_gb", "whatever")));
        assertEquals(Duration.ofMinutes(60), result.getDuration());
    }

    // ============================================================================
    // Errors
    // ============================================================================

    static Stream<Arguments> errorCases() {
        return Stream.of(
                Arguments.of("missing vm_count", PostMigrationTroubleshooting.withDefaults(),
                        Collections.<String, Param>emptyMap(), EstimationError.MISSING_PARAMETER),
                Arguments.of("vm_count not a number", PostMigrationTroubleshooting.withDefaults(),
                        Param.registry(Param.of(PARAM_VM_COUNT, "not a number")), EstimationError.INVALID_TYPE),
                Arguments.of("vm_count null", PostMigrationTroubleshooting.withDefaults(),
                        Param.registry(Param.of(PARAM_VM_COUNT, null)), EstimationError.INVALID_TYPE),
                Arguments.of("negative vm_count", PostMigrationTroubleshooting.withDefaults(),
                        Param.registry(Param.of(PARAM_VM_COUNT, -5)), EstimationError.OUT_OF_RANGE),
                Arguments.of("zero engineers via option", PostMigrationTroubleshooting.builder().engineerCount(0).build(),
                        Param.registry(Param.of(PARAM_VM_COUNT, 10)), EstimationError.OUT_OF_RANGE),
                Arguments.of("negative engineers via option", PostMigrationTroubleshooting.builder().engineerCount(-1).build(),
                        Param.registry(Param.of(PARAM_VM_COUNT, 10)), EstimationError.OUT_OF_RANGE),
                Arguments.of("zero engineers via param", PostMigrationTroubleshooting.withDefaults(),
                        Param.registry(Param.of(PARAM_VM_COUNT, 10), Param.of(PARAM_POST_MIGRATION_ENGINEERS, 0)),
                        EstimationError.OUT_OF_RANGE),
                Arguments.of("fractional engineers via param", PostMigrationTroubleshooting.withDefaults(),
                        Param.registry(Param.of(PARAM_VM_COUNT, 10), Param.of(PARAM_POST_MIGRATION_ENGINEERS, 2.5)),
                        EstimationError.OUT_OF_RANGE),
                Arguments.of("engineers not a number", PostMigrationTroubleshooting.withDefaults(),
                        Param.registry(Param.of(PARAM_VM_COUNT, 10), Param.of(PARAM_POST_MIGRATION_ENGINEERS, "five")),
                        EstimationError.INVALID_TYPE),
                Arguments.of("negative minutes per VM", PostMigrationTroubleshooting.withDefaults(),
                        Param.registry(Param.of(PARAM_VM_COUNT, 10), Param.of(PARAM_TROUBLESHOOT_MINS_PER_VM, -1.0)),
                        EstimationError.OUT_OF_RANGE),
                Arguments.of("zero work hours per day", PostMigrationTroubleshooting.builder().workHoursPerDay(0).build(),
                        Param.registry(Param.of(PARAM_VM_COUNT, 10)), EstimationError.OUT_OF_RANGE)
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("errorCases")
    @DisplayName("Invalid input fails with the matching error kind")
    void testCalculate_ErrorCases(String name, PostMigrationTroubleshooting calc,
                                  Map<String, Param> params, EstimationError expected) {
        EstimationException e = assertThrows(EstimationException.class, () -> calc.calculate(params));
        assertEquals(expected, e.getError());
        assertNotNull(e.getMessage());
    }

    @Test
    @DisplayName("Missing vm_count reports the parameter name")
    void testCalculate_MissingReportsKey() {
        EstimationException e = assertThrows(EstimationException.class,
                () -> PostMigrationTroubleshooting.withDefaults().calculate(Map.of()));
        assertEquals(PARAM_VM_COUNT, e.getParameter());
        assertTrue(e.getMessage().contains(PARAM_VM_COUNT));
    }

    // ============================================================================
    // Large inputs / concurrent use
    // ============================================================================

    @Test
    @DisplayName("100M VMs gives the exact 600M minutes the reason reports")
    void testCalculate_VeryLargeVmCount() {
        Estimation result = PostMigrationTroubleshooting.withDefaults()
                .calculate(Param.registry(Param.of(PARAM_VM_COUNT, 100_000_000)));

        assertEquals(Duration.ofMinutes(600_000_000L), result.getDuration());
        assertEquals(6.0e8, result.getDurationMinutes());
        assertTrue(result.getReason().contains("= 600000000 min"), result.getReason());
    }

    @Test
    @DisplayName("One instance serves many threads with independent parameter sets")
    void testCalculate_ConcurrentCalls() throws Exception {
        PostMigrationTroubleshooting calc = PostMigrationTroubleshooting.withDefaults();
        List<Callable<Estimation>> tasks = new ArrayList<>();
        for (int vms = 0; vms < 200; vms++) {
            int vmCount = vms;
            tasks.add(() -> calc.calculate(Param.registry(Param.of(PARAM_VM_COUNT, vmCount))));
        }

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Estimation>> results = executor.invokeAll(tasks);
            for (int vms = 0; vms < results.size(); vms++) {
                // vms * 60 min / 10 engineers
                assertEquals(Duration.ofMinutes(vms * 6L), results.get(vms).get().getDuration());
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
