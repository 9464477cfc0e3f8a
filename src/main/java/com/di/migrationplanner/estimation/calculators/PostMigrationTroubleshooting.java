package com.di.migrationplanner.estimation.calculators;

import com.di.migrationplanner.estimation.Calculator;
import com.di.migrationplanner.estimation.Estimation;
import com.di.migrationplanner.estimation.EstimationException;
import com.di.migrationplanner.estimation.Param;
import com.di.migrationplanner.estimation.ParamValues;
import com.di.migrationplanner.estimation.WorkDays;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Estimates the engineering effort needed to fix up VMs after they land on the target cluster.
 *
 * <p>Model: every VM needs {@code minsPerVm} of hands-on work, spread evenly across
 * {@code engineers} working in parallel:
 * <pre>
 *   realTimeMins = vmCount * minsPerVm / engineers
 *   workDays     = ceil(realTimeMins / (workHoursPerDay * 60))
 * </pre>
 * {@value #PARAM_TROUBLESHOOT_MINS_PER_VM} and {@value #PARAM_POST_MIGRATION_ENGINEERS} override the
 * configured values for a single call.
 */
@Slf4j
public final class PostMigrationTroubleshooting implements Calculator {

    public static final String NAME = "Post-Migration Troubleshooting";

    /** Number of VMs being migrated. Required. */
    public static final String PARAM_VM_COUNT = "vm_count";
    /** Minutes of troubleshooting per VM. Optional. */
    public static final String PARAM_TROUBLESHOOT_MINS_PER_VM = "troubleshoot_mins_per_vm";
    /** Engineers troubleshooting in parallel. Optional. */
    public static final String PARAM_POST_MIGRATION_ENGINEERS = "post_migration_engineers";

    public static final double DEFAULT_TROUBLESHOOT_MINS_PER_VM = 60.0;
    public static final int DEFAULT_ENGINEER_COUNT = 10;
    public static final double DEFAULT_WORK_HOURS_PER_DAY = WorkDays.DEFAULT_WORK_HOURS_PER_DAY;

    private final double troubleshootMinsPerVm;
    private final int engineerCount;
    private final double workHoursPerDay;

    private PostMigrationTroubleshooting(Builder builder) {
        this.troubleshootMinsPerVm = builder.troubleshootMinsPerVm;
        this.engineerCount = builder.engineerCount;
        this.workHoursPerDay = builder.workHoursPerDay;
    }

    public static PostMigrationTroubleshooting withDefaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> keys() {
        return List.of(PARAM_VM_COUNT);
    }

    @Override
    public Estimation calculate(Map<String, Param> params) {
        double vmCount = ParamValues.requireNonNegative(params, PARAM_VM_COUNT);

        double minsPerVm = troubleshootMinsPerVm;
        OptionalDouble minsOverride = ParamValues.optionalDouble(params, PARAM_TROUBLESHOOT_MINS_PER_VM);
        if (minsOverride.isPresent()) {
            minsPerVm = minsOverride.getAsDouble();
        }
        if (minsPerVm < 0) {
            throw EstimationException.outOfRange(PARAM_TROUBLESHOOT_MINS_PER_VM,
                    "troubleshooting minutes per VM must be non-negative, got " + minsPerVm);
        }

        int engineers = engineerCount;
        OptionalDouble engineersOverride = ParamValues.optionalDouble(params, PARAM_POST_MIGRATION_ENGINEERS);
        if (engineersOverride.isPresent()) {
            engineers = ParamValues.toWholeCount(PARAM_POST_MIGRATION_ENGINEERS, engineersOverride.getAsDouble());
        }
        if (engineers <= 0) {
            throw EstimationException.outOfRange(PARAM_POST_MIGRATION_ENGINEERS,
                    "engineer count must be positive, got " + engineers);
        }
        if (!(workHoursPerDay > 0)) {
            throw EstimationException.outOfRange("work_hours_per_day",
                    "work hours per day must be positive, got " + workHoursPerDay);
        }

        double totalMins = vmCount * minsPerVm;
        double realTimeMins = totalMins / engineers;
        long workDays = WorkDays.fromMinutes(realTimeMins, workHoursPerDay);

        log.debug("[POST-MIGRATION] vms={} minsPerVm={} engineers={} realTimeMins={} workDays={}",
                vmCount, minsPerVm, engineers, realTimeMins, workDays);

        String reason = String.format(Locale.ROOT,
                "%.0f VMs x %.0f min/VM = %.0f min across %d engineers = %.0f min (%d work days at %.1f h/day)",
                vmCount, minsPerVm, totalMins, engineers, realTimeMins, workDays, workHoursPerDay);
        return Estimation.ofMinutes(realTimeMins, reason);
    }

    public double getTroubleshootMinsPerVm() {
        return troubleshootMinsPerVm;
    }

    public int getEngineerCount() {
        return engineerCount;
    }

    public double getWorkHoursPerDay() {
        return workHoursPerDay;
    }

    /**
     * Options are applied in call order; unset options keep their defaults. Values are not
     * validated here: a non-positive engineer count or work-day length fails at {@link #calculate}.
     */
    public static final class Builder {
        private double troubleshootMinsPerVm = DEFAULT_TROUBLESHOOT_MINS_PER_VM;
        private int engineerCount = DEFAULT_ENGINEER_COUNT;
        private double workHoursPerDay = DEFAULT_WORK_HOURS_PER_DAY;

        private Builder() {}

        public Builder troubleshootMinsPerVm(double minutes) {
            this.troubleshootMinsPerVm = minutes;
            return this;
        }

        public Builder engineerCount(int engineers) {
            this.engineerCount = engineers;
            return this;
        }

        public Builder workHoursPerDay(double hours) {
            this.workHoursPerDay = hours;
            return this;
        }

        public PostMigrationTroubleshooting build() {
            return new PostMigrationTroubleshooting(this);
        }
    }
}
