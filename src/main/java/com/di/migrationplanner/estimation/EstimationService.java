package com.di.migrationplanner.estimation;

import com.di.migrationplanner.estimation.dto.CalculatorInfo;
import com.di.migrationplanner.estimation.dto.EstimationOutcome;
import com.di.migrationplanner.estimation.dto.EstimationResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs calculators from the {@link CalculatorRegistry} against a caller-supplied parameter set.
 * Each calculator is independent: one failing never affects the others, and no totals are computed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EstimationService {

    private final CalculatorRegistry registry;

    public List<CalculatorInfo> listCalculators() {
        return registry.getCalculators().stream()
                .map(c -> CalculatorInfo.of(CalculatorRegistry.normalizeName(c.name()), c))
                .toList();
    }

    /**
     * Runs a single calculator.
     *
     * @throws UnknownCalculatorException if the name is not registered
     * @throws EstimationException if the calculator rejects the parameters
     */
    public EstimationResponse estimate(String calculatorName, Map<String, Object> rawParams) {
        Calculator calculator = registry.getCalculator(calculatorName);
        Map<String, Param> params = Param.registryOf(rawParams);
        Estimation estimation = calculator.calculate(params);
        log.info("[ESTIMATION] {} -> {} ({})", calculator.name(), estimation.getDuration(), estimation.getReason());
        return EstimationResponse.from(calculator.name(), estimation);
    }

    /**
     * Runs the named calculators (all registered when {@code calculatorNames} is null or empty)
     * and reports one outcome per calculator. Unknown names fail the whole call before anything runs.
     */
    public List<EstimationOutcome> estimateAll(List<String> calculatorNames, Map<String, Object> rawParams) {
        List<Calculator> selected = new ArrayList<>();
        if (calculatorNames == null || calculatorNames.isEmpty()) {
            selected.addAll(registry.getCalculators());
        } else {
            for (String name : calculatorNames) {
                selected.add(registry.getCalculator(name));
            }
        }

        Map<String, Param> params = Param.registryOf(rawParams);
        List<EstimationOutcome> outcomes = new ArrayList<>(selected.size());
        for (Calculator calculator : selected) {
            outcomes.add(runOne(calculator, params));
        }
        long failed = outcomes.stream().filter(o -> !o.isSuccess()).count();
        log.info("[ESTIMATION] Ran {} calculator(s): {} succeeded, {} failed",
                outcomes.size(), outcomes.size() - failed, failed);
        return outcomes;
    }

    private static EstimationOutcome runOne(Calculator calculator, Map<String, Param> params) {
        try {
            Estimation estimation = calculator.calculate(params);
            log.debug("[ESTIMATION] {} -> {} ({})", calculator.name(), estimation.getDuration(), estimation.getReason());
            return EstimationOutcome.builder()
                    .calculator(calculator.name())
                    .estimation(EstimationResponse.from(calculator.name(), estimation))
                    .build();
        } catch (EstimationException e) {
            log.warn("[ESTIMATION] {} unavailable: {} [{}]", calculator.name(), e.getMessage(), e.getError());
            return EstimationOutcome.builder()
                    .calculator(calculator.name())
                    .error(e.getMessage())
                    .errorKind(e.getError())
                    .parameter(e.getParameter())
                    .build();
        }
    }
}
