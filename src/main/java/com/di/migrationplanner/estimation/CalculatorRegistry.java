package com.di.migrationplanner.estimation;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Registry for looking up calculators by name.
 *
 * <p>All {@link Calculator} beans are discovered and registered under a normalized form of their
 * {@link Calculator#name()}: lower case, with every run of non-alphanumeric characters collapsed to
 * a single hyphen. "Post-Migration Troubleshooting", "post migration troubleshooting" and
 * "post-migration-troubleshooting" therefore resolve to the same calculator.
 *
 * <p>Duplicate names (after normalization) and blank names fail startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CalculatorRegistry {

    private final List<Calculator> calculators;

    private Map<String, Calculator> calculatorsByName;

    @PostConstruct
    void initialize() {
        if (calculators == null || calculators.isEmpty()) {
            log.warn("No Calculator beans found. Registry will be empty.");
            calculatorsByName = Collections.emptyMap();
            return;
        }

        log.info("Discovering {} Calculator bean(s)...", calculators.size());
        calculators.forEach(calculator -> log.info("  - Calculator: {} (name='{}', keys={})",
                calculator.getClass().getSimpleName(), calculator.name(), calculator.keys()));

        Map<String, List<Calculator>> grouped = calculators.stream()
                .peek(CalculatorRegistry::validateCalculator)
                .collect(Collectors.groupingBy(c -> normalizeName(c.name()), LinkedHashMap::new, Collectors.toList()));
        validateNoDuplicates(grouped);

        Map<String, Calculator> byName = new LinkedHashMap<>();
        grouped.forEach((name, list) -> byName.put(name, list.get(0)));
        calculatorsByName = Collections.unmodifiableMap(byName);

        log.info("Successfully registered {} calculator(s): {}", calculatorsByName.size(), calculatorsByName.keySet());
    }

    /**
     * Returns the calculator registered under the given name (case-insensitive).
     *
     * @throws IllegalArgumentException if the name is blank
     * @throws UnknownCalculatorException if no calculator has that name
     */
    public Calculator getCalculator(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Calculator name cannot be null or blank");
        }
        Calculator calculator = calculatorsByName.get(normalizeName(name));
        if (calculator == null) {
            throw new UnknownCalculatorException(String.format(
                    "Unknown calculator: '%s'. Available calculators: %s", name, calculatorsByName.keySet()));
        }
        return calculator;
    }

    /** All registered calculators in discovery order. */
    public List<Calculator> getCalculators() {
        return List.copyOf(calculatorsByName.values());
    }

    private static void validateCalculator(Calculator calculator) {
        String className = calculator.getClass().getName();
        if (calculator.name() == null || calculator.name().isBlank()) {
            throw new IllegalStateException(String.format(
                    "Calculator %s returned blank name(). Name must be non-null and non-blank.", className));
        }
        if (calculator.keys() == null || calculator.keys().isEmpty()) {
            throw new IllegalStateException(String.format(
                    "Calculator %s declares no required keys().", className));
        }
    }

    private static void validateNoDuplicates(Map<String, List<Calculator>> grouped) {
        String detail = grouped.entrySet().stream()
                .filter(entry -> entry.getValue().size() > 1)
                .map(entry -> String.format("'%s' -> [%s]", entry.getKey(), entry.getValue().stream()
                        .map(c -> c.getClass().getName())
                        .collect(Collectors.joining(", "))))
                .collect(Collectors.joining(" ; "));
        if (!detail.isEmpty()) {
            throw new IllegalStateException("Duplicate Calculator name() values detected: " + detail);
        }
    }

    /** Lookup id for a calculator name, e.g. "Storage Migration" -> "storage-migration". */
    public static String normalizeName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        return normalized.replaceAll("^-+|-+$", "");
    }
}
