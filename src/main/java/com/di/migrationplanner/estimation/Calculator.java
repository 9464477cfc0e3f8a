package com.di.migrationplanner.estimation;

import java.util.List;
import java.util.Map;

/**
 * A configured, reusable estimator for one migration stage.
 * Implementations are immutable after construction and safe to call from many threads.
 */
public interface Calculator {

    /** Stable, human-readable name, e.g. "Storage Migration". */
    String name();

    /** Parameter keys without which no estimate can be produced. Never empty. */
    List<String> keys();

    /**
     * Computes the estimate from the given parameters. Keys the calculator does not know are ignored.
     *
     * @throws EstimationException if a required parameter is missing, not numeric, or out of range
     */
    Estimation calculate(Map<String, Param> params);
}
