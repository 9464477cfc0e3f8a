package com.di.migrationplanner.estimation;

/**
 * Why a calculator refused to produce an estimate.
 */
public enum EstimationError {

    MISSING_PARAMETER("Missing parameter", "A required parameter was not supplied"),
    INVALID_TYPE("Invalid parameter type", "Parameter value is not a usable number"),
    OUT_OF_RANGE("Parameter out of range", "Parameter value is outside the valid domain");

    private final String name;
    private final String description;

    EstimationError(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }
}
