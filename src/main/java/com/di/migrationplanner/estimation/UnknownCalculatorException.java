package com.di.migrationplanner.estimation;

/**
 * No calculator is registered under the requested name. Returned as 404 Not Found.
 */
public class UnknownCalculatorException extends IllegalArgumentException {

    public UnknownCalculatorException(String message) {
        super(message);
    }
}
