package com.di.migrationplanner.estimation;

/**
 * Thrown by {@link Calculator#calculate} when no estimate can be produced.
 *
 * <p>Caught by {@link com.di.migrationplanner.exception.GlobalExceptionHandler}
 * and returned as a 400 Bad Request with the error kind and offending parameter.
 */
public class EstimationException extends RuntimeException {

    private final EstimationError error;
    private final String parameter;

    public EstimationException(EstimationError error, String parameter, String message) {
        super(message);
        this.error = error;
        this.parameter = parameter;
    }

    public static EstimationException missing(String parameter) {
        return new EstimationException(EstimationError.MISSING_PARAMETER, parameter, "missing " + parameter);
    }

    public static EstimationException invalidType(String parameter, Object value) {
        String type = value == null ? "null" : value.getClass().getSimpleName();
        return new EstimationException(EstimationError.INVALID_TYPE, parameter,
                String.format("%s must be a number, got %s (%s)", parameter, value, type));
    }

    public static EstimationException outOfRange(String parameter, String message) {
        return new EstimationException(EstimationError.OUT_OF_RANGE, parameter, message);
    }

    public EstimationError getError() {
        return error;
    }

    public String getParameter() {
        return parameter;
    }
}
