package com.di.migrationplanner.estimation;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Numeric coercion for calculator parameters. Every type error a calculator reports originates here.
 *
 * <p>Accepted values are any {@link Number} with a finite double value (Integer, Long, Double,
 * BigDecimal as produced by Jackson, ...). Strings, booleans, null and NaN/infinite numbers are
 * rejected with {@link EstimationError#INVALID_TYPE}; numeric strings are not parsed.
 */
public final class ParamValues {

    private ParamValues() {}

    /**
     * Returns the numeric value of a required parameter.
     *
     * @throws EstimationException MISSING_PARAMETER if absent, INVALID_TYPE if not numeric
     */
    public static double requireDouble(Map<String, Param> params, String key) {
        Param param = params == null ? null : params.get(key);
        if (param == null) {
            throw EstimationException.missing(key);
        }
        return toDouble(param);
    }

    /**
     * Same as {@link #requireDouble} and additionally rejects negative values.
     */
    public static double requireNonNegative(Map<String, Param> params, String key) {
        double value = requireDouble(params, key);
        if (value < 0) {
            throw EstimationException.outOfRange(key, key + " must be non-negative, got " + value);
        }
        return value;
    }

    /**
     * Returns the numeric value of an optional parameter, or empty when the key is absent.
     * A present but non-numeric value is still an error.
     */
    public static OptionalDouble optionalDouble(Map<String, Param> params, String key) {
        Param param = params == null ? null : params.get(key);
        if (param == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(toDouble(param));
    }

    public static double toDouble(Param param) {
        Object value = param.getValue();
        if (!(value instanceof Number)) {
            throw EstimationException.invalidType(param.getKey(), value);
        }
        double d = ((Number) value).doubleValue();
        if (!Double.isFinite(d)) {
            throw EstimationException.invalidType(param.getKey(), value);
        }
        return d;
    }

    /**
     * Interprets a double as a whole count (e.g. engineers). 4.0 is accepted, 4.5 is not.
     */
    public static int toWholeCount(String key, double value) {
        if (value != Math.rint(value)) {
            throw EstimationException.outOfRange(key, key + " must be a whole number, got " + value);
        }
        if (value > Integer.MAX_VALUE) {
            throw EstimationException.outOfRange(key, key + " exceeds maximum of " + Integer.MAX_VALUE + ", got " + value);
        }
        if (value < Integer.MIN_VALUE) {
            throw EstimationException.outOfRange(key, key + " is below minimum of " + Integer.MIN_VALUE + ", got " + value);
        }
        return (int) value;
    }
}
