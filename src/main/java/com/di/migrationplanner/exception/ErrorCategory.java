package com.di.migrationplanner.exception;

import com.di.migrationplanner.estimation.EstimationException;
import com.di.migrationplanner.estimation.UnknownCalculatorException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for API error responses and logging.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    ESTIMATION_ERROR("Estimation error", "Calculator rejected the supplied parameters"),
    NOT_FOUND("Not found", "Requested calculator or resource does not exist"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    SERIALIZATION_ERROR("Serialization error", "Request body could not be read or parsed"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof EstimationException, ESTIMATION_ERROR);
        MATCHERS.put(t -> t instanceof UnknownCalculatorException, NOT_FOUND);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof org.springframework.web.bind.MethodArgumentNotValidException
                || t instanceof org.springframework.web.bind.MissingServletRequestParameterException
                || t instanceof org.springframework.web.HttpMediaTypeNotSupportedException;
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof org.springframework.http.converter.HttpMessageNotReadableException
                || t instanceof com.fasterxml.jackson.core.JsonProcessingException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof IllegalStateException
                || t instanceof org.springframework.beans.factory.BeanCreationException;
    }

    @Override
    public String toString() {
        return name();
    }
}
