package com.di.migrationplanner.exception;

import com.di.migrationplanner.config.RequestIdFilter;
import com.di.migrationplanner.estimation.EstimationException;
import com.di.migrationplanner.estimation.UnknownCalculatorException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps exceptions escaping the controllers to a consistent {@link ErrorResponse} body.
 *
 * <ul>
 *   <li>{@link EstimationException} → 400 with error kind and offending parameter</li>
 *   <li>{@link UnknownCalculatorException} → 404</li>
 *   <li>unreadable or invalid body, unsupported media type, {@link IllegalArgumentException} → 400</li>
 *   <li>anything else → 500</li>
 * </ul>
 * Every body carries the request ID from the MDC so clients can quote it in bug reports.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EstimationException.class)
    public ResponseEntity<ErrorResponse> handleEstimationException(EstimationException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.warn("Estimation failed: {} [{} / parameter={}]", e.getMessage(), e.getError(), e.getParameter());
        ErrorResponse body = buildErrorResponse(category, e, HttpStatus.BAD_REQUEST);
        body.addDetail("errorKind", e.getError().name());
        body.addDetail("errorKindDescription", e.getError().getDescription());
        if (e.getParameter() != null) {
            body.addDetail("parameter", e.getParameter());
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(UnknownCalculatorException.class)
    public ResponseEntity<ErrorResponse> handleUnknownCalculator(UnknownCalculatorException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.warn("{}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(buildErrorResponse(category, e, HttpStatus.NOT_FOUND));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class,
            MethodArgumentNotValidException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.warn("Bad request: {} [{}]", e.getMessage(), category.getName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(buildErrorResponse(category, e, HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.error("GlobalExceptionHandler caught exception: {} [{}]",
                e.getClass().getSimpleName(), category.getName(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR));
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        String path = MDC.get(RequestIdFilter.MDC_REQUEST_PATH);
        response.setPath(path != null ? path : "/unknown");
        response.setRequestId(MDC.get(RequestIdFilter.MDC_REQUEST_ID));
        response.addDetail("exceptionType", exception.getClass().getName());
        return response;
    }

    /**
     * Structured error response for API endpoints.
     */
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String path;
        private String requestId;
        private Map<String, Object> details = new HashMap<>();

        public String getTimestamp() {
            return timestamp;
        }

        public void setTimestamp(String timestamp) {
            this.timestamp = timestamp;
        }

        public int getStatus() {
            return status;
        }

        public void setStatus(int status) {
            this.status = status;
        }

        public String getError() {
            return error;
        }

        public void setError(String error) {
            this.error = error;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }

        public String getErrorCategory() {
            return errorCategory;
        }

        public void setErrorCategory(String errorCategory) {
            this.errorCategory = errorCategory;
        }

        public String getErrorCategoryName() {
            return errorCategoryName;
        }

        public void setErrorCategoryName(String errorCategoryName) {
            this.errorCategoryName = errorCategoryName;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getRequestId() {
            return requestId;
        }

        public void setRequestId(String requestId) {
            this.requestId = requestId;
        }

        public Map<String, Object> getDetails() {
            return details;
        }

        public void setDetails(Map<String, Object> details) {
            this.details = details;
        }

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
