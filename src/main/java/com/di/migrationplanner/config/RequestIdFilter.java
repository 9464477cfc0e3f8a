package com.di.migrationplanner.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.UUID;

/**
 * Assigns one correlation ID to every HTTP request.
 * <p>
 * If the client sent {@value #REQUEST_ID_HEADER}, its value is reused as-is; otherwise a random
 * UUID is generated. The ID is then:
 * <ul>
 *   <li>written to the {@value #REQUEST_ID_HEADER} response header (before the handler runs, so it
 *       is present even if the handler commits the response early)</li>
 *   <li>stored as a request attribute, readable via {@link #getRequestId(ServletRequest)}</li>
 *   <li>put in the MDC as {@code requestId} (with {@code requestPath}) for log correlation</li>
 * </ul>
 * MDC keys are removed in {@code finally} so pooled threads do not leak them into the next request.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_ATTRIBUTE = RequestIdFilter.class.getName() + ".requestId";

    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_REQUEST_PATH = "requestPath";

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        String path = request.getRequestURI();

        request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        MDC.put(MDC_REQUEST_ID, requestId);
        MDC.put(MDC_REQUEST_PATH, path != null ? path : "");
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_REQUEST_PATH);
        }
    }

    /**
     * Returns the correlation ID assigned to this request, or null when the filter did not run.
     */
    public static String getRequestId(ServletRequest request) {
        Object value = request.getAttribute(REQUEST_ID_ATTRIBUTE);
        return value instanceof String ? (String) value : null;
    }
}
