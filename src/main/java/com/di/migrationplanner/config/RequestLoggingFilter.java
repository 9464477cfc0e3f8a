package com.di.migrationplanner.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Logs one {@code [REQUEST]} line and one {@code [RESPONSE]} line per call, with the request body
 * (truncated) when present. Runs after {@link RequestIdFilter} so every line carries the request ID.
 * Disable with migration-planner.request-logging.enabled=false.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RequestLoggingFilter extends OncePerRequestFilter {

    @Value("${migration-planner.request-logging.enabled:true}")
    private boolean enabled;

    @Value("${migration-planner.request-logging.max-body-length:2048}")
    private int maxBodyLength;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        if (!enabled) {
            filterChain.doFilter(request, response);
            return;
        }
        ContentCachingRequestWrapper wrappedRequest = new ContentCachingRequestWrapper(request, 65536);
        long start = System.nanoTime();
        try {
            filterChain.doFilter(wrappedRequest, response);
        } finally {
            logRequest(wrappedRequest);
            log.info("[RESPONSE] status={} path={} elapsedMs={}", response.getStatus(),
                    request.getRequestURI(), (System.nanoTime() - start) / 1_000_000);
        }
    }

    private void logRequest(ContentCachingRequestWrapper request) {
        String query = request.getQueryString();
        String uri = request.getRequestURI();
        log.info("[REQUEST] {} {}", request.getMethod(), query != null && !query.isBlank() ? uri + "?" + query : uri);
        byte[] buf = request.getContentAsByteArray();
        if (buf.length > 0) {
            String body = new String(buf, StandardCharsets.UTF_8);
            if (body.length() > maxBodyLength) {
                body = body.substring(0, maxBodyLength) + "... [truncated, total " + buf.length + " bytes]";
            }
            log.info("[REQUEST] Body (Content-Type: {}): {}",
                    request.getContentType() != null ? request.getContentType() : "n/a", body);
        }
    }
}
