package com.chronofill.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts request, correlation and operator ids into the MDC for the duration of an HTTP call.
 */
@Component
public class RequestCorrelationFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String OPERATOR_ID_HEADER = "X-Operator-Id";

    // matches audit_events.correlation_id
    private static final int MAX_ID_LENGTH = 100;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestId = idOrGenerate(request.getHeader(REQUEST_ID_HEADER));
        String correlationId = idOrDefault(request.getHeader(CORRELATION_ID_HEADER), requestId);
        String operatorId = request.getHeader(OPERATOR_ID_HEADER);

        MDC.put("requestId", requestId);
        MDC.put("correlationId", correlationId);
        if (operatorId != null && !operatorId.isBlank()) {
            MDC.put("operatorId", bounded(operatorId));
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove("requestId");
            MDC.remove("correlationId");
            MDC.remove("operatorId");
        }
    }

    private static String idOrGenerate(String header) {
        return idOrDefault(header, UUID.randomUUID().toString());
    }

    private static String idOrDefault(String header, String fallback) {
        return header == null || header.isBlank() ? fallback : bounded(header);
    }

    private static String bounded(String value) {
        String trimmed = value.trim();
        return trimmed.length() > MAX_ID_LENGTH ? trimmed.substring(0, MAX_ID_LENGTH) : trimmed;
    }
}
