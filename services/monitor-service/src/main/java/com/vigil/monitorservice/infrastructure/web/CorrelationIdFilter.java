package com.vigil.monitorservice.infrastructure.web;

import com.vigil.observability.CorrelationContext;
import com.vigil.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Gives every request a correlation ID, taken from {@code X-Correlation-ID} when the caller sends
 * a usable one.
 *
 * <p>The ID is installed in {@link CorrelationContextHolder} for the request thread, copied by the
 * batch coordinator onto its workers and echoed in the response header. Header values that are too
 * long or contain characters outside {@code [A-Za-z0-9._:-]} are replaced, since they end up in
 * log lines.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String correlationId = resolve(request.getHeader(CORRELATION_ID_HEADER));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        CorrelationContextHolder.set(CorrelationContext.of(correlationId));
        try {
            chain.doFilter(request, response);
        } finally {
            // request threads are pooled
            CorrelationContextHolder.clear();
        }
    }

    static String resolve(String headerValue) {
        if (headerValue != null && ACCEPTED_ID.matcher(headerValue.trim()).matches()) {
            return headerValue.trim();
        }
        return UUID.randomUUID().toString();
    }
}
