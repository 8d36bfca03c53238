package com.latticeMarket.latticeLedger.gateway.filter;

import com.latticeMarket.latticeLedger.gateway.service.CorrelationIdService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.regex.Pattern;

/**
 * Assigns every API request a correlation id, exposes it in the
 * X-Correlation-ID response header and in the logging MDC.
 * A client-supplied X-Correlation-ID is reused when it is 1 to 64 letters,
 * digits or hyphens; anything else is replaced with a generated id.
 */
@Component
@RequiredArgsConstructor
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private static final Pattern VALID_CORRELATION_ID = Pattern.compile("[A-Za-z0-9-]{1,64}");

    private final CorrelationIdService correlationIdService;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || !VALID_CORRELATION_ID.matcher(correlationId).matches()) {
            correlationId = correlationIdService.generateCorrelationId();
        }
        MDC.put(CorrelationIdService.MDC_KEY, correlationId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(CorrelationIdService.MDC_KEY);
        }
    }
}
