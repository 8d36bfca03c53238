package com.latticeMarket.latticeLedger.gateway.service;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Service for generating and tracking correlation IDs for request tracking.
 * The current request's id lives in the SLF4J MDC so every log line carries it.
 */
@Service
public class CorrelationIdService {

    public static final String MDC_KEY = "correlationId";

    /**
     * Generates a unique correlation ID for request tracking.
     *
     * @return A UUID-based correlation ID
     */
    public String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * @return the correlation id of the request being served, or a fresh one outside a request
     */
    public String currentCorrelationId() {
        String correlationId = MDC.get(MDC_KEY);
        return correlationId != null ? correlationId : generateCorrelationId();
    }
}
