package com.latticeMarket.latticeLedger.gateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request context passed from the gateway to the ledger services.
 * Contains the trusted account id from the header and the correlation id for tracking.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RequestContext {

    /**
     * Account ID extracted from HTTP header (trusted source).
     * This is the caller identity for every ledger authorization check.
     */
    private String accountId;

    /**
     * Correlation ID for request tracking and audit.
     */
    private String correlationId;

    /**
     * Timestamp when request was received at the gateway.
     */
    private Instant receivedAt;
}
