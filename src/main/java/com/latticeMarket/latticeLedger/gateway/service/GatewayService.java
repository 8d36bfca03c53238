package com.latticeMarket.latticeLedger.gateway.service;

import com.latticeMarket.latticeLedger.gateway.exception.MissingAccountIdException;
import com.latticeMarket.latticeLedger.gateway.exception.RateLimitExceededException;
import com.latticeMarket.latticeLedger.gateway.model.RequestContext;
import com.latticeMarket.latticeLedger.gateway.util.AccountIdMasker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Gateway service - admits write requests into the ledger.
 *
 * Responsibilities:
 * - Extract and validate accountId from header (trusted source)
 * - Attach the request's correlationId
 * - Enforce rate limiting
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {

    private final CorrelationIdService correlationIdService;
    private final RateLimiter rateLimiter;

    /**
     * Builds the context of an authenticated write request.
     *
     * @param accountIdHeader Account ID from HTTP header (trusted)
     * @return request context carrying the caller identity
     * @throws MissingAccountIdException if account ID header is missing
     * @throws RateLimitExceededException if rate limit is exceeded
     */
    public RequestContext admit(String accountIdHeader) {
        String accountId = extractAndValidateAccountId(accountIdHeader);
        String correlationId = correlationIdService.currentCorrelationId();

        validateRateLimit(accountId, correlationId);

        log.debug("Write request admitted - correlationId: {}, accountId: {}",
                correlationId, AccountIdMasker.mask(accountId));
        return RequestContext.builder()
                .accountId(accountId)
                .correlationId(correlationId)
                .receivedAt(Instant.now())
                .build();
    }

    /**
     * Extracts and validates account ID from header.
     *
     * @param accountIdHeader Account ID from HTTP header
     * @return Validated and trimmed account ID
     * @throws MissingAccountIdException if account ID is missing or blank
     */
    private String extractAndValidateAccountId(String accountIdHeader) {
        if (accountIdHeader == null || accountIdHeader.isBlank()) {
            log.error("Missing accountId header");
            throw new MissingAccountIdException("Account ID header is required");
        }
        return accountIdHeader.trim();
    }

    /**
     * Validates rate limit for the account.
     *
     * @throws RateLimitExceededException if rate limit is exceeded
     */
    private void validateRateLimit(String accountId, String correlationId) {
        if (!rateLimiter.isAllowed(accountId)) {
            log.warn("Rate limit exceeded for accountId: {} (correlationId: {})",
                    AccountIdMasker.mask(accountId), correlationId);
            throw new RateLimitExceededException("Rate limit exceeded. Please try again later.");
        }
    }
}
