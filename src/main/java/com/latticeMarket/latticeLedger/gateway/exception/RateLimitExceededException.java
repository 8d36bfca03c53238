package com.latticeMarket.latticeLedger.gateway.exception;

/**
 * Exception thrown when an account sends more write requests than its rate limit allows.
 */
public class RateLimitExceededException extends RuntimeException {

    public RateLimitExceededException(String message) {
        super(message);
    }
}
