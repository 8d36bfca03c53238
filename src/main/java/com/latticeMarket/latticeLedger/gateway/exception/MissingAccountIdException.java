package com.latticeMarket.latticeLedger.gateway.exception;

/**
 * Exception thrown when the account identity header is missing.
 */
public class MissingAccountIdException extends RuntimeException {

    public MissingAccountIdException(String message) {
        super(message);
    }
}
