package com.latticeMarket.latticeLedger.ledger.model;

import org.springframework.http.HttpStatus;

/**
 * Rejection kinds reported by ledger operations.
 * Every kind is a precondition failure detected before any state is touched.
 */
public enum LedgerError {

    NOT_AUTHORIZED(HttpStatus.FORBIDDEN),
    COLLECTION_NOT_FOUND(HttpStatus.NOT_FOUND),
    COLLECTION_CLOSED(HttpStatus.CONFLICT),
    COLLECTION_LIMIT_REACHED(HttpStatus.CONFLICT),
    INVALID_PARAMETERS(HttpStatus.BAD_REQUEST),
    INVALID_ROYALTY(HttpStatus.BAD_REQUEST),
    INSUFFICIENT_PAYMENT(HttpStatus.PAYMENT_REQUIRED),
    NFT_NOT_FOUND(HttpStatus.NOT_FOUND),
    NOT_OWNER(HttpStatus.FORBIDDEN),
    LISTING_EXISTS(HttpStatus.CONFLICT),
    LISTING_NOT_FOUND(HttpStatus.NOT_FOUND);

    private final HttpStatus httpStatus;

    LedgerError(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
