package com.latticeMarket.latticeLedger.ledger.exception;

import com.latticeMarket.latticeLedger.ledger.model.LedgerError;

/**
 * Exception thrown when a ledger operation is rejected.
 * The operation that threw it has left no trace in ledger state.
 */
public class LedgerException extends RuntimeException {

    private final LedgerError error;

    public LedgerException(LedgerError error, String message) {
        super(message);
        this.error = error;
    }

    public LedgerException(LedgerError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public LedgerError getError() {
        return error;
    }
}
