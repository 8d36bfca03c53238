package com.latticeMarket.latticeLedger.balance.exception;

/**
 * Exception thrown when a value transfer exceeds the sender's available balance.
 */
public class InsufficientFundsException extends RuntimeException {

    private final String account;
    private final long requested;
    private final long available;

    public InsufficientFundsException(String account, long requested, long available) {
        super("Insufficient funds: requested " + requested + ", available " + available);
        this.account = account;
        this.requested = requested;
        this.available = available;
    }

    public String getAccount() {
        return account;
    }

    public long getRequested() {
        return requested;
    }

    public long getAvailable() {
        return available;
    }
}
