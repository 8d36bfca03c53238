package com.latticeMarket.latticeLedger.balance.service;

import com.latticeMarket.latticeLedger.balance.exception.InsufficientFundsException;

/**
 * Value-transfer primitive that moves the payment currency between accounts.
 * Synchronous and fail-fast: a transfer either completes or throws.
 */
public interface BalanceLedger {

    /**
     * @param account Account identity
     * @return available balance, zero for unknown accounts
     */
    long balanceOf(String account);

    /**
     * Moves {@code amount} from {@code from} to {@code to}.
     *
     * @throws InsufficientFundsException if {@code from} holds less than {@code amount}
     * @throws IllegalArgumentException if {@code amount} is negative
     */
    void transfer(long amount, String from, String to);
}
