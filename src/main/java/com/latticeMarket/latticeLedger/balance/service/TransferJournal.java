package com.latticeMarket.latticeLedger.balance.service;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Records the transfers of one multi-party payment so they can be reversed
 * if a later leg fails.
 */
@Slf4j
public class TransferJournal {

    private final BalanceLedger balanceLedger;
    private final Deque<Leg> completed = new ArrayDeque<>();

    public TransferJournal(BalanceLedger balanceLedger) {
        this.balanceLedger = balanceLedger;
    }

    public void transfer(long amount, String from, String to) {
        balanceLedger.transfer(amount, from, to);
        completed.push(new Leg(amount, from, to));
    }

    /**
     * Reverses every completed leg, newest first.
     *
     * @throws IllegalStateException if a reversal fails; balances are then inconsistent
     */
    public void rollback() {
        while (!completed.isEmpty()) {
            Leg leg = completed.pop();
            try {
                balanceLedger.transfer(leg.amount(), leg.to(), leg.from());
            } catch (RuntimeException e) {
                log.error("Failed to reverse transfer - amount: {}, legsRemaining: {}", leg.amount(), completed.size(), e);
                throw new IllegalStateException("Payment rollback failed", e);
            }
        }
    }

    public int size() {
        return completed.size();
    }

    private record Leg(long amount, String from, String to) {}
}
