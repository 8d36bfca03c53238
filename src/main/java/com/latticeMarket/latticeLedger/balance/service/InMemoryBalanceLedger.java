package com.latticeMarket.latticeLedger.balance.service;

import com.latticeMarket.latticeLedger.balance.exception.InsufficientFundsException;
import com.latticeMarket.latticeLedger.gateway.util.AccountIdMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Balance ledger kept in process memory.
 *
 * Zero-amount transfers and transfers to self are accepted and change nothing.
 */
@Slf4j
@Service
public class InMemoryBalanceLedger implements BalanceLedger {

    private final Map<String, Long> balances = new HashMap<>();

    @Override
    public synchronized long balanceOf(String account) {
        return balances.getOrDefault(account, 0L);
    }

    @Override
    public synchronized void transfer(long amount, String from, String to) {
        if (amount < 0) {
            throw new IllegalArgumentException("Transfer amount must not be negative: " + amount);
        }
        long available = balanceOf(from);
        if (available < amount) {
            throw new InsufficientFundsException(from, amount, available);
        }
        if (amount == 0 || from.equals(to)) {
            return;
        }
        balances.put(from, available - amount);
        balances.merge(to, amount, Math::addExact);
        log.debug("Balance transfer - amount: {}, from: {}, to: {}",
                amount, AccountIdMasker.mask(from), AccountIdMasker.mask(to));
    }

    /**
     * Adds funds to an account out of thin air. Used to seed opening balances.
     */
    public synchronized void credit(String account, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Credit amount must not be negative: " + amount);
        }
        balances.merge(account, amount, Math::addExact);
    }

    public synchronized int accountCount() {
        return balances.size();
    }
}
