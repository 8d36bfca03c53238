package com.latticeMarket.latticeLedger.ledger.service;

import com.latticeMarket.latticeLedger.ledger.exception.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Transaction boundary for the whole ledger.
 *
 * Writes are serialized globally: every settlement reads the platform fee rate,
 * so a single writer at a time is the only granularity that keeps each call
 * atomic with respect to every other call. Reads share the lock and never see
 * a write in progress.
 *
 * Nested calls are allowed (the lock is reentrant). Only the outermost write
 * advances the height clock, and only when it commits.
 */
@Slf4j
@Component
public class LedgerTransactionManager {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final HeightClock heightClock;

    public LedgerTransactionManager(HeightClock heightClock) {
        this.heightClock = heightClock;
    }

    /**
     * Runs a state-mutating operation as one indivisible step.
     *
     * @param operation Operation name, for logging
     * @param work Operation body; must check all preconditions before mutating
     * @return the operation's result
     * @throws LedgerException if the operation was rejected
     */
    public <T> T write(String operation, Supplier<T> work) {
        ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            T result = work.get();
            if (writeLock.getHoldCount() == 1) {
                long height = heightClock.advance();
                log.debug("Committed {} - next height: {}", operation, height);
            }
            return result;
        } catch (LedgerException e) {
            if (writeLock.getHoldCount() == 1) {
                log.warn("Rejected {} - error: {}, reason: {}", operation, e.getError(), e.getMessage());
            }
            throw e;
        } finally {
            writeLock.unlock();
        }
    }

    public void run(String operation, Runnable work) {
        write(operation, () -> {
            work.run();
            return null;
        });
    }

    /**
     * Runs a side-effect-free lookup against a consistent snapshot of ledger state.
     */
    public <T> T read(Supplier<T> work) {
        ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
        readLock.lock();
        try {
            return work.get();
        } finally {
            readLock.unlock();
        }
    }

    public boolean isWriteLockedByCurrentThread() {
        return lock.isWriteLockedByCurrentThread();
    }
}
