package com.latticeMarket.latticeLedger.ledger.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process height clock starting at 1.
 */
@Component
public class SequentialHeightClock implements HeightClock {

    private final AtomicLong height = new AtomicLong(1);

    @Override
    public long currentHeight() {
        return height.get();
    }

    @Override
    public long advance() {
        return height.incrementAndGet();
    }
}
