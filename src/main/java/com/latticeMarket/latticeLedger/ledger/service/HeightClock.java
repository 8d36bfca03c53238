package com.latticeMarket.latticeLedger.ledger.service;

/**
 * Monotonically increasing height counter used to timestamp ledger records.
 */
public interface HeightClock {

    /**
     * @return the height at which the operation in progress commits
     */
    long currentHeight();

    /**
     * Moves to the next height. Called once per committed write.
     *
     * @return the new height
     */
    long advance();
}
