package com.latticeMarket.latticeLedger.fee.model;

import lombok.Builder;
import lombok.Value;

/**
 * Three-way split of a sale price.
 * {@code platformFee + royalty + sellerAmount == price} always holds.
 */
@Value
@Builder
public class Settlement {

    long price;
    long platformFee;
    long royalty;
    long sellerAmount;
    int platformFeeBps;
    int royaltyBps;
}
