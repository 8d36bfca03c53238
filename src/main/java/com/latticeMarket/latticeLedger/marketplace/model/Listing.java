package com.latticeMarket.latticeLedger.marketplace.model;

import com.latticeMarket.latticeLedger.token.model.TokenId;
import lombok.Builder;
import lombok.Value;

/**
 * A seller's open offer to sell one token at a fixed price.
 */
@Value
@Builder
public class Listing {

    TokenId tokenId;
    String seller;
    long price;
    long listedAtHeight;
}
