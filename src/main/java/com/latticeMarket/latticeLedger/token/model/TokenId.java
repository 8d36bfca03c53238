package com.latticeMarket.latticeLedger.token.model;

import lombok.Value;

/**
 * Identity of a token: its collection and its 1-based index within the collection.
 */
@Value
public class TokenId {

    long collectionId;
    long tokenIndex;

    public static TokenId of(long collectionId, long tokenIndex) {
        return new TokenId(collectionId, tokenIndex);
    }

    @Override
    public String toString() {
        return collectionId + "#" + tokenIndex;
    }
}
