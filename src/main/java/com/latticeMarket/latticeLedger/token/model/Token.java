package com.latticeMarket.latticeLedger.token.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A minted token. Instances handed out by the registry are copies.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Token {

    private TokenId id;
    private String owner;

    /**
     * Combined with the collection's lattice parameters to render this token.
     */
    private long seed;

    private long mintedAtHeight;
    private String metadataLocator;
}
