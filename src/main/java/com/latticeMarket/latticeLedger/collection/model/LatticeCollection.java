package com.latticeMarket.latticeLedger.collection.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A named, capped series of lattice tokens with shared royalty terms.
 * Instances handed out by the registry are copies.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class LatticeCollection {

    private long id;
    private String creator;
    private String name;
    private String description;
    private long maxSupply;

    /**
     * Number of tokens minted so far; also the index of the newest token.
     */
    private long currentSupply;

    private long mintPrice;
    private int royaltyBps;
    private boolean isOpen;
    private long createdAtHeight;

    /**
     * Base locator; token locators append "/" and the token index.
     */
    private String metadataLocator;

    @JsonProperty("isOpen")
    public boolean isOpen() {
        return isOpen;
    }

    @JsonIgnore
    public boolean isSoldOut() {
        return currentSupply >= maxSupply;
    }
}
