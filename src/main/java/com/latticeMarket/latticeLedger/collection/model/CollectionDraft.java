package com.latticeMarket.latticeLedger.collection.model;

import lombok.Builder;
import lombok.Value;

/**
 * Everything a creator supplies to open a new collection.
 * The lattice's collection id is ignored; the registry assigns it.
 */
@Value
@Builder
public class CollectionDraft {

    String name;
    String description;
    long maxSupply;
    long mintPrice;
    int royaltyBps;
    String metadataLocator;
    LatticeParameters lattice;
}
