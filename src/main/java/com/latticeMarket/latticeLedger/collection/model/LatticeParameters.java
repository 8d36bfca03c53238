package com.latticeMarket.latticeLedger.collection.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Structural description shared by every token of a collection.
 * Together with a token's seed it fully determines the token's rendering,
 * so it never changes once the collection exists.
 */
@Value
@Builder(toBuilder = true)
public class LatticeParameters {

    long collectionId;
    int dimensions;
    int nodeCount;
    List<LatticeConnection> connections;
    String colorScheme;
    List<String> transformations;
    List<ExtraParam> extraParams;
}
