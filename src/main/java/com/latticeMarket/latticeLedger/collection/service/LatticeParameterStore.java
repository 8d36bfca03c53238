package com.latticeMarket.latticeLedger.collection.service;

import com.latticeMarket.latticeLedger.collection.model.LatticeParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Write-once store of lattice parameters, one entry per collection.
 * There is no update or delete: tokens are minted against these parameters.
 *
 * Callers hold the ledger lock; the store does no locking of its own.
 */
@Slf4j
@Service
public class LatticeParameterStore {

    private final Map<Long, LatticeParameters> parameters = new HashMap<>();

    /**
     * @throws IllegalStateException if parameters were already stored for the collection
     */
    void store(LatticeParameters lattice) {
        LatticeParameters previous = parameters.putIfAbsent(lattice.getCollectionId(), lattice);
        if (previous != null) {
            throw new IllegalStateException("Lattice parameters already stored for collection " + lattice.getCollectionId());
        }
        log.debug("Stored lattice parameters - collectionId: {}, dimensions: {}, nodeCount: {}, connections: {}",
                lattice.getCollectionId(), lattice.getDimensions(), lattice.getNodeCount(), lattice.getConnections().size());
    }

    public Optional<LatticeParameters> find(long collectionId) {
        return Optional.ofNullable(parameters.get(collectionId));
    }
}
