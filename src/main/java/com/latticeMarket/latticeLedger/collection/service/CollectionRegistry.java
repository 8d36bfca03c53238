package com.latticeMarket.latticeLedger.collection.service;

import com.latticeMarket.latticeLedger.collection.model.CollectionDraft;
import com.latticeMarket.latticeLedger.collection.model.ExtraParam;
import com.latticeMarket.latticeLedger.collection.model.LatticeCollection;
import com.latticeMarket.latticeLedger.collection.model.LatticeConnection;
import com.latticeMarket.latticeLedger.collection.model.LatticeParameters;
import com.latticeMarket.latticeLedger.gateway.util.AccountIdMasker;
import com.latticeMarket.latticeLedger.ledger.exception.LedgerException;
import com.latticeMarket.latticeLedger.ledger.model.LedgerError;
import com.latticeMarket.latticeLedger.ledger.service.HeightClock;
import com.latticeMarket.latticeLedger.ledger.service.LedgerTransactionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collection registry - owns collection records and their open/closed state.
 *
 * Responsibilities:
 * - Validate and create collections, with their lattice parameters, in one step
 * - Assign sequential collection ids starting at 1
 * - Let creators open and close minting
 * - Allocate token indexes against the supply cap
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CollectionRegistry {

    public static final int MAX_ROYALTY_BPS = 3000;
    public static final int MAX_NAME_LENGTH = 64;
    public static final int MAX_DESCRIPTION_LENGTH = 256;
    public static final int MAX_LOCATOR_LENGTH = 256;
    public static final int MAX_COLOR_SCHEME_LENGTH = 32;
    public static final int MAX_CONNECTIONS = 100;
    public static final int MAX_TRANSFORMATIONS = 20;
    public static final int MAX_TRANSFORMATION_LENGTH = 64;
    public static final int MAX_EXTRA_PARAMS = 20;
    public static final int MAX_EXTRA_PARAM_KEY_LENGTH = 32;
    public static final int MAX_EXTRA_PARAM_VALUE_LENGTH = 64;

    private final LedgerTransactionManager transactions;
    private final LatticeParameterStore latticeParameterStore;
    private final HeightClock heightClock;

    private final Map<Long, LatticeCollection> collections = new HashMap<>();
    private long lastCollectionId;

    /**
     * Creates a collection, open for minting with no tokens, and stores its lattice parameters.
     *
     * @param creator Creating account; receives mint payments and royalties
     * @param draft Collection terms and lattice parameters
     * @return the new collection id
     * @throws LedgerException INVALID_PARAMETERS or INVALID_ROYALTY
     */
    public long createCollection(String creator, CollectionDraft draft) {
        return transactions.write("createCollection", () -> {
            validate(draft);

            long collectionId = lastCollectionId + 1;
            LatticeCollection collection = LatticeCollection.builder()
                    .id(collectionId)
                    .creator(creator)
                    .name(draft.getName())
                    .description(nullToEmpty(draft.getDescription()))
                    .maxSupply(draft.getMaxSupply())
                    .currentSupply(0)
                    .mintPrice(draft.getMintPrice())
                    .royaltyBps(draft.getRoyaltyBps())
                    .isOpen(true)
                    .createdAtHeight(heightClock.currentHeight())
                    .metadataLocator(draft.getMetadataLocator())
                    .build();

            LatticeParameters lattice = draft.getLattice();
            latticeParameterStore.store(LatticeParameters.builder()
                    .collectionId(collectionId)
                    .dimensions(lattice.getDimensions())
                    .nodeCount(lattice.getNodeCount())
                    .connections(copyOf(lattice.getConnections()))
                    .colorScheme(nullToEmpty(lattice.getColorScheme()))
                    .transformations(copyOf(lattice.getTransformations()))
                    .extraParams(copyOf(lattice.getExtraParams()))
                    .build());
            collections.put(collectionId, collection);
            lastCollectionId = collectionId;

            log.info("Collection created - collectionId: {}, creator: {}, maxSupply: {}, mintPrice: {}, royaltyBps: {}",
                    collectionId, AccountIdMasker.mask(creator), collection.getMaxSupply(),
                    collection.getMintPrice(), collection.getRoyaltyBps());
            return collectionId;
        });
    }

    /**
     * Opens or closes minting. Only the creator may do so.
     *
     * @throws LedgerException COLLECTION_NOT_FOUND or NOT_AUTHORIZED
     */
    public void setCollectionStatus(long collectionId, boolean isOpen, String caller) {
        transactions.run("setCollectionStatus", () -> {
            LatticeCollection collection = collections.get(collectionId);
            if (collection == null) {
                throw notFound(collectionId);
            }
            if (!collection.getCreator().equals(caller)) {
                throw new LedgerException(LedgerError.NOT_AUTHORIZED, "Only the collection creator can change its status");
            }
            collection.setOpen(isOpen);
            log.info("Collection status changed - collectionId: {}, isOpen: {}", collectionId, isOpen);
        });
    }

    public Optional<LatticeCollection> findCollection(long collectionId) {
        return transactions.read(() -> Optional.ofNullable(collections.get(collectionId))
                .map(collection -> collection.toBuilder().build()));
    }

    public Optional<LatticeParameters> findLatticeParameters(long collectionId) {
        return transactions.read(() -> latticeParameterStore.find(collectionId));
    }

    public long getCollectionsCount() {
        return transactions.read(() -> lastCollectionId);
    }

    /**
     * Lookup for use inside another ledger operation.
     *
     * @return a copy of the collection
     * @throws LedgerException COLLECTION_NOT_FOUND
     */
    public LatticeCollection requireCollection(long collectionId) {
        return findCollection(collectionId).orElseThrow(() -> notFound(collectionId));
    }

    /**
     * Reserves the next token index: checks the cap and increments the supply in one step.
     * Must run inside a ledger write, after every other precondition of the mint has passed.
     *
     * @return the allocated index, equal to the new current supply
     * @throws LedgerException COLLECTION_NOT_FOUND or COLLECTION_LIMIT_REACHED
     */
    public long allocateTokenIndex(long collectionId) {
        requireWriteTransaction();
        LatticeCollection collection = collections.get(collectionId);
        if (collection == null) {
            throw notFound(collectionId);
        }
        if (collection.isSoldOut()) {
            throw new LedgerException(LedgerError.COLLECTION_LIMIT_REACHED,
                    "Collection " + collectionId + " has reached its supply of " + collection.getMaxSupply());
        }
        long tokenIndex = collection.getCurrentSupply() + 1;
        collection.setCurrentSupply(tokenIndex);
        return tokenIndex;
    }

    private void requireWriteTransaction() {
        if (!transactions.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("Token index allocation requires a ledger write transaction");
        }
    }

    private static void validate(CollectionDraft draft) {
        if (draft.getMaxSupply() <= 0) {
            throw invalid("maxSupply must be positive");
        }
        if (draft.getRoyaltyBps() < 0 || draft.getRoyaltyBps() > MAX_ROYALTY_BPS) {
            throw new LedgerException(LedgerError.INVALID_ROYALTY,
                    "royaltyBps must be between 0 and " + MAX_ROYALTY_BPS);
        }
        LatticeParameters lattice = draft.getLattice();
        if (lattice == null) {
            throw invalid("lattice parameters are required");
        }
        if (lattice.getDimensions() < 1) {
            throw invalid("dimensions must be at least 1");
        }
        if (lattice.getNodeCount() < 2) {
            throw invalid("nodeCount must be at least 2");
        }
        if (draft.getMintPrice() < 0) {
            throw invalid("mintPrice cannot be negative");
        }
        requireText(draft.getName(), "name", true, MAX_NAME_LENGTH);
        requireText(draft.getDescription(), "description", false, MAX_DESCRIPTION_LENGTH);
        requireText(draft.getMetadataLocator(), "metadataLocator", true, MAX_LOCATOR_LENGTH);
        requireText(lattice.getColorScheme(), "colorScheme", false, MAX_COLOR_SCHEME_LENGTH);

        List<LatticeConnection> connections = copyOf(lattice.getConnections());
        if (connections.size() > MAX_CONNECTIONS) {
            throw invalid("at most " + MAX_CONNECTIONS + " connections are allowed");
        }
        for (LatticeConnection connection : connections) {
            if (!isNode(connection.from(), lattice.getNodeCount())
                    || !isNode(connection.to(), lattice.getNodeCount())
                    || connection.weight() < 0) {
                throw invalid("connection " + connection + " does not fit a lattice of " + lattice.getNodeCount() + " nodes");
            }
        }

        List<String> transformations = copyOf(lattice.getTransformations());
        if (transformations.size() > MAX_TRANSFORMATIONS) {
            throw invalid("at most " + MAX_TRANSFORMATIONS + " transformations are allowed");
        }
        for (String transformation : transformations) {
            requireText(transformation, "transformation", true, MAX_TRANSFORMATION_LENGTH);
        }

        List<ExtraParam> extraParams = copyOf(lattice.getExtraParams());
        if (extraParams.size() > MAX_EXTRA_PARAMS) {
            throw invalid("at most " + MAX_EXTRA_PARAMS + " extra params are allowed");
        }
        for (ExtraParam param : extraParams) {
            requireText(param.key(), "extra param key", true, MAX_EXTRA_PARAM_KEY_LENGTH);
            requireText(param.value(), "extra param value", false, MAX_EXTRA_PARAM_VALUE_LENGTH);
        }
    }

    private static boolean isNode(int index, int nodeCount) {
        return index >= 0 && index < nodeCount;
    }

    private static void requireText(String value, String field, boolean required, int maxLength) {
        if (required && (value == null || value.isBlank())) {
            throw invalid(field + " is required");
        }
        if (value != null && value.length() > maxLength) {
            throw invalid(field + " exceeds " + maxLength + " characters");
        }
    }

    private static <T> List<T> copyOf(List<T> values) {
        if (values == null) {
            return List.of();
        }
        for (T value : values) {
            if (value == null) {
                throw invalid("lists cannot contain null entries");
            }
        }
        return List.copyOf(values);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static LedgerException invalid(String message) {
        return new LedgerException(LedgerError.INVALID_PARAMETERS, message);
    }

    private static LedgerException notFound(long collectionId) {
        return new LedgerException(LedgerError.COLLECTION_NOT_FOUND, "Collection " + collectionId + " does not exist");
    }
}
