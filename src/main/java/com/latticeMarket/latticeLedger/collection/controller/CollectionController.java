package com.latticeMarket.latticeLedger.collection.controller;

import com.latticeMarket.latticeLedger.collection.dto.CollectionStatusRequest;
import com.latticeMarket.latticeLedger.collection.dto.CreateCollectionRequest;
import com.latticeMarket.latticeLedger.collection.dto.CreateCollectionResponse;
import com.latticeMarket.latticeLedger.collection.model.CollectionDraft;
import com.latticeMarket.latticeLedger.collection.model.LatticeCollection;
import com.latticeMarket.latticeLedger.collection.model.LatticeParameters;
import com.latticeMarket.latticeLedger.collection.service.CollectionRegistry;
import com.latticeMarket.latticeLedger.gateway.model.RequestContext;
import com.latticeMarket.latticeLedger.gateway.service.GatewayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Collection REST controller - thin HTTP layer over the collection registry.
 */
@RestController
@RequestMapping("/api/v1/collections")
@RequiredArgsConstructor
public class CollectionController {

    private static final String ACCOUNT_ID_HEADER = "X-Account-ID";

    private final GatewayService gatewayService;
    private final CollectionRegistry collectionRegistry;

    @PostMapping
    public ResponseEntity<CreateCollectionResponse> createCollection(
            @Valid @RequestBody CreateCollectionRequest request,
            @RequestHeader(value = ACCOUNT_ID_HEADER, required = false) String accountIdHeader) {

        RequestContext context = gatewayService.admit(accountIdHeader);
        long collectionId = collectionRegistry.createCollection(context.getAccountId(), toDraft(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(new CreateCollectionResponse(collectionId));
    }

    @GetMapping("/count")
    public ResponseEntity<Map<String, Long>> getCollectionsCount() {
        return ResponseEntity.ok(Map.of("count", collectionRegistry.getCollectionsCount()));
    }

    @GetMapping("/{collectionId}")
    public ResponseEntity<LatticeCollection> getCollection(@PathVariable long collectionId) {
        return ResponseEntity.of(collectionRegistry.findCollection(collectionId));
    }

    @GetMapping("/{collectionId}/lattice")
    public ResponseEntity<LatticeParameters> getLatticeParameters(@PathVariable long collectionId) {
        return ResponseEntity.of(collectionRegistry.findLatticeParameters(collectionId));
    }

    @PutMapping("/{collectionId}/status")
    public ResponseEntity<Map<String, String>> setCollectionStatus(
            @PathVariable long collectionId,
            @Valid @RequestBody CollectionStatusRequest request,
            @RequestHeader(value = ACCOUNT_ID_HEADER, required = false) String accountIdHeader) {

        RequestContext context = gatewayService.admit(accountIdHeader);
        collectionRegistry.setCollectionStatus(collectionId, request.getIsOpen(), context.getAccountId());
        return ResponseEntity.ok(Map.of("status", "success"));
    }

    private static CollectionDraft toDraft(CreateCollectionRequest request) {
        return CollectionDraft.builder()
                .name(request.getName())
                .description(request.getDescription())
                .maxSupply(request.getMaxSupply())
                .mintPrice(request.getMintPrice())
                .royaltyBps(request.getRoyaltyBps())
                .metadataLocator(request.getMetadataLocator())
                .lattice(LatticeParameters.builder()
                        .dimensions(request.getDimensions())
                        .nodeCount(request.getNodeCount())
                        .connections(request.getConnections())
                        .colorScheme(request.getColorScheme())
                        .transformations(request.getTransformations())
                        .extraParams(request.getExtraParams())
                        .build())
                .build();
    }
}
