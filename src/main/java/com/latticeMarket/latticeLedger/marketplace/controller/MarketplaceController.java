package com.latticeMarket.latticeLedger.marketplace.controller;

import com.latticeMarket.latticeLedger.fee.model.Settlement;
import com.latticeMarket.latticeLedger.gateway.model.RequestContext;
import com.latticeMarket.latticeLedger.gateway.service.GatewayService;
import com.latticeMarket.latticeLedger.marketplace.dto.ListingRequest;
import com.latticeMarket.latticeLedger.marketplace.model.Listing;
import com.latticeMarket.latticeLedger.marketplace.service.MarketplaceLedger;
import com.latticeMarket.latticeLedger.token.model.TokenId;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Marketplace REST controller - listing lifecycle and purchases.
 */
@RestController
@RequestMapping("/api/v1/listings/{collectionId}/{tokenIndex}")
@RequiredArgsConstructor
public class MarketplaceController {

    private static final String ACCOUNT_ID_HEADER = "X-Account-ID";

    private final GatewayService gatewayService;
    private final MarketplaceLedger marketplaceLedger;

    @PostMapping
    public ResponseEntity<Listing> listForSale(
            @PathVariable long collectionId,
            @PathVariable long tokenIndex,
            @Valid @RequestBody ListingRequest request,
            @RequestHeader(value = ACCOUNT_ID_HEADER, required = false) String accountIdHeader) {

        RequestContext context = gatewayService.admit(accountIdHeader);
        Listing listing = marketplaceLedger.list(TokenId.of(collectionId, tokenIndex), request.getPrice(), context.getAccountId());
        return ResponseEntity.status(HttpStatus.CREATED).body(listing);
    }

    @DeleteMapping
    public ResponseEntity<Map<String, String>> cancelListing(
            @PathVariable long collectionId,
            @PathVariable long tokenIndex,
            @RequestHeader(value = ACCOUNT_ID_HEADER, required = false) String accountIdHeader) {

        RequestContext context = gatewayService.admit(accountIdHeader);
        marketplaceLedger.cancel(TokenId.of(collectionId, tokenIndex), context.getAccountId());
        return ResponseEntity.ok(Map.of("status", "success"));
    }

    @GetMapping
    public ResponseEntity<Listing> getListing(@PathVariable long collectionId, @PathVariable long tokenIndex) {
        return ResponseEntity.of(marketplaceLedger.findListing(TokenId.of(collectionId, tokenIndex)));
    }

    @PostMapping("/purchase")
    public ResponseEntity<Settlement> buyNft(
            @PathVariable long collectionId,
            @PathVariable long tokenIndex,
            @RequestHeader(value = ACCOUNT_ID_HEADER, required = false) String accountIdHeader) {

        RequestContext context = gatewayService.admit(accountIdHeader);
        Settlement settlement = marketplaceLedger.buy(TokenId.of(collectionId, tokenIndex), context.getAccountId());
        return ResponseEntity.ok(settlement);
    }
}
