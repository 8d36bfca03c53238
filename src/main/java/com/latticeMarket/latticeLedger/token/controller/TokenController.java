package com.latticeMarket.latticeLedger.token.controller;

import com.latticeMarket.latticeLedger.gateway.model.RequestContext;
import com.latticeMarket.latticeLedger.gateway.service.GatewayService;
import com.latticeMarket.latticeLedger.token.dto.MintRequest;
import com.latticeMarket.latticeLedger.token.dto.OwnerResponse;
import com.latticeMarket.latticeLedger.token.dto.TransferRequest;
import com.latticeMarket.latticeLedger.token.model.Token;
import com.latticeMarket.latticeLedger.token.model.TokenId;
import com.latticeMarket.latticeLedger.token.service.TokenRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Token REST controller - minting, lookups and direct transfers.
 */
@RestController
@RequestMapping("/api/v1/collections/{collectionId}/tokens")
@RequiredArgsConstructor
public class TokenController {

    private static final String ACCOUNT_ID_HEADER = "X-Account-ID";

    private final GatewayService gatewayService;
    private final TokenRegistry tokenRegistry;

    @PostMapping
    public ResponseEntity<TokenId> mint(
            @PathVariable long collectionId,
            @Valid @RequestBody MintRequest request,
            @RequestHeader(value = ACCOUNT_ID_HEADER, required = false) String accountIdHeader) {

        RequestContext context = gatewayService.admit(accountIdHeader);
        TokenId tokenId = tokenRegistry.mint(collectionId, request.getSeed(), context.getAccountId());
        return ResponseEntity.status(HttpStatus.CREATED).body(tokenId);
    }

    @GetMapping("/{tokenIndex}")
    public ResponseEntity<Token> getNft(@PathVariable long collectionId, @PathVariable long tokenIndex) {
        return ResponseEntity.of(tokenRegistry.findToken(TokenId.of(collectionId, tokenIndex)));
    }

    @GetMapping("/{tokenIndex}/owner")
    public ResponseEntity<OwnerResponse> getNftOwner(@PathVariable long collectionId, @PathVariable long tokenIndex) {
        return ResponseEntity.of(tokenRegistry.findOwner(TokenId.of(collectionId, tokenIndex)).map(OwnerResponse::new));
    }

    @PostMapping("/{tokenIndex}/transfer")
    public ResponseEntity<Map<String, String>> transferNft(
            @PathVariable long collectionId,
            @PathVariable long tokenIndex,
            @Valid @RequestBody TransferRequest request,
            @RequestHeader(value = ACCOUNT_ID_HEADER, required = false) String accountIdHeader) {

        RequestContext context = gatewayService.admit(accountIdHeader);
        tokenRegistry.transferNft(collectionId, tokenIndex, request.getRecipient().trim(), context.getAccountId());
        return ResponseEntity.ok(Map.of("status", "success"));
    }
}
