package com.latticeMarket.latticeLedger.token.controller;

import com.latticeMarket.latticeLedger.token.model.TokenId;
import com.latticeMarket.latticeLedger.token.service.TokenRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/accounts")
@RequiredArgsConstructor
public class OwnedTokensController {

    private final TokenRegistry tokenRegistry;

    /**
     * Tokens held by an account, in acquisition order. Unknown accounts hold nothing.
     */
    @GetMapping("/{account}/nfts")
    public ResponseEntity<List<TokenId>> getOwnedNfts(@PathVariable String account) {
        return ResponseEntity.ok(tokenRegistry.getOwnedTokens(account));
    }
}
