package com.latticeMarket.latticeLedger.balance.controller;

import com.latticeMarket.latticeLedger.balance.dto.BalanceResponse;
import com.latticeMarket.latticeLedger.balance.service.BalanceLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the payment currency balances.
 */
@RestController
@RequestMapping("/api/v1/accounts")
@RequiredArgsConstructor
public class BalanceController {

    private final BalanceLedger balanceLedger;

    @GetMapping("/{account}/balance")
    public ResponseEntity<BalanceResponse> balance(@PathVariable String account) {
        return ResponseEntity.ok(new BalanceResponse(account, balanceLedger.balanceOf(account)));
    }
}
