package com.latticeMarket.latticeLedger.admin.controller;

import com.latticeMarket.latticeLedger.admin.dto.AdminChangeRequest;
import com.latticeMarket.latticeLedger.admin.dto.PlatformFeeRequest;
import com.latticeMarket.latticeLedger.admin.dto.PlatformSettingsResponse;
import com.latticeMarket.latticeLedger.admin.service.AdminService;
import com.latticeMarket.latticeLedger.gateway.model.RequestContext;
import com.latticeMarket.latticeLedger.gateway.service.GatewayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Admin REST controller - platform fee and admin handover.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminController {

    private static final String ACCOUNT_ID_HEADER = "X-Account-ID";

    private final GatewayService gatewayService;
    private final AdminService adminService;

    @GetMapping("/settings")
    public ResponseEntity<PlatformSettingsResponse> getSettings() {
        return ResponseEntity.ok(adminService.getSettings());
    }

    @PutMapping("/platform-fee")
    public ResponseEntity<Map<String, String>> setPlatformFeeBps(
            @Valid @RequestBody PlatformFeeRequest request,
            @RequestHeader(value = ACCOUNT_ID_HEADER, required = false) String accountIdHeader) {

        RequestContext context = gatewayService.admit(accountIdHeader);
        adminService.setPlatformFeeBps(request.getFeeBps(), context.getAccountId());
        return ResponseEntity.ok(Map.of("status", "success"));
    }

    @PutMapping("/admin")
    public ResponseEntity<Map<String, String>> setAdmin(
            @Valid @RequestBody AdminChangeRequest request,
            @RequestHeader(value = ACCOUNT_ID_HEADER, required = false) String accountIdHeader) {

        RequestContext context = gatewayService.admit(accountIdHeader);
        adminService.setAdmin(request.getNewAdmin(), context.getAccountId());
        return ResponseEntity.ok(Map.of("status", "success"));
    }
}
