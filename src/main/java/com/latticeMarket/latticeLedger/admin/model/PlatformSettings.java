package com.latticeMarket.latticeLedger.admin.model;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Process-wide marketplace configuration: the platform admin and the fee rate.
 *
 * Held as an explicit bean so separate ledgers can run side by side in tests.
 * Mutated only inside a ledger write; fields are volatile for readers outside one.
 */
@Component
public class PlatformSettings {

    public static final int MAX_PLATFORM_FEE_BPS = 1000;

    private volatile String admin;
    private volatile int platformFeeBps;

    public PlatformSettings(
            @Value("${ledger.admin.initial:deployer}") String initialAdmin,
            @Value("${ledger.platform-fee.initial-bps:250}") int initialFeeBps) {
        if (initialAdmin == null || initialAdmin.isBlank()) {
            throw new IllegalArgumentException("Initial admin is required");
        }
        if (initialFeeBps < 0 || initialFeeBps > MAX_PLATFORM_FEE_BPS) {
            throw new IllegalArgumentException("Initial platform fee out of range: " + initialFeeBps);
        }
        this.admin = initialAdmin.trim();
        this.platformFeeBps = initialFeeBps;
    }

    public String getAdmin() {
        return admin;
    }

    public int getPlatformFeeBps() {
        return platformFeeBps;
    }

    public boolean isAdmin(String account) {
        return admin.equals(account);
    }

    public void setAdmin(String admin) {
        this.admin = admin;
    }

    public void setPlatformFeeBps(int platformFeeBps) {
        this.platformFeeBps = platformFeeBps;
    }
}
