package com.latticeMarket.latticeLedger.admin.service;

import com.latticeMarket.latticeLedger.admin.dto.PlatformSettingsResponse;
import com.latticeMarket.latticeLedger.admin.model.PlatformSettings;
import com.latticeMarket.latticeLedger.gateway.util.AccountIdMasker;
import com.latticeMarket.latticeLedger.ledger.exception.LedgerException;
import com.latticeMarket.latticeLedger.ledger.model.LedgerError;
import com.latticeMarket.latticeLedger.ledger.service.LedgerTransactionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Admin operations over the platform settings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminService {

    private final PlatformSettings settings;
    private final LedgerTransactionManager transactions;

    /**
     * @throws LedgerException NOT_AUTHORIZED if caller is not the admin,
     *         INVALID_PARAMETERS if the rate is negative or above 1000 bps
     */
    public void setPlatformFeeBps(int newFeeBps, String caller) {
        transactions.run("setPlatformFeeBps", () -> {
            requireAdmin(caller);
            if (newFeeBps < 0 || newFeeBps > PlatformSettings.MAX_PLATFORM_FEE_BPS) {
                throw new LedgerException(LedgerError.INVALID_PARAMETERS,
                        "Platform fee must be between 0 and " + PlatformSettings.MAX_PLATFORM_FEE_BPS + " bps");
            }
            int previous = settings.getPlatformFeeBps();
            settings.setPlatformFeeBps(newFeeBps);
            log.info("Platform fee changed - from: {} bps, to: {} bps", previous, newFeeBps);
        });
    }

    /**
     * Hands the admin role to another account. The caller loses it immediately.
     */
    public void setAdmin(String newAdmin, String caller) {
        transactions.run("setAdmin", () -> {
            requireAdmin(caller);
            if (newAdmin == null || newAdmin.isBlank()) {
                throw new LedgerException(LedgerError.INVALID_PARAMETERS, "New admin is required");
            }
            settings.setAdmin(newAdmin.trim());
            log.info("Platform admin changed - from: {}, to: {}",
                    AccountIdMasker.mask(caller), AccountIdMasker.mask(newAdmin));
        });
    }

    public PlatformSettingsResponse getSettings() {
        return transactions.read(() -> PlatformSettingsResponse.builder()
                .admin(settings.getAdmin())
                .platformFeeBps(settings.getPlatformFeeBps())
                .build());
    }

    private void requireAdmin(String caller) {
        if (!settings.isAdmin(caller)) {
            throw new LedgerException(LedgerError.NOT_AUTHORIZED, "Caller is not the platform admin");
        }
    }
}
