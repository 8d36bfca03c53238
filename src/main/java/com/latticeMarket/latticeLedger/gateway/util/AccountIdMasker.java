package com.latticeMarket.latticeLedger.gateway.util;

/**
 * Masks account identities before they reach the logs.
 */
public class AccountIdMasker {

    /**
     * Shows first 2 and last 2 characters, masks the middle.
     *
     * @param accountId The account ID to mask
     * @return Masked account ID (e.g., "SP****7Q"), or "****" for short or null ids
     */
    public static String mask(String accountId) {
        if (accountId == null || accountId.length() <= 4) {
            return "****";
        }
        return accountId.substring(0, 2) + "****" + accountId.substring(accountId.length() - 2);
    }
}
