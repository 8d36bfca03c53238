package com.latticeMarket.latticeLedger.token.service;

import com.latticeMarket.latticeLedger.token.model.TokenId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-account set of owned tokens, derived from {@code Token.owner}.
 *
 * Sets keep acquisition order for listing and give constant-time add, remove
 * and membership. Only {@link TokenRegistry} mutates the index, always in the
 * same ledger write that changes the owner.
 */
@Service
public class OwnershipIndex {

    private final int maxTokensPerAccount;
    private final Map<String, Set<TokenId>> tokensByOwner = new HashMap<>();

    public OwnershipIndex(@Value("${ledger.ownership.max-tokens-per-account:1000}") int maxTokensPerAccount) {
        if (maxTokensPerAccount < 1) {
            throw new IllegalArgumentException("maxTokensPerAccount must be positive: " + maxTokensPerAccount);
        }
        this.maxTokensPerAccount = maxTokensPerAccount;
    }

    /**
     * @throws IllegalStateException if the entry already exists or the account is full
     */
    void add(String owner, TokenId tokenId) {
        Set<TokenId> owned = tokensByOwner.computeIfAbsent(owner, k -> new LinkedHashSet<>());
        if (owned.size() >= maxTokensPerAccount) {
            throw new IllegalStateException("Ownership index full for account");
        }
        if (!owned.add(tokenId)) {
            throw new IllegalStateException("Ownership index already lists token " + tokenId);
        }
    }

    /**
     * @throws IllegalStateException if the entry does not exist
     */
    void remove(String owner, TokenId tokenId) {
        Set<TokenId> owned = tokensByOwner.get(owner);
        if (owned == null || !owned.remove(tokenId)) {
            throw new IllegalStateException("Ownership index does not list token " + tokenId);
        }
        if (owned.isEmpty()) {
            tokensByOwner.remove(owner);
        }
    }

    public boolean contains(String owner, TokenId tokenId) {
        Set<TokenId> owned = tokensByOwner.get(owner);
        return owned != null && owned.contains(tokenId);
    }

    public boolean hasCapacity(String owner) {
        return count(owner) < maxTokensPerAccount;
    }

    public int count(String owner) {
        Set<TokenId> owned = tokensByOwner.get(owner);
        return owned == null ? 0 : owned.size();
    }

    /**
     * @return the account's tokens in acquisition order; empty for unknown accounts
     */
    public List<TokenId> tokensOf(String owner) {
        Set<TokenId> owned = tokensByOwner.get(owner);
        return owned == null ? List.of() : List.copyOf(owned);
    }

    public int getMaxTokensPerAccount() {
        return maxTokensPerAccount;
    }
}
