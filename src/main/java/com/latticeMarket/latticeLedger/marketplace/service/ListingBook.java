package com.latticeMarket.latticeLedger.marketplace.service;

import com.latticeMarket.latticeLedger.marketplace.model.Listing;
import com.latticeMarket.latticeLedger.token.model.TokenId;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Open listings keyed by token. At most one listing per token.
 *
 * Shared by the marketplace and the token registry, which drops a token's
 * listing whenever the token changes hands. Callers hold the ledger lock.
 */
@Service
public class ListingBook {

    private final Map<TokenId, Listing> listings = new HashMap<>();

    public Optional<Listing> find(TokenId tokenId) {
        return Optional.ofNullable(listings.get(tokenId));
    }

    public boolean contains(TokenId tokenId) {
        return listings.containsKey(tokenId);
    }

    /**
     * @throws IllegalStateException if the token is already listed
     */
    public void open(Listing listing) {
        if (listings.putIfAbsent(listing.getTokenId(), listing) != null) {
            throw new IllegalStateException("Token " + listing.getTokenId() + " is already listed");
        }
    }

    /**
     * @return the removed listing, if there was one
     */
    public Optional<Listing> close(TokenId tokenId) {
        return Optional.ofNullable(listings.remove(tokenId));
    }

    public int size() {
        return listings.size();
    }
}
