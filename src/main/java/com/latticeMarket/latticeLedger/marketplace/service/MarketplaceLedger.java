package com.latticeMarket.latticeLedger.marketplace.service;

import com.latticeMarket.latticeLedger.balance.service.BalanceLedger;
import com.latticeMarket.latticeLedger.balance.service.TransferJournal;
import com.latticeMarket.latticeLedger.collection.model.LatticeCollection;
import com.latticeMarket.latticeLedger.collection.service.CollectionRegistry;
import com.latticeMarket.latticeLedger.fee.model.Settlement;
import com.latticeMarket.latticeLedger.fee.service.FeeEngine;
import com.latticeMarket.latticeLedger.gateway.util.AccountIdMasker;
import com.latticeMarket.latticeLedger.ledger.exception.LedgerException;
import com.latticeMarket.latticeLedger.ledger.model.LedgerError;
import com.latticeMarket.latticeLedger.ledger.service.HeightClock;
import com.latticeMarket.latticeLedger.ledger.service.LedgerTransactionManager;
import com.latticeMarket.latticeLedger.marketplace.model.Listing;
import com.latticeMarket.latticeLedger.token.model.Token;
import com.latticeMarket.latticeLedger.token.model.TokenId;
import com.latticeMarket.latticeLedger.token.service.TokenRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Marketplace ledger - fixed-price listings and their settlement.
 *
 * A sale is one ledger write: payment split and ownership change either both
 * happen or neither does.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketplaceLedger {

    private final LedgerTransactionManager transactions;
    private final ListingBook listingBook;
    private final TokenRegistry tokenRegistry;
    private final CollectionRegistry collectionRegistry;
    private final FeeEngine feeEngine;
    private final BalanceLedger balanceLedger;
    private final HeightClock heightClock;

    /**
     * Offers a token for sale.
     *
     * @throws LedgerException NFT_NOT_FOUND, NOT_OWNER, INVALID_PARAMETERS, LISTING_EXISTS
     */
    public Listing list(TokenId tokenId, long price, String caller) {
        return transactions.write("listForSale", () -> {
            Token token = tokenRegistry.requireToken(tokenId);
            if (!token.getOwner().equals(caller)) {
                throw new LedgerException(LedgerError.NOT_OWNER, "Caller does not own token " + tokenId);
            }
            if (price <= 0 || price > FeeEngine.MAX_SETTLEMENT_AMOUNT) {
                throw new LedgerException(LedgerError.INVALID_PARAMETERS,
                        "Price must be between 1 and " + FeeEngine.MAX_SETTLEMENT_AMOUNT);
            }
            if (listingBook.contains(tokenId)) {
                throw new LedgerException(LedgerError.LISTING_EXISTS, "Token " + tokenId + " is already listed");
            }
            Listing listing = Listing.builder()
                    .tokenId(tokenId)
                    .seller(caller)
                    .price(price)
                    .listedAtHeight(heightClock.currentHeight())
                    .build();
            listingBook.open(listing);
            log.info("Token listed - tokenId: {}, seller: {}, price: {}", tokenId, AccountIdMasker.mask(caller), price);
            return listing;
        });
    }

    /**
     * Withdraws a listing. Cancelling twice fails the second time.
     *
     * @throws LedgerException LISTING_NOT_FOUND, NOT_AUTHORIZED
     */
    public void cancel(TokenId tokenId, String caller) {
        transactions.run("cancelListing", () -> {
            Listing listing = requireListing(tokenId);
            if (!listing.getSeller().equals(caller)) {
                throw new LedgerException(LedgerError.NOT_AUTHORIZED, "Only the seller can cancel the listing of " + tokenId);
            }
            listingBook.close(tokenId);
            log.info("Listing cancelled - tokenId: {}, seller: {}", tokenId, AccountIdMasker.mask(caller));
        });
    }

    /**
     * Buys a listed token at its listed price.
     *
     * @return the payment split
     * @throws LedgerException LISTING_NOT_FOUND, COLLECTION_NOT_FOUND, NFT_NOT_FOUND,
     *         NOT_AUTHORIZED (buying from oneself), INSUFFICIENT_PAYMENT, or
     *         INVALID_PARAMETERS when the buyer already holds the maximum
     */
    public Settlement buy(TokenId tokenId, String caller) {
        return transactions.write("buyNft", () -> {
            Listing listing = requireListing(tokenId);
            LatticeCollection collection = collectionRegistry.requireCollection(tokenId.getCollectionId());
            tokenRegistry.requireToken(tokenId);
            if (listing.getSeller().equals(caller)) {
                throw new LedgerException(LedgerError.NOT_AUTHORIZED, "Seller cannot buy its own listing");
            }
            if (balanceLedger.balanceOf(caller) < listing.getPrice()) {
                throw new LedgerException(LedgerError.INSUFFICIENT_PAYMENT, "Listing price is " + listing.getPrice());
            }
            tokenRegistry.requireCapacity(caller);

            TransferJournal journal = new TransferJournal(balanceLedger);
            Settlement settlement = feeEngine.settle(journal, listing.getPrice(), caller, listing.getSeller(),
                    collection.getCreator(), collection.getRoyaltyBps());
            try {
                tokenRegistry.transfer(tokenId, listing.getSeller(), caller);
            } catch (RuntimeException e) {
                log.error("Ownership change failed after payment - tokenId: {}, reversing {} transfers", tokenId, journal.size(), e);
                journal.rollback();
                throw e;
            }

            log.info("Token sold - tokenId: {}, seller: {}, buyer: {}, price: {}, fee: {}, royalty: {}, sellerAmount: {}",
                    tokenId, AccountIdMasker.mask(listing.getSeller()), AccountIdMasker.mask(caller),
                    settlement.getPrice(), settlement.getPlatformFee(), settlement.getRoyalty(), settlement.getSellerAmount());
            return settlement;
        });
    }

    public Optional<Listing> findListing(TokenId tokenId) {
        return transactions.read(() -> listingBook.find(tokenId));
    }

    public int getListingCount() {
        return transactions.read(listingBook::size);
    }

    private Listing requireListing(TokenId tokenId) {
        return listingBook.find(tokenId).orElseThrow(() ->
                new LedgerException(LedgerError.LISTING_NOT_FOUND, "Token " + tokenId + " is not listed"));
    }
}
