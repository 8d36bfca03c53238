package com.latticeMarket.latticeLedger.token.service;

import com.latticeMarket.latticeLedger.balance.exception.InsufficientFundsException;
import com.latticeMarket.latticeLedger.balance.service.BalanceLedger;
import com.latticeMarket.latticeLedger.collection.model.LatticeCollection;
import com.latticeMarket.latticeLedger.collection.service.CollectionRegistry;
import com.latticeMarket.latticeLedger.gateway.util.AccountIdMasker;
import com.latticeMarket.latticeLedger.ledger.exception.LedgerException;
import com.latticeMarket.latticeLedger.ledger.model.LedgerError;
import com.latticeMarket.latticeLedger.ledger.service.HeightClock;
import com.latticeMarket.latticeLedger.ledger.service.LedgerTransactionManager;
import com.latticeMarket.latticeLedger.marketplace.service.ListingBook;
import com.latticeMarket.latticeLedger.token.model.Token;
import com.latticeMarket.latticeLedger.token.model.TokenId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Token registry - the single source of truth for who owns which token.
 *
 * Responsibilities:
 * - Mint tokens against a collection's supply cap, collecting the mint price
 * - Transfer tokens, dropping any open listing in the same step
 * - Keep the ownership index in step with every owner change
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenRegistry {

    private final LedgerTransactionManager transactions;
    private final CollectionRegistry collectionRegistry;
    private final OwnershipIndex ownershipIndex;
    private final ListingBook listingBook;
    private final BalanceLedger balanceLedger;
    private final HeightClock heightClock;

    private final Map<TokenId, Token> tokens = new HashMap<>();

    /**
     * Mints the next token of a collection to the caller, who pays the mint price to the creator.
     *
     * @param collectionId Collection to mint from
     * @param seed Rendering seed of the new token
     * @param caller Minting account; becomes the owner
     * @return identity of the new token
     * @throws LedgerException COLLECTION_NOT_FOUND, COLLECTION_CLOSED, COLLECTION_LIMIT_REACHED,
     *         INSUFFICIENT_PAYMENT, or INVALID_PARAMETERS when the caller already holds the maximum
     */
    public TokenId mint(long collectionId, long seed, String caller) {
        return transactions.write("mint", () -> {
            LatticeCollection collection = collectionRegistry.requireCollection(collectionId);
            if (!collection.isOpen()) {
                throw new LedgerException(LedgerError.COLLECTION_CLOSED, "Collection " + collectionId + " is closed for minting");
            }
            if (collection.isSoldOut()) {
                throw new LedgerException(LedgerError.COLLECTION_LIMIT_REACHED,
                        "Collection " + collectionId + " has reached its supply of " + collection.getMaxSupply());
            }
            if (balanceLedger.balanceOf(caller) < collection.getMintPrice()) {
                throw new LedgerException(LedgerError.INSUFFICIENT_PAYMENT, "Mint price is " + collection.getMintPrice());
            }
            requireCapacity(caller);

            try {
                balanceLedger.transfer(collection.getMintPrice(), caller, collection.getCreator());
            } catch (InsufficientFundsException e) {
                throw new LedgerException(LedgerError.INSUFFICIENT_PAYMENT, "Mint price is " + collection.getMintPrice(), e);
            }

            long tokenIndex = collectionRegistry.allocateTokenIndex(collectionId);
            TokenId tokenId = TokenId.of(collectionId, tokenIndex);
            tokens.put(tokenId, Token.builder()
                    .id(tokenId)
                    .owner(caller)
                    .seed(seed)
                    .mintedAtHeight(heightClock.currentHeight())
                    .metadataLocator(collection.getMetadataLocator() + "/" + tokenIndex)
                    .build());
            ownershipIndex.add(caller, tokenId);

            log.info("Token minted - tokenId: {}, owner: {}, seed: {}, price: {}",
                    tokenId, AccountIdMasker.mask(caller), seed, collection.getMintPrice());
            return tokenId;
        });
    }

    /**
     * Moves a token from its owner to a recipient on the owner's request.
     *
     * @throws LedgerException NFT_NOT_FOUND, NOT_OWNER, or INVALID_PARAMETERS for a
     *         blank recipient, a transfer to self, or a full recipient
     */
    public void transferNft(long collectionId, long tokenIndex, String recipient, String caller) {
        transactions.run("transferNft", () -> {
            TokenId tokenId = TokenId.of(collectionId, tokenIndex);
            Token token = requireToken(tokenId);
            if (!token.getOwner().equals(caller)) {
                throw new LedgerException(LedgerError.NOT_OWNER, "Caller does not own token " + tokenId);
            }
            if (recipient == null || recipient.isBlank()) {
                throw new LedgerException(LedgerError.INVALID_PARAMETERS, "Recipient is required");
            }
            transfer(tokenId, caller, recipient);
        });
    }

    /**
     * Ownership change shared by direct transfers and marketplace sales.
     * Removes any listing of the token, sets the new owner and updates the
     * ownership index, all inside the caller's ledger write.
     *
     * @throws LedgerException NFT_NOT_FOUND, NOT_OWNER if {@code from} is not the owner,
     *         INVALID_PARAMETERS if {@code to} is the owner or holds the maximum
     */
    public void transfer(TokenId tokenId, String from, String to) {
        if (!transactions.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("Token transfer requires a ledger write transaction");
        }
        Token token = tokens.get(tokenId);
        if (token == null) {
            throw nftNotFound(tokenId);
        }
        if (!token.getOwner().equals(from)) {
            throw new LedgerException(LedgerError.NOT_OWNER, "Account does not own token " + tokenId);
        }
        if (from.equals(to)) {
            throw new LedgerException(LedgerError.INVALID_PARAMETERS, "Token " + tokenId + " already belongs to the recipient");
        }
        requireCapacity(to);

        listingBook.close(tokenId).ifPresent(listing ->
                log.debug("Listing dropped by transfer - tokenId: {}, price: {}", tokenId, listing.getPrice()));
        token.setOwner(to);
        ownershipIndex.remove(from, tokenId);
        ownershipIndex.add(to, tokenId);

        log.info("Token transferred - tokenId: {}, from: {}, to: {}",
                tokenId, AccountIdMasker.mask(from), AccountIdMasker.mask(to));
    }

    public Optional<Token> findToken(TokenId tokenId) {
        return transactions.read(() -> Optional.ofNullable(tokens.get(tokenId))
                .map(token -> token.toBuilder().build()));
    }

    public Optional<String> findOwner(TokenId tokenId) {
        return transactions.read(() -> Optional.ofNullable(tokens.get(tokenId)).map(Token::getOwner));
    }

    /**
     * @return a copy of the token
     * @throws LedgerException NFT_NOT_FOUND
     */
    public Token requireToken(TokenId tokenId) {
        return findToken(tokenId).orElseThrow(() -> nftNotFound(tokenId));
    }

    public List<TokenId> getOwnedTokens(String owner) {
        return transactions.read(() -> ownershipIndex.tokensOf(owner));
    }

    public int getTokenCount() {
        return transactions.read(tokens::size);
    }

    /**
     * @throws LedgerException INVALID_PARAMETERS if the account cannot take another token
     */
    public void requireCapacity(String account) {
        if (!ownershipIndex.hasCapacity(account)) {
            throw new LedgerException(LedgerError.INVALID_PARAMETERS,
                    "Account already holds the maximum of " + ownershipIndex.getMaxTokensPerAccount() + " tokens");
        }
    }

    private static LedgerException nftNotFound(TokenId tokenId) {
        return new LedgerException(LedgerError.NFT_NOT_FOUND, "Token " + tokenId + " does not exist");
    }
}
