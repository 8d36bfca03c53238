package com.latticeMarket.latticeLedger.token.service;

import com.latticeMarket.latticeLedger.LedgerFixture;
import com.latticeMarket.latticeLedger.balance.service.InMemoryBalanceLedger;
import com.latticeMarket.latticeLedger.ledger.exception.LedgerException;
import com.latticeMarket.latticeLedger.ledger.model.LedgerError;
import com.latticeMarket.latticeLedger.token.model.Token;
import com.latticeMarket.latticeLedger.token.model.TokenId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.latticeMarket.latticeLedger.LedgerAssertions.assertRejected;
import static com.latticeMarket.latticeLedger.LedgerFixture.ALICE;
import static com.latticeMarket.latticeLedger.LedgerFixture.BOB;
import static com.latticeMarket.latticeLedger.LedgerFixture.CAROL;
import static com.latticeMarket.latticeLedger.LedgerFixture.CREATOR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TokenRegistryTest {

    private LedgerFixture ledger;
    private TokenRegistry tokens;

    @BeforeEach
    void setUp() {
        ledger = new LedgerFixture();
        tokens = ledger.tokens;
        ledger.fund(ALICE, 10_000);
        ledger.fund(BOB, 10_000);
    }

    @Test
    void mintAssignsSequentialIndexesUpToTheCap() {
        long id = ledger.createCollection(3, 100, 500);

        assertThat(tokens.mint(id, 11, ALICE)).isEqualTo(TokenId.of(id, 1));
        assertThat(tokens.mint(id, 22, BOB)).isEqualTo(TokenId.of(id, 2));
        assertThat(tokens.mint(id, 33, ALICE)).isEqualTo(TokenId.of(id, 3));
        assertRejected(() -> tokens.mint(id, 44, BOB), LedgerError.COLLECTION_LIMIT_REACHED);

        assertThat(ledger.collections.findCollection(id).orElseThrow().getCurrentSupply()).isEqualTo(3);
        assertThat(ledger.balances.balanceOf(BOB)).isEqualTo(9_900);
        assertThat(tokens.getTokenCount()).isEqualTo(3);
    }

    @Test
    void mintRecordsTheTokenAndPaysTheCreator() {
        long id = ledger.createCollection(10, 250, 0);
        long height = ledger.clock.currentHeight();

        TokenId tokenId = tokens.mint(id, 424242, ALICE);

        Token token = tokens.findToken(tokenId).orElseThrow();
        assertThat(token.getOwner()).isEqualTo(ALICE);
        assertThat(token.getSeed()).isEqualTo(424242);
        assertThat(token.getMintedAtHeight()).isEqualTo(height);
        assertThat(token.getMetadataLocator()).isEqualTo("ipfs://lattice/crystal/1");
        assertThat(tokens.findOwner(tokenId)).contains(ALICE);
        assertThat(tokens.getOwnedTokens(ALICE)).containsExactly(tokenId);
        assertThat(ledger.balances.balanceOf(ALICE)).isEqualTo(9_750);
        assertThat(ledger.balances.balanceOf(CREATOR)).isEqualTo(250);
    }

    @Test
    void mintFromMissingCollectionFails() {
        assertRejected(() -> tokens.mint(5, 1, ALICE), LedgerError.COLLECTION_NOT_FOUND);
    }

    @Test
    void mintFromClosedCollectionFails() {
        long id = ledger.createCollection(10, 0, 0);
        ledger.collections.setCollectionStatus(id, false, CREATOR);

        assertRejected(() -> tokens.mint(id, 1, ALICE), LedgerError.COLLECTION_CLOSED);

        ledger.collections.setCollectionStatus(id, true, CREATOR);
        assertThat(tokens.mint(id, 1, ALICE)).isEqualTo(TokenId.of(id, 1));
    }

    @Test
    void mintWithoutFundsLeavesNoTrace() {
        long id = ledger.createCollection(10, 500, 0);

        assertRejected(() -> tokens.mint(id, 1, CAROL), LedgerError.INSUFFICIENT_PAYMENT);

        assertThat(ledger.collections.findCollection(id).orElseThrow().getCurrentSupply()).isZero();
        assertThat(tokens.getOwnedTokens(CAROL)).isEmpty();
        assertThat(ledger.balances.balanceOf(CREATOR)).isZero();
        assertThat(tokens.mint(id, 1, ALICE)).isEqualTo(TokenId.of(id, 1));
    }

    @Test
    void freeMintNeedsNoFunds() {
        long id = ledger.createCollection(10, 0, 0);

        assertThat(tokens.mint(id, 1, CAROL)).isEqualTo(TokenId.of(id, 1));
    }

    @Test
    void mintIsRefusedWhenTheMinterHoldsTheMaximum() {
        LedgerFixture small = new LedgerFixture(new InMemoryBalanceLedger(), 250, 2);
        long id = small.createCollection(10, 0, 0);
        small.tokens.mint(id, 1, ALICE);
        small.tokens.mint(id, 2, ALICE);

        assertRejected(() -> small.tokens.mint(id, 3, ALICE), LedgerError.INVALID_PARAMETERS);
        assertThat(small.collections.findCollection(id).orElseThrow().getCurrentSupply()).isEqualTo(2);
    }

    @Test
    void ownerTransfersDirectly() {
        long id = ledger.createCollection(10, 0, 0);
        TokenId tokenId = tokens.mint(id, 1, ALICE);

        tokens.transferNft(id, 1, BOB, ALICE);

        assertThat(tokens.findOwner(tokenId)).contains(BOB);
        assertThat(tokens.getOwnedTokens(ALICE)).isEmpty();
        assertThat(tokens.getOwnedTokens(BOB)).containsExactly(tokenId);
    }

    @Test
    void nonOwnerTransferChangesNothing() {
        long id = ledger.createCollection(10, 0, 0);
        TokenId tokenId = tokens.mint(id, 1, ALICE);
        long height = ledger.clock.currentHeight();

        assertRejected(() -> tokens.transferNft(id, 1, BOB, BOB), LedgerError.NOT_OWNER);

        assertThat(tokens.findOwner(tokenId)).contains(ALICE);
        assertThat(tokens.getOwnedTokens(ALICE)).containsExactly(tokenId);
        assertThat(tokens.getOwnedTokens(BOB)).isEmpty();
        assertThat(ledger.clock.currentHeight()).isEqualTo(height);
    }

    @Test
    void transferOfMissingTokenFails() {
        long id = ledger.createCollection(10, 0, 0);

        assertRejected(() -> tokens.transferNft(id, 1, BOB, ALICE), LedgerError.NFT_NOT_FOUND);
    }

    @Test
    void transferToSelfOrNobodyIsInvalid() {
        long id = ledger.createCollection(10, 0, 0);
        tokens.mint(id, 1, ALICE);

        assertRejected(() -> tokens.transferNft(id, 1, ALICE, ALICE), LedgerError.INVALID_PARAMETERS);
        assertRejected(() -> tokens.transferNft(id, 1, " ", ALICE), LedgerError.INVALID_PARAMETERS);
    }

    @Test
    void transferDropsTheListing() {
        long id = ledger.createCollection(10, 0, 0);
        TokenId tokenId = tokens.mint(id, 1, ALICE);
        ledger.marketplace.list(tokenId, 1000, ALICE);

        tokens.transferNft(id, 1, BOB, ALICE);

        assertThat(ledger.marketplace.findListing(tokenId)).isEmpty();
    }

    @Test
    void transferPrimitiveRequiresAWriteTransaction() {
        long id = ledger.createCollection(10, 0, 0);
        TokenId tokenId = tokens.mint(id, 1, ALICE);

        assertThatThrownBy(() -> tokens.transfer(tokenId, ALICE, BOB)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void readsOfMissingTokensAreEmpty() {
        assertThat(tokens.findToken(TokenId.of(1, 1))).isEmpty();
        assertThat(tokens.findOwner(TokenId.of(1, 1))).isEmpty();
        assertThat(tokens.getOwnedTokens(ALICE)).isEmpty();
    }

    @Test
    void concurrentMintsNeverShareAnIndex() throws Exception {
        int minters = 8;
        int mintsPerMinter = 50;
        long supply = 300;
        long id = ledger.createCollection(supply, 0, 0);

        ExecutorService executor = Executors.newFixedThreadPool(minters);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<TokenId>>> futures = new ArrayList<>();
        for (int m = 0; m < minters; m++) {
            String minter = "SP-MINTER-" + m;
            futures.add(executor.submit(() -> {
                start.await();
                List<TokenId> minted = new ArrayList<>();
                for (int i = 0; i < mintsPerMinter; i++) {
                    try {
                        minted.add(tokens.mint(id, i, minter));
                    } catch (LedgerException e) {
                        assertThat(e.getError()).isEqualTo(LedgerError.COLLECTION_LIMIT_REACHED);
                    }
                }
                return minted;
            }));
        }
        start.countDown();

        List<TokenId> all = Collections.synchronizedList(new ArrayList<>());
        for (Future<List<TokenId>> future : futures) {
            all.addAll(future.get(30, TimeUnit.SECONDS));
        }
        executor.shutdown();

        assertThat(all).hasSize((int) supply).doesNotHaveDuplicates();
        assertThat(all).extracting(TokenId::getTokenIndex).allMatch(index -> index >= 1 && index <= supply);
        assertThat(ledger.collections.findCollection(id).orElseThrow().getCurrentSupply()).isEqualTo(supply);
    }
}
