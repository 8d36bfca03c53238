package com.latticeMarket.latticeLedger.fee.service;

import com.latticeMarket.latticeLedger.admin.model.PlatformSettings;
import com.latticeMarket.latticeLedger.balance.exception.InsufficientFundsException;
import com.latticeMarket.latticeLedger.balance.service.TransferJournal;
import com.latticeMarket.latticeLedger.fee.model.Settlement;
import com.latticeMarket.latticeLedger.gateway.util.AccountIdMasker;
import com.latticeMarket.latticeLedger.ledger.exception.LedgerException;
import com.latticeMarket.latticeLedger.ledger.model.LedgerError;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fee and royalty arithmetic, and the payment legs of a sale.
 *
 * All rates are basis points out of 10000 and every division floors.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeeEngine {

    public static final int BPS_DENOMINATOR = 10_000;

    /**
     * Largest amount whose product with any rate up to 10000 bps fits in a long.
     */
    public static final long MAX_SETTLEMENT_AMOUNT = Long.MAX_VALUE / BPS_DENOMINATOR;

    private final PlatformSettings settings;

    public long platformFee(long amount, int feeBps) {
        return portion(amount, feeBps);
    }

    public long royalty(long amount, int royaltyBps) {
        return portion(amount, royaltyBps);
    }

    /**
     * Splits {@code amount}; the seller's share is whatever the fee and royalty leave.
     */
    public Settlement split(long amount, int feeBps, int royaltyBps) {
        long fee = platformFee(amount, feeBps);
        long roy = royalty(amount, royaltyBps);
        long sellerAmount = amount - fee - roy;
        if (sellerAmount < 0) {
            throw new IllegalArgumentException("Fee and royalty exceed the amount: " + feeBps + " + " + royaltyBps + " bps");
        }
        return Settlement.builder()
                .price(amount)
                .platformFee(fee)
                .royalty(roy)
                .sellerAmount(sellerAmount)
                .platformFeeBps(feeBps)
                .royaltyBps(royaltyBps)
                .build();
    }

    /**
     * Pays a sale: fee to the platform admin, royalty to the creator, the rest to the seller.
     * Legs are recorded in {@code journal} so the caller can reverse them if a later step
     * of the sale fails. If a leg is refused, the legs already paid are reversed here.
     *
     * @param journal Journal of the sale in progress
     * @param amount Sale price
     * @param buyer Paying account
     * @param seller Account receiving the proceeds
     * @param creator Collection creator receiving the royalty
     * @param royaltyBps Collection royalty rate
     * @return the split that was paid
     * @throws LedgerException INSUFFICIENT_PAYMENT if any leg is refused
     */
    public Settlement settle(TransferJournal journal, long amount, String buyer, String seller, String creator, int royaltyBps) {
        Settlement settlement = split(amount, settings.getPlatformFeeBps(), royaltyBps);
        try {
            journal.transfer(settlement.getPlatformFee(), buyer, settings.getAdmin());
            journal.transfer(settlement.getRoyalty(), buyer, creator);
            journal.transfer(settlement.getSellerAmount(), buyer, seller);
        } catch (InsufficientFundsException e) {
            log.warn("Settlement aborted after {} legs - buyer: {}, price: {}",
                    journal.size(), AccountIdMasker.mask(buyer), amount);
            journal.rollback();
            throw new LedgerException(LedgerError.INSUFFICIENT_PAYMENT, "Buyer cannot cover the price of " + amount, e);
        }
        log.debug("Settled sale - price: {}, fee: {}, royalty: {}, seller: {}",
                amount, settlement.getPlatformFee(), settlement.getRoyalty(), settlement.getSellerAmount());
        return settlement;
    }

    private static long portion(long amount, int bps) {
        if (amount < 0 || bps < 0 || bps > BPS_DENOMINATOR) {
            throw new IllegalArgumentException("Invalid amount or rate: " + amount + " @ " + bps + " bps");
        }
        return Math.multiplyExact(amount, (long) bps) / BPS_DENOMINATOR;
    }
}
