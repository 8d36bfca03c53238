package com.latticeMarket.latticeLedger.balance.service;

import com.latticeMarket.latticeLedger.balance.exception.InsufficientFundsException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TransferJournalTest {

    private final InMemoryBalanceLedger balances = new InMemoryBalanceLedger();

    @Test
    void rollbackRestoresAllBalances() {
        balances.credit("buyer", 100);
        TransferJournal journal = new TransferJournal(balances);
        journal.transfer(10, "buyer", "admin");
        journal.transfer(20, "buyer", "creator");

        assertThatThrownBy(() -> journal.transfer(200, "buyer", "seller")).isInstanceOf(InsufficientFundsException.class);
        assertThat(journal.size()).isEqualTo(2);

        journal.rollback();

        assertThat(journal.size()).isZero();
        assertThat(balances.balanceOf("buyer")).isEqualTo(100);
        assertThat(balances.balanceOf("admin")).isZero();
        assertThat(balances.balanceOf("creator")).isZero();
    }

    @Test
    void failedReversalIsReported() {
        balances.credit("buyer", 100);
        TransferJournal journal = new TransferJournal(balances);
        journal.transfer(50, "buyer", "creator");
        balances.transfer(50, "creator", "elsewhere");

        assertThatThrownBy(journal::rollback).isInstanceOf(IllegalStateException.class);
    }
}
