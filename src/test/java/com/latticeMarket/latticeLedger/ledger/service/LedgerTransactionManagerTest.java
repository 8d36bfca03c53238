package com.latticeMarket.latticeLedger.ledger.service;

import com.latticeMarket.latticeLedger.ledger.exception.LedgerException;
import com.latticeMarket.latticeLedger.ledger.model.LedgerError;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LedgerTransactionManagerTest {

    private final SequentialHeightClock clock = new SequentialHeightClock();
    private final LedgerTransactionManager transactions = new LedgerTransactionManager(clock);

    @Test
    void committedWriteAdvancesHeightOnce() {
        String result = transactions.write("outer", () -> {
            transactions.run("inner", () -> { });
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(clock.currentHeight()).isEqualTo(2);
    }

    @Test
    void rejectedWriteKeepsTheHeight() {
        assertThatThrownBy(() -> transactions.run("failing", () -> {
            throw new LedgerException(LedgerError.INVALID_PARAMETERS, "nope");
        })).isInstanceOf(LedgerException.class);

        assertThat(clock.currentHeight()).isEqualTo(1);
        assertThat(transactions.isWriteLockedByCurrentThread()).isFalse();
    }

    @Test
    void readsDoNotAdvanceHeight() {
        assertThat(transactions.read(() -> 42)).isEqualTo(42);
        assertThat(clock.currentHeight()).isEqualTo(1);
    }

    @Test
    void readsInsideAWriteAreAllowed() {
        int value = transactions.write("outer", () -> transactions.read(() -> 7));

        assertThat(value).isEqualTo(7);
    }

    @Test
    void readersWaitForTheWriter() throws Exception {
        CountDownLatch writerInside = new CountDownLatch(1);
        CountDownLatch releaseWriter = new CountDownLatch(1);
        AtomicBoolean writerDone = new AtomicBoolean();
        ExecutorService executor = Executors.newFixedThreadPool(2);

        Future<?> writer = executor.submit(() -> transactions.run("slow", () -> {
            writerInside.countDown();
            try {
                releaseWriter.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            writerDone.set(true);
        }));
        assertThat(writerInside.await(5, TimeUnit.SECONDS)).isTrue();

        Future<Boolean> reader = executor.submit(() -> transactions.read(writerDone::get));
        Thread.sleep(100);
        assertThat(reader.isDone()).isFalse();

        releaseWriter.countDown();
        assertThat(reader.get(5, TimeUnit.SECONDS)).isTrue();
        writer.get(5, TimeUnit.SECONDS);
        executor.shutdown();
    }
}
