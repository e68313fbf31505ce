package com.tradeguard.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradeguard.oms.SymbolSequencer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for SymbolSequencer on a real thread pool. */
class SymbolSequencerTest {

    private ExecutorService executor;
    private SymbolSequencer sequencer;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        sequencer = new SymbolSequencer(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Tasks on one symbol run one at a time in submission order")
    void sameSymbol_runsInOrder() throws Exception {
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            int n = i;
            futures.add(sequencer.submit("BTCUSDT", () -> {
                seen.add(n);
                return n;
            }));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);

        assertThat(seen).hasSize(50).isSorted();
    }

    @Test
    @DisplayName("A failed task does not block the next one on the same symbol")
    void failure_doesNotBlockLane() throws Exception {
        CompletableFuture<Object> failing = sequencer.submit("BTCUSDT", () -> {
            throw new IllegalStateException("boom");
        });
        CompletableFuture<String> next = sequencer.submit("BTCUSDT", () -> "ran");

        assertThat(next.get(5, TimeUnit.SECONDS)).isEqualTo("ran");
        assertThat(failing).isCompletedExceptionally();
    }

    @Test
    @DisplayName("Different symbols run in parallel")
    void differentSymbols_runInParallel() throws Exception {
        CountDownLatch bothRunning = new CountDownLatch(2);
        CompletableFuture<Boolean> btc = sequencer.submit("BTCUSDT", () -> awaitLatch(bothRunning));
        CompletableFuture<Boolean> eth = sequencer.submit("ETHUSDT", () -> awaitLatch(bothRunning));

        assertThat(btc.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(eth.get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Idle symbols are forgotten")
    void idleSymbols_dropped() throws Exception {
        sequencer.submit("BTCUSDT", () -> 1).get(5, TimeUnit.SECONDS);

        long deadline = System.currentTimeMillis() + 2000;
        while (sequencer.activeSymbols() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(sequencer.activeSymbols()).isZero();
    }

    private static boolean awaitLatch(CountDownLatch latch) {
        latch.countDown();
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
