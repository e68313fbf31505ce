package com.tradeguard.oms;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs tasks one at a time per symbol, in submission order, on the shared lane pool.
 * Different symbols run in parallel.
 *
 * <p>Each symbol keeps the future of its last task; a new task is chained after it whether
 * that task succeeded or failed. The entry is dropped once the tail completes, so idle
 * symbols hold nothing.
 */
@Component
public class SymbolSequencer {

    private final Executor laneExecutor;
    private final Map<String, CompletableFuture<?>> tails = new HashMap<>();

    public SymbolSequencer(@Qualifier("laneExecutor") Executor laneExecutor) {
        this.laneExecutor = laneExecutor;
    }

    public <T> CompletableFuture<T> submit(String symbol, Supplier<T> task) {
        CompletableFuture<T> next;
        synchronized (tails) {
            CompletableFuture<?> tail = tails.get(symbol);
            CompletableFuture<?> after = tail != null
                    ? tail.handle((result, error) -> null)
                    : CompletableFuture.completedFuture(null);
            next = after.thenApplyAsync(ignored -> task.get(), laneExecutor);
            tails.put(symbol, next);
        }
        CompletableFuture<T> submitted = next;
        submitted.whenComplete((result, error) -> {
            synchronized (tails) {
                tails.remove(symbol, submitted);
            }
        });
        return submitted;
    }

    public int activeSymbols() {
        synchronized (tails) {
            return tails.size();
        }
    }
}
