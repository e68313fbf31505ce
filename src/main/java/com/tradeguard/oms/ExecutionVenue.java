package com.tradeguard.oms;

import com.tradeguard.domain.model.Order;
import com.tradeguard.domain.model.OrderHandle;
import com.tradeguard.domain.model.OrderRequest;
import com.tradeguard.risk.CancellationToken;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Where approved orders go: the paper simulator or a live venue adapter.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>return the existing order for an intent id they have already seen, with no new side
 *       effect;</li>
 *   <li>check {@code token} before every fill and cancel the order once it is cancelled;</li>
 *   <li>audit and persist every status transition and fill;</li>
 *   <li>bound every external call with a timeout.</li>
 * </ul>
 */
public interface ExecutionVenue {

    /** Places and works the order until it is terminal or the venue stops reporting on it. */
    OrderHandle submit(OrderRequest request, CancellationToken token);

    /**
     * Asks for an order to be canceled. Fire-and-forget: the future completes {@code true} once
     * the order is CANCELED and {@code false} when it reached another terminal state first.
     */
    CompletableFuture<Boolean> requestCancel(String orderId);

    /**
     * Blocking form of {@link #requestCancel}. Waits at most {@code timeout} for the order to
     * reach a terminal state and returns false when it did not.
     */
    default boolean cancel(String orderId, Duration timeout) {
        return requestCancel(orderId)
                .completeOnTimeout(false, timeout.toMillis(), TimeUnit.MILLISECONDS)
                .join();
    }

    /** Snapshots of orders not yet terminal. */
    List<Order> openOrders();
}
