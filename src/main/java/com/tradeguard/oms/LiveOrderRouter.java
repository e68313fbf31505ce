package com.tradeguard.oms;

import com.tradeguard.domain.model.OrderRequest;

/**
 * Downstream collaborator that talks to a real exchange. Implemented outside this engine;
 * {@link LiveExecutionVenue} wraps every call with a timeout.
 *
 * <p>Implementations translate exchange errors into unchecked exceptions.
 */
public interface LiveOrderRouter {

    /**
     * Places the order. {@code clientOrderId} is the engine's order id and lets the exchange
     * reject a second placement of the same order.
     */
    VenueAck place(OrderRequest request, String clientOrderId);

    /** Current state and every execution so far. Safe to call repeatedly. */
    VenueExecutionReport query(String venueOrderId);

    /** Requests cancellation. Returns true when the exchange accepted the request. */
    boolean cancel(String venueOrderId);
}
