package com.tradeguard.event;

import com.tradeguard.domain.model.MarketContext;
import org.springframework.context.ApplicationEvent;

/**
 * Published whenever a fresh market context is stored for a symbol.
 *
 * <p>The anomaly monitor turns each one into price, latency and clock signals. Listeners run
 * on the publishing thread, so they must only enqueue work.
 */
public class MarketDataEvent extends ApplicationEvent {

    private final MarketContext context;
    private final long receivedAt;

    public MarketDataEvent(Object source, MarketContext context) {
        super(source);
        this.context = context;
        this.receivedAt = System.nanoTime();
    }

    public MarketContext getContext() {
        return context;
    }

    /** System.nanoTime() at publication. */
    public long getReceivedAt() {
        return receivedAt;
    }
}
