package com.tradeguard.marketdata;

import com.tradeguard.domain.model.MarketContext;
import com.tradeguard.event.EventPublisherHelper;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds the latest {@link MarketContext} per symbol as pushed by the market-data collaborator.
 *
 * <p>Each update is re-published as a {@code MarketDataEvent} so the anomaly monitor can
 * observe price, latency and clock signals without sitting in the update path.
 */
@Component
public class InMemoryMarketContextProvider implements MarketContextProvider {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMarketContextProvider.class);

    private final Map<String, MarketContext> contexts = new ConcurrentHashMap<>();
    private final EventPublisherHelper eventPublisherHelper;

    public InMemoryMarketContextProvider(EventPublisherHelper eventPublisherHelper) {
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public void update(MarketContext context) {
        if (context == null || context.getSymbol() == null) {
            log.warn("Ignoring market context without symbol");
            return;
        }
        contexts.put(context.getSymbol(), context);
        eventPublisherHelper.publishMarketData(this, context);
    }

    @Override
    public Optional<MarketContext> current(String symbol) {
        return Optional.ofNullable(contexts.get(symbol));
    }

    @Override
    public Collection<MarketContext> all() {
        return List.copyOf(contexts.values());
    }
}
