package com.tradeguard.marketdata;

import com.tradeguard.domain.model.MarketContext;
import java.util.Collection;
import java.util.Optional;

/**
 * Boundary to the market-data pipeline: best bid/ask, last trade, estimated depth and
 * rolling volatility per symbol. Consumed by the EV gate, the paper simulator and the
 * anomaly monitor.
 */
public interface MarketContextProvider {

    Optional<MarketContext> current(String symbol);

    Collection<MarketContext> all();
}
