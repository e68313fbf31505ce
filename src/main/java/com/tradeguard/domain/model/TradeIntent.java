package com.tradeguard.domain.model;

import com.tradeguard.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A candidate trade proposed by a strategy collaborator. Immutable once created.
 *
 * <p>{@code venues} holds one venue for a directional trade, or two for a cross-venue
 * arbitrage (buy leg first, sell leg second). {@code expectedEdgeBps} is optional: when the
 * strategy has its own edge estimate (an arbitrage spread) it takes precedence over the
 * quoted bid/ask spread.
 */
@Value
@Builder
public class TradeIntent {

    String intentId;
    String strategyId;
    String symbol;
    OrderSide side;
    BigDecimal quantity;
    BigDecimal referencePrice;

    @Singular
    List<String> venues;

    BigDecimal expectedEdgeBps;

    /** Currency the price is quoted in. Null means the ledger's base currency. */
    String quoteCurrency;

    Instant timestamp;

    public String primaryVenue() {
        return venues.isEmpty() ? null : venues.get(0);
    }

    public boolean crossVenue() {
        return venues.size() > 1;
    }

    public BigDecimal notional() {
        return quantity.multiply(referencePrice);
    }
}
