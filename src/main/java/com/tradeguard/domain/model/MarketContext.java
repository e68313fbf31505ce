package com.tradeguard.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Latest market view for one symbol, supplied by the market-data collaborator.
 *
 * <p>{@code bookDepth} is the estimated quantity available near the touch on the side an
 * aggressive order would consume. {@code depthRatio} is bid depth over ask depth (1.0 is a
 * balanced book). {@code volatilityPct} is the rolling volatility in percent.
 */
@Value
@Builder(toBuilder = true)
public class MarketContext {

    String symbol;
    BigDecimal bid;
    BigDecimal ask;
    BigDecimal last;
    BigDecimal bookDepth;
    BigDecimal depthRatio;
    BigDecimal volatilityPct;
    long latencyMs;

    /** Share of recent passive orders that filled, 0..1. Null when unknown. */
    BigDecimal makerFillRate;

    Instant observedAt;

    public BigDecimal mid() {
        if (bid == null || ask == null) {
            return last;
        }
        return bid.add(ask).divide(BigDecimal.valueOf(2), 10, RoundingMode.HALF_UP);
    }

    /** Quoted spread in basis points of mid. Zero when either side of the book is missing. */
    public BigDecimal spreadBps() {
        BigDecimal mid = mid();
        if (bid == null || ask == null || mid == null || mid.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return ask.subtract(bid).multiply(BigDecimal.valueOf(10_000)).divide(mid, 6, RoundingMode.HALF_UP);
    }

    /** Price used to mark open lots: last trade, falling back to mid. */
    public BigDecimal markPrice() {
        return last != null ? last : mid();
    }
}
