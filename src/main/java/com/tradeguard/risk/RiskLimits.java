package com.tradeguard.risk;

import java.math.BigDecimal;
import java.time.LocalTime;
import java.time.ZoneId;
import lombok.Builder;
import lombok.Data;

/**
 * Configured risk limits. Null values disable the corresponding check.
 *
 * <p>All notional and P&L amounts are in the ledger's base currency. The trading-hours
 * window is inclusive of its start and exclusive of its end, evaluated in
 * {@link #tradingHoursZone}; a window whose end is before its start spans midnight.
 */
@Data
@Builder
public class RiskLimits {

    // ==================== Trade-Level Limits ====================

    /** Maximum notional of a single order. */
    private BigDecimal maxTradeNotional;

    // ==================== Position-Level Limits ====================

    /** Maximum absolute notional held in one symbol after the trade. */
    private BigDecimal maxPositionNotional;

    // ==================== Account-Level Limits ====================

    /** Maximum gross notional across all symbols after the trade. */
    private BigDecimal maxAggregateNotional;

    /** Daily loss (realized + unrealized) that trips the kill switch. Positive number. */
    private BigDecimal dailyLossLimit;

    // ==================== Trading Hours ====================

    private LocalTime tradingHoursStart;
    private LocalTime tradingHoursEnd;

    @Builder.Default
    private ZoneId tradingHoursZone = ZoneId.of("UTC");

    public boolean hasTradingHours() {
        return tradingHoursStart != null && tradingHoursEnd != null;
    }
}
