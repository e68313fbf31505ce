package com.tradeguard.domain.vo;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Net-cost estimate for a prospective trade, in the trade's quote currency.
 *
 * <p>{@code feeBps} and {@code taxBps} are the effective all-leg rates so callers can rescale
 * the estimate to another size without going back to the fee schedule.
 */
@Value
@Builder
public class FeeTaxEstimate {

    BigDecimal notional;
    BigDecimal fees;
    BigDecimal taxes;
    BigDecimal feeBps;
    BigDecimal taxBps;
    int legs;

    public BigDecimal getTotal() {
        return fees.add(taxes);
    }

    public BigDecimal totalBps() {
        return feeBps.add(taxBps);
    }

    public static FeeTaxEstimate zero() {
        return FeeTaxEstimate.builder()
                .notional(BigDecimal.ZERO)
                .fees(BigDecimal.ZERO)
                .taxes(BigDecimal.ZERO)
                .feeBps(BigDecimal.ZERO)
                .taxBps(BigDecimal.ZERO)
                .legs(0)
                .build();
    }
}
