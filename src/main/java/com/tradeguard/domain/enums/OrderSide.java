package com.tradeguard.domain.enums;

import java.math.BigDecimal;

/** Buy or sell side of an intent, order or fill. */
public enum OrderSide {
    BUY,
    SELL;

    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** +1 for BUY, -1 for SELL. Multiplies an unsigned quantity into a signed position delta. */
    public BigDecimal sign() {
        return this == BUY ? BigDecimal.ONE : BigDecimal.ONE.negate();
    }
}
