package com.tradeguard.ledger;

import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Whole-ledger valuation in the base currency. */
@Value
@Builder
public class LedgerValuation {

    String baseCurrency;
    BigDecimal realizedPnl;
    BigDecimal unrealizedPnl;
    BigDecimal grossExposure;
    Map<String, BigDecimal> exposureBySymbol;

    /** True when any conversion fell back to a last-known rate. */
    boolean staleRates;

    public BigDecimal totalPnl() {
        return realizedPnl.add(unrealizedPnl);
    }
}
