package com.tradeguard.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Effect of applying one fill to its position. Amounts are in the position's currency. */
@Value
@Builder
public class LedgerUpdate {

    String symbol;
    String fillId;
    String currency;
    BigDecimal fillPrice;
    BigDecimal realizedPnl;
    BigDecimal positionRealizedPnl;
    BigDecimal fee;
    BigDecimal netQuantity;
    int lotsConsumed;
    boolean lotOpened;
    long auditSequence;
}
