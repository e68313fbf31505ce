package com.tradeguard.domain.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Read-only copy of one ledger position. Used for the REST surface and for ledger snapshots.
 */
@Value
@Builder
@Jacksonized
public class PositionView {

    String symbol;
    String currency;
    BigDecimal netQuantity;
    List<Lot> lots;
    BigDecimal realizedPnl;
    BigDecimal feesAccrued;
    long lastAppliedSequence;
}
