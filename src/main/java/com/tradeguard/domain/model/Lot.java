package com.tradeguard.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * A FIFO tranche of a position. {@code quantity} is signed: positive for a long lot,
 * negative for a short one. Partially consumed lots are replaced via {@link #withQuantity}.
 */
@Value
@Builder
@Jacksonized
public class Lot {

    String symbol;

    @With
    BigDecimal quantity;

    BigDecimal entryPrice;
    String currency;
    Instant openedAt;
    String fillId;
}
