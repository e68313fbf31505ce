package com.tradeguard.domain.model;

import com.tradeguard.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Ground-truth trade record reported by an execution venue. */
@Value
@Builder
public class ExternalTrade {

    String tradeId;
    String symbol;
    OrderSide side;
    BigDecimal price;
    BigDecimal quantity;
    Instant timestamp;
}
