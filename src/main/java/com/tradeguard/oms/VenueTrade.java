package com.tradeguard.oms;

import com.tradeguard.domain.enums.LiquidityRole;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** One execution reported by the exchange. {@code tradeId} is unique per venue. */
@Value
@Builder
public class VenueTrade {

    String tradeId;
    BigDecimal price;
    BigDecimal quantity;
    BigDecimal fee;
    String currency;
    LiquidityRole liquidityRole;
    Instant timestamp;
}
