package com.tradeguard.domain.model;

import com.tradeguard.domain.enums.LiquidityRole;
import com.tradeguard.domain.enums.OrderSide;
import com.tradeguard.domain.enums.PriceSource;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One execution against an order. Appended only, never edited.
 *
 * <p>For live orders {@code id} is the venue's trade id, which is what reconciliation
 * matches external trade records against.
 */
@Value
@Builder
@Jacksonized
public class Fill {

    String id;
    String orderId;
    String symbol;
    OrderSide side;
    String venue;
    BigDecimal price;
    BigDecimal quantity;
    BigDecimal fee;
    String currency;
    LiquidityRole liquidityRole;
    PriceSource priceSource;
    Instant timestamp;

    public BigDecimal signedQuantity() {
        return quantity.multiply(side.sign());
    }
}
