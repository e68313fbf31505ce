package com.tradeguard.api.dto.request;

import com.tradeguard.domain.enums.OrderSide;
import com.tradeguard.domain.model.ExternalTrade;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExternalTradeRequest {

    @NotBlank(message = "tradeId is required")
    private String tradeId;

    @NotBlank(message = "symbol is required")
    private String symbol;

    @NotNull(message = "side is required")
    private OrderSide side;

    @NotNull(message = "price is required")
    private BigDecimal price;

    @NotNull(message = "quantity is required")
    private BigDecimal quantity;

    private Instant timestamp;

    public ExternalTrade toDomain() {
        return ExternalTrade.builder()
                .tradeId(tradeId)
                .symbol(symbol)
                .side(side)
                .price(price)
                .quantity(quantity)
                .timestamp(timestamp)
                .build();
    }
}
