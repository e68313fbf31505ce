package com.tradeguard.api.dto.request;

import com.tradeguard.domain.enums.OrderSide;
import com.tradeguard.domain.model.TradeIntent;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Trade intent submitted by an out-of-process strategy. Field checks happen in the pipeline's
 * validator so REST and in-process submissions are judged (and audited) the same way.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeIntentRequest {

    private String intentId;
    private String strategyId;
    private String symbol;
    private OrderSide side;
    private BigDecimal quantity;
    private BigDecimal referencePrice;

    @Builder.Default
    private List<String> venues = new ArrayList<>();

    private BigDecimal expectedEdgeBps;
    private String quoteCurrency;

    public TradeIntent toDomain(Instant receivedAt) {
        return TradeIntent.builder()
                .intentId(intentId)
                .strategyId(strategyId)
                .symbol(symbol)
                .side(side)
                .quantity(quantity)
                .referencePrice(referencePrice)
                .venues(venues != null ? venues : List.of())
                .expectedEdgeBps(expectedEdgeBps)
                .quoteCurrency(quoteCurrency)
                .timestamp(receivedAt)
                .build();
    }
}
