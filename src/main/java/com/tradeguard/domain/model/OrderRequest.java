package com.tradeguard.domain.model;

import com.tradeguard.domain.enums.OrderSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** What an execution venue receives: an intent resized by its EV decision. */
@Value
@Builder
public class OrderRequest {

    String intentId;
    String strategyId;
    String symbol;
    OrderSide side;
    BigDecimal quantity;
    BigDecimal referencePrice;
    String venue;
    String quoteCurrency;

    public static OrderRequest from(TradeIntent intent, EvDecision decision, String quoteCurrency) {
        return OrderRequest.builder()
                .intentId(intent.getIntentId())
                .strategyId(intent.getStrategyId())
                .symbol(intent.getSymbol())
                .side(intent.getSide())
                .quantity(decision.getApprovedQuantity())
                .referencePrice(intent.getReferencePrice())
                .venue(intent.primaryVenue())
                .quoteCurrency(quoteCurrency)
                .build();
    }
}
