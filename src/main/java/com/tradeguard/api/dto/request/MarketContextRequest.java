package com.tradeguard.api.dto.request;

import com.tradeguard.domain.model.MarketContext;
import jakarta.validation.constraints.NotBlank;
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
public class MarketContextRequest {

    @NotBlank(message = "symbol is required")
    private String symbol;

    private BigDecimal bid;
    private BigDecimal ask;
    private BigDecimal last;
    private BigDecimal bookDepth;
    private BigDecimal depthRatio;
    private BigDecimal volatilityPct;
    private long latencyMs;
    private BigDecimal makerFillRate;
    private Instant observedAt;

    public MarketContext toDomain(Instant receivedAt) {
        return MarketContext.builder()
                .symbol(symbol)
                .bid(bid)
                .ask(ask)
                .last(last)
                .bookDepth(bookDepth)
                .depthRatio(depthRatio)
                .volatilityPct(volatilityPct)
                .latencyMs(latencyMs)
                .makerFillRate(makerFillRate)
                .observedAt(observedAt != null ? observedAt : receivedAt)
                .build();
    }
}
