package com.tradeguard.risk;

import com.tradeguard.domain.enums.RiskUpdateType;
import com.tradeguard.domain.model.AnomalyEvent;
import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Input to {@link RiskEngine#evaluate}. Ledger changes, valuations, anomalies (including
 * reconciliation and cancellation failures) and manual trips all arrive through this one
 * type. Amounts are in the base currency.
 */
@Value
@Builder
public class RiskStateUpdate {

    RiskUpdateType type;

    // ---- LEDGER ----
    String symbol;
    BigDecimal realizedPnl;
    /** Absolute notional now held in {@link #symbol}. */
    BigDecimal symbolExposure;
    /** Audit sequence of the fill behind this update, -1 when there is none. */
    @Builder.Default
    long fillSequence = -1;

    // ---- VALUATION ----
    BigDecimal unrealizedPnl;
    Map<String, BigDecimal> exposureBySymbol;

    // ---- ANOMALY ----
    AnomalyEvent anomaly;

    // ---- MANUAL_TRIP ----
    String detail;

    public static RiskStateUpdate ledger(String symbol, BigDecimal realizedPnl, BigDecimal symbolExposure) {
        return ledger(symbol, realizedPnl, symbolExposure, -1);
    }

    public static RiskStateUpdate ledger(
            String symbol, BigDecimal realizedPnl, BigDecimal symbolExposure, long fillSequence) {
        return RiskStateUpdate.builder()
                .type(RiskUpdateType.LEDGER)
                .symbol(symbol)
                .realizedPnl(realizedPnl)
                .symbolExposure(symbolExposure)
                .fillSequence(fillSequence)
                .build();
    }

    public static RiskStateUpdate valuation(BigDecimal unrealizedPnl, Map<String, BigDecimal> exposureBySymbol) {
        return RiskStateUpdate.builder()
                .type(RiskUpdateType.VALUATION)
                .unrealizedPnl(unrealizedPnl)
                .exposureBySymbol(exposureBySymbol)
                .build();
    }

    public static RiskStateUpdate anomaly(AnomalyEvent anomaly) {
        return RiskStateUpdate.builder().type(RiskUpdateType.ANOMALY).anomaly(anomaly).build();
    }

    public static RiskStateUpdate manualTrip(String detail) {
        return RiskStateUpdate.builder().type(RiskUpdateType.MANUAL_TRIP).detail(detail).build();
    }
}
