package com.tradeguard.risk;

import com.tradeguard.domain.enums.KillSwitchState;
import com.tradeguard.domain.enums.TripReason;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Consistent copy of the live risk state, taken under the state lock. */
@Value
@Builder
public class RiskStateSnapshot {

    KillSwitchState killSwitchState;
    TripReason tripReason;
    String tripDetail;
    Instant trippedAt;
    LocalDate tradingDay;
    BigDecimal dailyRealizedPnl;
    BigDecimal unrealizedPnl;
    int consecutiveAnomalies;

    /** Audit sequence of the last fill counted in {@code dailyRealizedPnl}, -1 for none. */
    @Builder.Default
    long lastFillSequence = -1;
    Map<String, BigDecimal> exposureBySymbol;
    BigDecimal grossExposure;

    public boolean isKillSwitchActive() {
        return killSwitchState == KillSwitchState.TRIPPED;
    }

    public BigDecimal getDailyPnl() {
        BigDecimal realized = dailyRealizedPnl != null ? dailyRealizedPnl : BigDecimal.ZERO;
        BigDecimal unrealized = unrealizedPnl != null ? unrealizedPnl : BigDecimal.ZERO;
        return realized.add(unrealized);
    }
}
