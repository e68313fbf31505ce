package com.tradeguard.domain.model;

import com.tradeguard.domain.enums.AnomalyType;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A flagged observation. {@code magnitude} is the z-score for statistical anomalies, the skew
 * in milliseconds for clock drift, and the discrepancy or unconfirmed-order count for
 * reconciliation and cancellation failures.
 */
@Value
@Builder
public class AnomalyEvent {

    AnomalyType type;
    String key;
    double magnitude;
    double threshold;
    double observedValue;
    int recentCount;
    boolean autoPause;
    String detail;
    Instant timestamp;

    /** Whether the risk engine must trip on this event alone. */
    public boolean tripsKillSwitch() {
        return autoPause || type.isFatal();
    }
}
