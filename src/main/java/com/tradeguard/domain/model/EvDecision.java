package com.tradeguard.domain.model;

import com.tradeguard.domain.enums.EvOutcome;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Output of the EV gate for one trade intent. Created exactly once per intent id and never
 * mutated. All money amounts are in the intent's quote currency and refer to the approved
 * size (or to the requested size when the outcome is REJECTED).
 */
@Value
@Builder
public class EvDecision {

    String intentId;
    String strategyId;
    String symbol;
    BigDecimal spreadBps;
    BigDecimal fillProbability;
    BigDecimal slippageBps;
    BigDecimal slippageCost;
    BigDecimal netCost;
    BigDecimal latencyPenalty;
    BigDecimal expectedValue;
    BigDecimal minimumEv;
    BigDecimal requestedQuantity;
    BigDecimal approvedQuantity;
    EvOutcome outcome;
    Instant decidedAt;

    public boolean approved() {
        return outcome != EvOutcome.REJECTED;
    }
}
