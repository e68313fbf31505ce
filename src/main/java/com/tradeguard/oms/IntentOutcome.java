package com.tradeguard.oms;

import com.tradeguard.domain.enums.IntentStatus;
import com.tradeguard.domain.enums.RejectReason;
import com.tradeguard.domain.model.EvDecision;
import com.tradeguard.domain.model.Fill;
import com.tradeguard.domain.model.Order;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Final result of one trade intent. Replayed unchanged (with {@code duplicate} set) when the
 * same intent id is submitted again.
 */
@Value
@Builder(toBuilder = true)
public class IntentOutcome {

    String intentId;
    IntentStatus status;
    RejectReason rejectReason;

    /** Human-readable reason for anything other than EXECUTED. */
    String detail;

    EvDecision evDecision;

    /** Comma-separated risk violation codes when the risk check denied the intent. */
    String riskViolations;

    Order order;
    List<Fill> fills;
    boolean duplicate;

    public IntentOutcome asDuplicate() {
        return toBuilder().duplicate(true).build();
    }
}
