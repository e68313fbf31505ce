package com.tradeguard.oms;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Outcome of one cancel-all sweep. Audited as the CANCEL_ALL entry body. */
@Value
@Builder
public class CancelAllReport {

    String trigger;
    int requested;
    int canceled;

    /** Orders that reached FILLED or REJECTED before the cancel took effect. */
    int finishedOtherwise;

    List<String> unconfirmedOrderIds;
    long elapsedMs;

    public boolean isComplete() {
        return unconfirmedOrderIds.isEmpty();
    }
}
