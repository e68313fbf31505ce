package com.tradeguard.domain.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Outcome of matching internal fills against an external trade list by trade id. */
@Value
@Builder
public class ReconciliationReport {

    String runId;
    Instant runAt;
    Instant since;
    int internalCount;
    int externalCount;
    int matchedCount;
    List<Discrepancy> discrepancies;

    public boolean passed() {
        return discrepancies.isEmpty();
    }
}
