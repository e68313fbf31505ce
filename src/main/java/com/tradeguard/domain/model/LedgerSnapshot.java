package com.tradeguard.domain.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Point-in-time copy of every ledger position. */
@Value
@Builder
public class LedgerSnapshot {
    Long id;
    long auditSequence;
    List<PositionView> positions;
    Instant takenAt;
}
