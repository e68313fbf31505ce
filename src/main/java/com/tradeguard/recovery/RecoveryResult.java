package com.tradeguard.recovery;

import com.tradeguard.domain.enums.KillSwitchState;
import lombok.Builder;
import lombok.Data;

/** Summary of one startup recovery run, logged and audited as RECOVERY. */
@Data
@Builder
public class RecoveryResult {

    private long startedAt;
    private long durationMs;
    private boolean success;
    private String error;

    private long auditEntriesVerified;
    private boolean riskStateRestored;
    private KillSwitchState killSwitchState;
    private Long snapshotId;
    private int positionsRestored;
    private int fillsReplayed;
}
