package com.tradeguard.recovery;

import com.tradeguard.anomaly.AnomalyMonitor;
import com.tradeguard.audit.AuditLog;
import com.tradeguard.domain.enums.AuditEventType;
import com.tradeguard.domain.model.AuditEntry;
import com.tradeguard.domain.model.ChainVerificationResult;
import com.tradeguard.domain.model.Fill;
import com.tradeguard.domain.model.LedgerSnapshot;
import com.tradeguard.domain.model.LedgerUpdate;
import com.tradeguard.ledger.PositionLedger;
import com.tradeguard.oms.FillProcessor;
import com.tradeguard.risk.KillSwitchService;
import com.tradeguard.risk.RiskEngine;
import com.tradeguard.risk.RiskStateHolder;
import com.tradeguard.risk.RiskStatePersistenceService;
import com.tradeguard.risk.RiskStateSnapshot;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Rebuilds in-memory state after a restart, then opens intake.
 *
 * <ol>
 *   <li>Verify the audit chain. A broken chain halts the engine: intents are refused until an
 *       operator intervenes.</li>
 *   <li>Restore the persisted risk state, and with it the kill switch.</li>
 *   <li>Restore the latest ledger snapshot.</li>
 *   <li>Replay FILL entries the snapshot does not contain, per position by audit sequence.
 *       Fills from today also feed the risk engine.</li>
 *   <li>Value the portfolio once, then mark the engine ready.</li>
 * </ol>
 */
@Service
public class StartupRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(StartupRecoveryService.class);

    private final AuditLog auditLog;
    private final RiskStatePersistenceService riskStatePersistenceService;
    private final RiskStateHolder riskStateHolder;
    private final KillSwitchService killSwitchService;
    private final RiskEngine riskEngine;
    private final LedgerSnapshotService ledgerSnapshotService;
    private final PositionLedger positionLedger;
    private final FillProcessor fillProcessor;
    private final AnomalyMonitor anomalyMonitor;
    private final EngineReadiness engineReadiness;
    private final Clock clock;

    public StartupRecoveryService(
            AuditLog auditLog,
            RiskStatePersistenceService riskStatePersistenceService,
            RiskStateHolder riskStateHolder,
            KillSwitchService killSwitchService,
            RiskEngine riskEngine,
            LedgerSnapshotService ledgerSnapshotService,
            PositionLedger positionLedger,
            FillProcessor fillProcessor,
            AnomalyMonitor anomalyMonitor,
            EngineReadiness engineReadiness,
            Clock clock) {
        this.auditLog = auditLog;
        this.riskStatePersistenceService = riskStatePersistenceService;
        this.riskStateHolder = riskStateHolder;
        this.killSwitchService = killSwitchService;
        this.riskEngine = riskEngine;
        this.ledgerSnapshotService = ledgerSnapshotService;
        this.positionLedger = positionLedger;
        this.fillProcessor = fillProcessor;
        this.anomalyMonitor = anomalyMonitor;
        this.engineReadiness = engineReadiness;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(10)
    public void onApplicationReady() {
        recover();
    }

    public RecoveryResult recover() {
        log.info("Starting recovery sequence...");
        RecoveryResult result = RecoveryResult.builder().startedAt(System.currentTimeMillis()).build();

        try {
            ChainVerificationResult chain = auditLog.verifyChain();
            result.setAuditEntriesVerified(chain.getEntriesChecked());
            if (!chain.isValid()) {
                engineReadiness.halt("audit chain broken at index " + chain.getFirstBrokenIndex() + ": "
                        + chain.getMessage());
                result.setSuccess(false);
                result.setError(chain.getMessage());
                return finish(result);
            }

            restoreRiskState(result);
            restoreLedger(result);
            anomalyMonitor.samplePortfolio();

            result.setKillSwitchState(riskEngine.state().getKillSwitchState());
            result.setSuccess(true);
        } catch (RuntimeException e) {
            log.error("Recovery sequence failed", e);
            engineReadiness.halt("recovery failed: " + e.getMessage());
            result.setSuccess(false);
            result.setError(e.getMessage());
            return finish(result);
        }

        result = finish(result);
        auditLog.append(AuditEventType.RECOVERY, result);
        engineReadiness.markReady();
        return result;
    }

    void restoreRiskState(RecoveryResult result) {
        Optional<RiskStateSnapshot> persisted = riskStatePersistenceService.load();
        if (persisted.isEmpty()) {
            log.info("No persisted risk state, starting ARMED");
            return;
        }
        riskStateHolder.restore(persisted.get());
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        if (riskStateHolder.rollTo(today)) {
            log.info("Persisted risk state was from {}, daily counters reset", persisted.get().getTradingDay());
        }
        killSwitchService.syncTokenWithState();
        result.setRiskStateRestored(true);
        if (riskStateHolder.isTripped()) {
            log.warn("Kill switch restored TRIPPED ({}): intents stay denied until a two-operator reset",
                    riskStateHolder.tripReason());
        }
    }

    void restoreLedger(RecoveryResult result) {
        Optional<LedgerSnapshot> snapshot = ledgerSnapshotService.latest();
        if (snapshot.isPresent()) {
            positionLedger.restore(snapshot.get().getPositions());
            result.setSnapshotId(snapshot.get().getId());
            result.setPositionsRestored(snapshot.get().getPositions().size());
        }

        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        List<AuditEntry> fills = auditLog.entriesAfter(-1, AuditEventType.FILL);
        int replayed = 0;
        for (AuditEntry entry : fills) {
            Fill fill = auditLog.decodeBody(entry, Fill.class);
            if (entry.getSequence() <= positionLedger.lastAppliedSequence(fill.getSymbol())) {
                continue;
            }
            LedgerUpdate update = positionLedger.apply(fill, entry.getSequence());
            replayed++;
            if (fill.getTimestamp() != null && today.equals(LocalDate.ofInstant(fill.getTimestamp(), ZoneOffset.UTC))) {
                fillProcessor.afterFill(update);
            }
        }
        result.setFillsReplayed(replayed);
        if (replayed > 0) {
            log.info("Replayed {} fills from the audit log", replayed);
        }
    }

    private RecoveryResult finish(RecoveryResult result) {
        result.setDurationMs(System.currentTimeMillis() - result.getStartedAt());
        log.info(
                "Recovery {} in {}ms: {} audit entries, risk state restored={}, {} positions, {} fills replayed",
                result.isSuccess() ? "completed" : "failed",
                result.getDurationMs(),
                result.getAuditEntriesVerified(),
                result.isRiskStateRestored(),
                result.getPositionsRestored(),
                result.getFillsReplayed());
        return result;
    }
}
