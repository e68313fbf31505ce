package com.tradeguard.recovery;

import com.tradeguard.audit.AuditLog;
import com.tradeguard.domain.enums.AuditEventType;
import com.tradeguard.domain.enums.ReadinessState;
import com.tradeguard.domain.model.LedgerSnapshot;
import com.tradeguard.entity.LedgerSnapshotEntity;
import com.tradeguard.ledger.PositionLedger;
import com.tradeguard.mapper.LedgerSnapshotMapper;
import com.tradeguard.repository.jpa.LedgerSnapshotJpaRepository;
import com.tradeguard.risk.RiskEngine;
import com.tradeguard.risk.RiskStatePersistenceService;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically persists the ledger's positions together with the risk state, and once more on
 * shutdown. Only the latest snapshot is kept; fills after it are replayed from the audit log
 * on restart.
 */
@Service
public class LedgerSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(LedgerSnapshotService.class);

    private final PositionLedger positionLedger;
    private final LedgerSnapshotJpaRepository ledgerSnapshotJpaRepository;
    private final RiskEngine riskEngine;
    private final RiskStatePersistenceService riskStatePersistenceService;
    private final AuditLog auditLog;
    private final EngineReadiness engineReadiness;
    private final Clock clock;
    private final LedgerSnapshotMapper ledgerSnapshotMapper = Mappers.getMapper(LedgerSnapshotMapper.class);

    public LedgerSnapshotService(
            PositionLedger positionLedger,
            LedgerSnapshotJpaRepository ledgerSnapshotJpaRepository,
            RiskEngine riskEngine,
            RiskStatePersistenceService riskStatePersistenceService,
            AuditLog auditLog,
            EngineReadiness engineReadiness,
            Clock clock) {
        this.positionLedger = positionLedger;
        this.ledgerSnapshotJpaRepository = ledgerSnapshotJpaRepository;
        this.riskEngine = riskEngine;
        this.riskStatePersistenceService = riskStatePersistenceService;
        this.auditLog = auditLog;
        this.engineReadiness = engineReadiness;
        this.clock = clock;
    }

    @Scheduled(
            initialDelayString = "${tradeguard.ledger.snapshot-interval-ms:60000}",
            fixedDelayString = "${tradeguard.ledger.snapshot-interval-ms:60000}")
    public void scheduledSnapshot() {
        if (engineReadiness.state() != ReadinessState.READY) {
            return;
        }
        takeSnapshot();
    }

    @PreDestroy
    public void onShutdown() {
        if (engineReadiness.state() != ReadinessState.READY) {
            log.warn("Skipping shutdown snapshot, engine is {}", engineReadiness.state());
            return;
        }
        try {
            takeSnapshot();
        } catch (RuntimeException e) {
            log.error("Shutdown snapshot failed: {}", e.getMessage(), e);
        }
    }

    public LedgerSnapshot takeSnapshot() {
        LedgerSnapshot snapshot = LedgerSnapshot.builder()
                .auditSequence(auditLog.lastSequence())
                .positions(positionLedger.snapshot())
                .takenAt(clock.instant())
                .build();
        LedgerSnapshotEntity saved = ledgerSnapshotJpaRepository.save(ledgerSnapshotMapper.toEntity(snapshot));
        riskStatePersistenceService.save(riskEngine.state());
        int dropped = ledgerSnapshotJpaRepository.deleteOlderThan(saved.getId());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("snapshotId", saved.getId());
        body.put("auditSequence", snapshot.getAuditSequence());
        body.put("positions", snapshot.getPositions().size());
        auditLog.append(AuditEventType.LEDGER_SNAPSHOT, body);

        log.info(
                "Ledger snapshot {} saved: {} positions at audit sequence {} ({} older dropped)",
                saved.getId(),
                snapshot.getPositions().size(),
                snapshot.getAuditSequence(),
                dropped);
        return ledgerSnapshotMapper.toDomain(saved);
    }

    public Optional<LedgerSnapshot> latest() {
        return ledgerSnapshotJpaRepository.findTopByOrderByIdDesc().map(ledgerSnapshotMapper::toDomain);
    }
}
