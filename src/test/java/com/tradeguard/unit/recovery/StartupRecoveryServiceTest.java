package com.tradeguard.unit.recovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradeguard.anomaly.AnomalyMonitor;
import com.tradeguard.audit.AuditLog;
import com.tradeguard.config.KillSwitchProperties;
import com.tradeguard.config.LedgerProperties;
import com.tradeguard.config.StrategyProfileProperties;
import com.tradeguard.domain.enums.AuditEventType;
import com.tradeguard.domain.enums.KillSwitchState;
import com.tradeguard.domain.enums.LiquidityRole;
import com.tradeguard.domain.enums.OrderSide;
import com.tradeguard.domain.enums.PriceSource;
import com.tradeguard.domain.enums.ReadinessState;
import com.tradeguard.domain.enums.TripReason;
import com.tradeguard.domain.model.AuditEntry;
import com.tradeguard.domain.model.Fill;
import com.tradeguard.domain.model.LedgerSnapshot;
import com.tradeguard.domain.model.LedgerUpdate;
import com.tradeguard.event.EventPublisherHelper;
import com.tradeguard.ledger.FxRateProvider;
import com.tradeguard.ledger.FxRateService;
import com.tradeguard.ledger.PositionLedger;
import com.tradeguard.oms.FillProcessor;
import com.tradeguard.recovery.EngineReadiness;
import com.tradeguard.recovery.LedgerSnapshotService;
import com.tradeguard.recovery.RecoveryResult;
import com.tradeguard.recovery.StartupRecoveryService;
import com.tradeguard.risk.KillSwitchService;
import com.tradeguard.risk.OperatorConfirmationVerifier;
import com.tradeguard.risk.RiskEngine;
import com.tradeguard.risk.RiskLimits;
import com.tradeguard.risk.RiskStateHolder;
import com.tradeguard.risk.RiskStatePersistenceService;
import com.tradeguard.risk.RiskStateSnapshot;
import com.tradeguard.support.InMemoryAuditStore;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for StartupRecoveryService over a real audit log, ledger and kill switch.
 */
@ExtendWith(MockitoExtension.class)
class StartupRecoveryServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final Instant YESTERDAY = Instant.parse("2026-03-01T16:00:00Z");

    @Mock
    private RiskStatePersistenceService riskStatePersistenceService;

    @Mock
    private LedgerSnapshotService ledgerSnapshotService;

    @Mock
    private FillProcessor fillProcessor;

    @Mock
    private AnomalyMonitor anomalyMonitor;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private Clock clock;
    private InMemoryAuditStore auditStore;
    private AuditLog auditLog;
    private FxRateService fxRateService;
    private PositionLedger ledger;
    private RiskStateHolder holder;
    private KillSwitchService killSwitchService;
    private EngineReadiness readiness;
    private StartupRecoveryService recovery;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        auditStore = new InMemoryAuditStore();
        auditLog = auditStore.newAuditLog(clock);
        fxRateService = new FxRateService(new LedgerProperties(), (FxRateProvider) null, clock);
        ledger = new PositionLedger(fxRateService);
        holder = new RiskStateHolder();
        killSwitchService = new KillSwitchService(
                holder,
                riskStatePersistenceService,
                new OperatorConfirmationVerifier(new KillSwitchProperties()),
                auditLog,
                eventPublisherHelper,
                clock);
        RiskEngine riskEngine = new RiskEngine(
                RiskLimits.builder().dailyLossLimit(new BigDecimal("1000")).build(),
                holder,
                killSwitchService,
                ledger,
                fxRateService,
                new StrategyProfileProperties(),
                eventPublisherHelper,
                clock);
        readiness = new EngineReadiness();
        recovery = new StartupRecoveryService(
                auditLog,
                riskStatePersistenceService,
                holder,
                killSwitchService,
                riskEngine,
                ledgerSnapshotService,
                ledger,
                fillProcessor,
                anomalyMonitor,
                readiness,
                clock);
    }

    private static Fill fill(String id, OrderSide side, String price, String quantity, Instant at) {
        return Fill.builder()
                .id(id)
                .orderId("o-" + id)
                .symbol("BTCUSDT")
                .side(side)
                .venue("binance-tr")
                .price(new BigDecimal(price))
                .quantity(new BigDecimal(quantity))
                .fee(BigDecimal.ZERO)
                .currency("USDT")
                .liquidityRole(LiquidityRole.TAKER)
                .priceSource(PriceSource.SIMULATED)
                .timestamp(at)
                .build();
    }

    @Test
    @DisplayName("Empty store recovers ARMED and opens intake")
    void emptyStore_ready() {
        RecoveryResult result = recovery.recover();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getKillSwitchState()).isEqualTo(KillSwitchState.ARMED);
        assertThat(readiness.state()).isEqualTo(ReadinessState.READY);
        assertThat(auditStore.rowsOfType(AuditEventType.RECOVERY)).hasSize(1);
        verify(anomalyMonitor).samplePortfolio();
    }

    @Test
    @DisplayName("Broken audit chain halts the engine")
    void brokenChain_halts() {
        auditLog.append(AuditEventType.RISK_STATE_CHANGE, Map.of("n", 1));
        auditLog.append(AuditEventType.RISK_STATE_CHANGE, Map.of("n", 2));
        auditLog.append(AuditEventType.RISK_STATE_CHANGE, Map.of("n", 3));
        auditStore.remove(1);

        RecoveryResult result = recovery.recover();

        assertThat(result.isSuccess()).isFalse();
        assertThat(readiness.state()).isEqualTo(ReadinessState.HALTED);
        assertThat(readiness.haltReason()).contains("audit chain broken");
        assertThat(auditStore.rowsOfType(AuditEventType.RECOVERY)).isEmpty();
    }

    @Nested
    @DisplayName("Risk State")
    class RiskState {

        @Test
        @DisplayName("Persisted TRIPPED state comes back tripped with a cancelled token")
        void trippedState_restored() {
            RiskStateSnapshot persisted = RiskStateSnapshot.builder()
                    .killSwitchState(KillSwitchState.TRIPPED)
                    .tripReason(TripReason.DRAWDOWN_BREACH)
                    .tripDetail("daily P&L -1200")
                    .trippedAt(NOW.minusSeconds(600))
                    .tradingDay(LocalDate.of(2026, 3, 2))
                    .dailyRealizedPnl(new BigDecimal("-1200"))
                    .build();
            when(riskStatePersistenceService.load()).thenReturn(Optional.of(persisted));

            RecoveryResult result = recovery.recover();

            assertThat(result.isRiskStateRestored()).isTrue();
            assertThat(result.getKillSwitchState()).isEqualTo(KillSwitchState.TRIPPED);
            assertThat(killSwitchService.isTripped()).isTrue();
            assertThat(killSwitchService.currentToken().isCancelled()).isTrue();
            assertThat(holder.snapshot().getDailyRealizedPnl()).isEqualByComparingTo("-1200");
            assertThat(readiness.state()).isEqualTo(ReadinessState.READY);
        }

        @Test
        @DisplayName("State from an earlier day keeps the trip but resets daily P&L")
        void earlierDay_resetsDailyCounters() {
            RiskStateSnapshot persisted = RiskStateSnapshot.builder()
                    .killSwitchState(KillSwitchState.TRIPPED)
                    .tripReason(TripReason.MANUAL)
                    .tradingDay(LocalDate.of(2026, 3, 1))
                    .dailyRealizedPnl(new BigDecimal("-300"))
                    .build();
            when(riskStatePersistenceService.load()).thenReturn(Optional.of(persisted));

            recovery.recover();

            assertThat(holder.isTripped()).isTrue();
            assertThat(holder.tradingDay()).isEqualTo(LocalDate.of(2026, 3, 2));
            assertThat(holder.snapshot().getDailyRealizedPnl()).isZero();
        }
    }

    @Nested
    @DisplayName("Ledger Replay")
    class LedgerReplay {

        @Test
        @DisplayName("Fills after the snapshot are replayed and only today's feed risk")
        void fillsAfterSnapshot_replayed() {
            AuditEntry first = auditLog.append(AuditEventType.FILL, fill("f-1", OrderSide.BUY, "100", "2", YESTERDAY));
            auditLog.append(AuditEventType.FILL, fill("f-2", OrderSide.BUY, "110", "1", YESTERDAY));
            auditLog.append(AuditEventType.FILL, fill("f-3", OrderSide.SELL, "120", "2", NOW.minusSeconds(60)));

            PositionLedger before = new PositionLedger(fxRateService);
            before.apply(fill("f-1", OrderSide.BUY, "100", "2", YESTERDAY), first.getSequence());
            when(ledgerSnapshotService.latest()).thenReturn(Optional.of(LedgerSnapshot.builder()
                    .id(7L)
                    .auditSequence(first.getSequence())
                    .positions(before.snapshot())
                    .takenAt(YESTERDAY)
                    .build()));

            RecoveryResult result = recovery.recover();

            assertThat(result.getSnapshotId()).isEqualTo(7L);
            assertThat(result.getPositionsRestored()).isEqualTo(1);
            assertThat(result.getFillsReplayed()).isEqualTo(2);
            assertThat(ledger.netQuantity("BTCUSDT")).isEqualByComparingTo("1");
            assertThat(ledger.position("BTCUSDT").get().getRealizedPnl()).isEqualByComparingTo("40");

            ArgumentCaptor<LedgerUpdate> todays = ArgumentCaptor.forClass(LedgerUpdate.class);
            verify(fillProcessor, times(1)).afterFill(todays.capture());
            assertThat(todays.getValue().getFillId()).isEqualTo("f-3");
            assertThat(todays.getValue().getRealizedPnl()).isEqualByComparingTo("40");
        }

        @Test
        @DisplayName("Without a snapshot every fill is replayed")
        void noSnapshot_replaysAll() {
            auditLog.append(AuditEventType.FILL, fill("f-1", OrderSide.BUY, "100", "2", YESTERDAY));
            auditLog.append(AuditEventType.FILL, fill("f-2", OrderSide.BUY, "110", "1", YESTERDAY));

            RecoveryResult result = recovery.recover();

            assertThat(result.getFillsReplayed()).isEqualTo(2);
            assertThat(ledger.netQuantity("BTCUSDT")).isEqualByComparingTo("3");
            verify(fillProcessor, never()).afterFill(any());
        }
    }
}
