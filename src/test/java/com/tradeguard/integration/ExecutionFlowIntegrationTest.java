package com.tradeguard.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.tradeguard.domain.enums.AuditEventType;
import com.tradeguard.domain.enums.ConfirmationAction;
import com.tradeguard.domain.enums.IntentStatus;
import com.tradeguard.domain.enums.KillSwitchState;
import com.tradeguard.domain.enums.OrderSide;
import com.tradeguard.domain.enums.RejectReason;
import com.tradeguard.domain.enums.TripReason;
import com.tradeguard.exception.UnauthorizedException;
import com.tradeguard.oms.CancelAllReport;
import com.tradeguard.oms.IntentOutcome;
import com.tradeguard.risk.KillSwitchResult;
import com.tradeguard.risk.RiskLimits;
import com.tradeguard.risk.RiskStatePersistenceService;
import com.tradeguard.support.EngineHarness;
import com.tradeguard.support.InMemoryAuditStore;
import com.tradeguard.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * End-to-end intent flow through the real EV gate, risk engine, paper venue, ledger and audit
 * log: a losing round trip breaches the daily loss limit, the kill switch trips and blocks
 * intake, and a two-operator reset only reopens trading once the loss rolls off.
 */
class ExecutionFlowIntegrationTest {

    private static final Instant MORNING = Instant.parse("2026-03-02T10:00:00Z");

    private InMemoryAuditStore auditStore;
    private EngineHarness engine;

    @BeforeEach
    void setUp() {
        auditStore = new InMemoryAuditStore();
        RiskLimits limits = RiskLimits.builder()
                .maxTradeNotional(new BigDecimal("1000"))
                .maxPositionNotional(new BigDecimal("1000"))
                .maxAggregateNotional(new BigDecimal("5000"))
                .dailyLossLimit(new BigDecimal("100"))
                .build();
        engine = new EngineHarness(
                auditStore, new MutableClock(MORNING), limits, mock(RiskStatePersistenceService.class));
        engine.quote("BTCUSDT", "100");
        engine.readiness.markReady();
    }

    @Test
    @DisplayName("Approved intent fills on the paper venue and lands in the ledger and audit chain")
    void approvedIntent_executesAndIsAudited() {
        IntentOutcome outcome = engine.pipeline.submit(engine.intent("i-1", OrderSide.BUY, "2", "100"));

        assertThat(outcome.getStatus()).isEqualTo(IntentStatus.EXECUTED);
        assertThat(outcome.getFills()).hasSize(1);
        assertThat(outcome.getFills().get(0).getPrice()).isEqualByComparingTo("100");
        assertThat(engine.ledger.netQuantity("BTCUSDT")).isEqualByComparingTo("2");
        assertThat(engine.riskEngine.state().getExposureBySymbol().get("BTCUSDT")).isEqualByComparingTo("200");

        assertThat(auditStore.rowsOfType(AuditEventType.EV_DECISION)).hasSize(1);
        assertThat(auditStore.rowsOfType(AuditEventType.FILL)).hasSize(1);
        assertThat(auditStore.rowsOfType(AuditEventType.ORDER_TRANSITION)).isNotEmpty();
        assertThat(engine.auditLog.verifyChain().isValid()).isTrue();
    }

    @Test
    @DisplayName("Resubmitting an intent replays its outcome without a second order")
    void duplicateIntent_replaysOutcome() {
        IntentOutcome first = engine.pipeline.submit(engine.intent("i-1", OrderSide.BUY, "2", "100"));
        IntentOutcome second = engine.pipeline.submit(engine.intent("i-1", OrderSide.BUY, "2", "100"));

        assertThat(second.isDuplicate()).isTrue();
        assertThat(second.getOrder().getId()).isEqualTo(first.getOrder().getId());
        assertThat(engine.ledger.netQuantity("BTCUSDT")).isEqualByComparingTo("2");
        assertThat(auditStore.rowsOfType(AuditEventType.FILL)).hasSize(1);
    }

    @Test
    @DisplayName("Daily loss breach trips the kill switch, blocks intake, and reset waits for the next day")
    void dailyLossBreach_tripBlockReset() {
        assertThat(engine.pipeline.submit(engine.intent("i-1", OrderSide.BUY, "2", "100")).getStatus())
                .isEqualTo(IntentStatus.EXECUTED);

        // Fill booked before the trip: the losing sell itself completes.
        IntentOutcome sell = engine.pipeline.submit(engine.intent("i-2", OrderSide.SELL, "2", "40"));
        assertThat(sell.getStatus()).isEqualTo(IntentStatus.EXECUTED);
        assertThat(engine.ledger.position("BTCUSDT").get().getRealizedPnl()).isEqualByComparingTo("-120");

        assertThat(engine.killSwitchService.isTripped()).isTrue();
        assertThat(engine.holder.tripReason()).isEqualTo(TripReason.DRAWDOWN_BREACH);
        assertThat(engine.killSwitchService.currentToken().isCancelled()).isTrue();
        assertThat(auditStore.rowsOfType(AuditEventType.RISK_STATE_CHANGE)).hasSize(1);

        IntentOutcome blocked = engine.pipeline.submit(engine.intent("i-3", OrderSide.BUY, "1", "100"));
        assertThat(blocked.getStatus()).isEqualTo(IntentStatus.RISK_DENIED);
        assertThat(blocked.getRejectReason()).isEqualTo(RejectReason.KILL_SWITCH_ACTIVE);
        assertThat(auditStore.rowsOfType(AuditEventType.RISK_DENIAL)).hasSize(1);

        CancelAllReport report = engine.orderCancellationService.cancelAll("DRAWDOWN_BREACH");
        assertThat(report.isComplete()).isTrue();
        assertThat(report.getRequested()).isZero();

        KillSwitchResult reset = engine.killSwitchService.reset(
                "reset-1", EngineHarness.confirmations(ConfirmationAction.RESET, "reset-1"), "loss reviewed");
        assertThat(reset.isChanged()).isTrue();
        assertThat(reset.getState()).isEqualTo(KillSwitchState.ARMED);

        // Still the same day: the realized loss keeps new risk out.
        IntentOutcome sameDay = engine.pipeline.submit(engine.intent("i-4", OrderSide.BUY, "1", "100"));
        assertThat(sameDay.getStatus()).isEqualTo(IntentStatus.RISK_DENIED);
        assertThat(sameDay.getRiskViolations()).contains("DAILY_LOSS_LIMIT_BREACHED");

        engine.clock.advance(Duration.ofDays(1));
        engine.quote("BTCUSDT", "100");
        IntentOutcome nextDay = engine.pipeline.submit(engine.intent("i-5", OrderSide.BUY, "1", "100"));
        assertThat(nextDay.getStatus()).isEqualTo(IntentStatus.EXECUTED);
        assertThat(engine.riskEngine.state().getDailyRealizedPnl()).isZero();

        assertThat(engine.auditLog.verifyChain().isValid()).isTrue();
    }

    @Test
    @DisplayName("Manual kill needs two operators and stops the next intent")
    void manualKill_requiresTwoOperators() {
        assertThatThrownBy(() -> engine.killSwitchService.manualTrip(
                        "kill-1",
                        EngineHarness.confirmations(ConfirmationAction.KILL, "kill-1").subList(0, 1),
                        "desk halt"))
                .isInstanceOf(UnauthorizedException.class);
        assertThat(engine.killSwitchService.isTripped()).isFalse();

        engine.killSwitchService.manualTrip(
                "kill-2", EngineHarness.confirmations(ConfirmationAction.KILL, "kill-2"), "desk halt");

        IntentOutcome outcome = engine.pipeline.submit(engine.intent("i-1", OrderSide.BUY, "1", "100"));
        assertThat(outcome.getStatus()).isEqualTo(IntentStatus.RISK_DENIED);
        assertThat(outcome.getRejectReason()).isEqualTo(RejectReason.KILL_SWITCH_ACTIVE);
        assertThat(engine.ledger.position("BTCUSDT")).isEmpty();
    }
}
