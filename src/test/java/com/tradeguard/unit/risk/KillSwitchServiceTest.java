package com.tradeguard.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.tradeguard.audit.AuditLog;
import com.tradeguard.config.KillSwitchProperties;
import com.tradeguard.domain.enums.AuditEventType;
import com.tradeguard.domain.enums.ConfirmationAction;
import com.tradeguard.domain.enums.KillSwitchState;
import com.tradeguard.domain.enums.TripReason;
import com.tradeguard.event.EventPublisherHelper;
import com.tradeguard.event.RiskEventType;
import com.tradeguard.event.RiskLevel;
import com.tradeguard.exception.UnauthorizedException;
import com.tradeguard.risk.CancellationToken;
import com.tradeguard.risk.KillSwitchResult;
import com.tradeguard.risk.KillSwitchService;
import com.tradeguard.risk.OperatorConfirmation;
import com.tradeguard.risk.OperatorConfirmationVerifier;
import com.tradeguard.risk.RiskStateHolder;
import com.tradeguard.risk.RiskStatePersistenceService;
import com.tradeguard.risk.RiskStateSnapshot;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for KillSwitchService: trip ordering, idempotency, and operator-confirmed
 * manual trips and resets.
 */
@ExtendWith(MockitoExtension.class)
class KillSwitchServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private RiskStatePersistenceService riskStatePersistenceService;

    @Mock
    private AuditLog auditLog;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private RiskStateHolder holder;
    private KillSwitchService killSwitchService;

    @BeforeEach
    void setUp() {
        KillSwitchProperties properties = new KillSwitchProperties();
        properties.getOperators().put("alice", "alice-secret");
        properties.getOperators().put("bob", "bob-secret");
        holder = new RiskStateHolder();
        killSwitchService = new KillSwitchService(
                holder,
                riskStatePersistenceService,
                new OperatorConfirmationVerifier(properties),
                auditLog,
                eventPublisherHelper,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static OperatorConfirmation confirm(String operator, String secret, ConfirmationAction action, String nonce) {
        return OperatorConfirmation.builder()
                .operatorId(operator)
                .token(OperatorConfirmationVerifier.token(secret, action, nonce))
                .build();
    }

    private static List<OperatorConfirmation> both(ConfirmationAction action, String nonce) {
        return List.of(confirm("alice", "alice-secret", action, nonce), confirm("bob", "bob-secret", action, nonce));
    }

    // ==============================
    // TRIP
    // ==============================

    @Nested
    @DisplayName("Trip")
    class Trip {

        @Test
        @DisplayName("Trip cancels the token and records the transition")
        void trip_cancelsTokenAndRecords() {
            CancellationToken token = killSwitchService.currentToken();

            KillSwitchResult result = killSwitchService.trip(TripReason.DRAWDOWN_BREACH, "daily P&L -250");

            assertThat(result.isChanged()).isTrue();
            assertThat(result.getState()).isEqualTo(KillSwitchState.TRIPPED);
            assertThat(result.getAt()).isEqualTo(NOW);
            assertThat(token.isCancelled()).isTrue();
            assertThat(token.reason()).isEqualTo("DRAWDOWN_BREACH");
            assertThat(killSwitchService.isTripped()).isTrue();

            InOrder order = inOrder(riskStatePersistenceService, auditLog, eventPublisherHelper);
            order.verify(riskStatePersistenceService).save(any(RiskStateSnapshot.class));
            order.verify(auditLog).append(eq(AuditEventType.RISK_STATE_CHANGE), any());
            order.verify(eventPublisherHelper).publishRiskEvent(
                    eq(killSwitchService),
                    eq(RiskEventType.KILL_SWITCH_TRIPPED),
                    eq(RiskLevel.CRITICAL),
                    anyString(),
                    anyMap());
        }

        @Test
        @DisplayName("Second trip keeps the first reason and records nothing")
        void secondTrip_isIdempotent() {
            killSwitchService.trip(TripReason.ANOMALY, "price spike");

            KillSwitchResult second = killSwitchService.trip(TripReason.DRAWDOWN_BREACH, "later");

            assertThat(second.isChanged()).isFalse();
            assertThat(second.getReason()).isEqualTo(TripReason.ANOMALY);
            assertThat(holder.tripReason()).isEqualTo(TripReason.ANOMALY);
            verify(auditLog, times(1)).append(eq(AuditEventType.RISK_STATE_CHANGE), any());
        }

        @Test
        @DisplayName("Manual trip with two operators trips with MANUAL")
        void manualTrip_withTwoOperators_trips() {
            KillSwitchResult result =
                    killSwitchService.manualTrip("n-1", both(ConfirmationAction.KILL, "n-1"), "desk halt");

            assertThat(result.isChanged()).isTrue();
            assertThat(result.getReason()).isEqualTo(TripReason.MANUAL);
            assertThat(result.getOperators()).containsExactly("alice", "bob");
            assertThat(holder.snapshot().getTripDetail()).isEqualTo("desk halt (confirmed by alice,bob)");
        }

        @Test
        @DisplayName("Manual trip with one operator is refused and leaves the switch armed")
        void manualTrip_withOneOperator_refused() {
            List<OperatorConfirmation> single = List.of(confirm("alice", "alice-secret", ConfirmationAction.KILL, "n-2"));

            assertThatThrownBy(() -> killSwitchService.manualTrip("n-2", single, "desk halt"))
                    .isInstanceOf(UnauthorizedException.class);
            assertThat(killSwitchService.isTripped()).isFalse();
            assertThat(killSwitchService.currentToken().isCancelled()).isFalse();
        }
    }

    // ==============================
    // RESET
    // ==============================

    @Nested
    @DisplayName("Reset")
    class Reset {

        @Test
        @DisplayName("Two-operator reset re-arms and issues a fresh token")
        void reset_rearmsWithFreshToken() {
            killSwitchService.trip(TripReason.DRAWDOWN_BREACH, "loss");
            CancellationToken tripped = killSwitchService.currentToken();

            KillSwitchResult result = killSwitchService.reset("r-1", both(ConfirmationAction.RESET, "r-1"), "reviewed");

            assertThat(result.isChanged()).isTrue();
            assertThat(result.getState()).isEqualTo(KillSwitchState.ARMED);
            assertThat(result.getReason()).isEqualTo(TripReason.DRAWDOWN_BREACH);
            assertThat(killSwitchService.isTripped()).isFalse();
            assertThat(tripped.isCancelled()).isTrue();
            assertThat(killSwitchService.currentToken()).isNotSameAs(tripped);
            assertThat(killSwitchService.currentToken().isCancelled()).isFalse();
            verify(auditLog, times(2)).append(eq(AuditEventType.RISK_STATE_CHANGE), any());
        }

        @Test
        @DisplayName("Replayed reset nonce is refused")
        void replayedNonce_refused() {
            killSwitchService.trip(TripReason.MANUAL, "first");
            killSwitchService.reset("r-2", both(ConfirmationAction.RESET, "r-2"), "reviewed");
            killSwitchService.trip(TripReason.MANUAL, "second");

            assertThatThrownBy(() -> killSwitchService.reset("r-2", both(ConfirmationAction.RESET, "r-2"), "again"))
                    .isInstanceOf(UnauthorizedException.class)
                    .hasMessageContaining("already used");
            assertThat(killSwitchService.isTripped()).isTrue();
        }

        @Test
        @DisplayName("Token signed for KILL does not authorize RESET")
        void wrongActionToken_refused() {
            killSwitchService.trip(TripReason.MANUAL, "halt");

            assertThatThrownBy(() -> killSwitchService.reset("r-3", both(ConfirmationAction.KILL, "r-3"), "reviewed"))
                    .isInstanceOf(UnauthorizedException.class);
            assertThat(killSwitchService.isTripped()).isTrue();
        }

        @Test
        @DisplayName("Reset while armed reports no change")
        void resetWhileArmed_unchanged() {
            KillSwitchResult result = killSwitchService.reset("r-4", both(ConfirmationAction.RESET, "r-4"), "noop");

            assertThat(result.isChanged()).isFalse();
            assertThat(result.getState()).isEqualTo(KillSwitchState.ARMED);
            verify(auditLog, never()).append(any(), any());
        }
    }

    @Test
    @DisplayName("Restored TRIPPED state cancels the startup token")
    void syncTokenWithState_cancelsWhenTripped() {
        holder.trip(TripReason.ANOMALY, "persisted", NOW);

        killSwitchService.syncTokenWithState();

        assertThat(killSwitchService.currentToken().isCancelled()).isTrue();
        assertThat(killSwitchService.currentToken().reason()).isEqualTo("RESTORED_TRIPPED");
    }
}
