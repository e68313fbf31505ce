package com.tradeguard.risk;

import com.tradeguard.audit.AuditLog;
import com.tradeguard.domain.enums.AuditEventType;
import com.tradeguard.domain.enums.ConfirmationAction;
import com.tradeguard.domain.enums.KillSwitchState;
import com.tradeguard.domain.enums.TripReason;
import com.tradeguard.event.EventPublisherHelper;
import com.tradeguard.event.RiskEventType;
import com.tradeguard.event.RiskLevel;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Kill-switch state machine: {@code ARMED → TRIPPED → ARMED}.
 *
 * <p>Trip sequence:
 * <ol>
 *   <li>Cancel the current {@link CancellationToken}. This waits out any fill already in
 *       progress and stops every later fill on orders submitted under that token.</li>
 *   <li>Move the shared state to TRIPPED, stamping the trip time. From here every pre-trade
 *       check denies.</li>
 *   <li>Persist the state, append a RISK_STATE_CHANGE audit entry, and publish
 *       KILL_SWITCH_TRIPPED. OrderCancellationService reacts by canceling all open orders
 *       within the cancel deadline.</li>
 * </ol>
 *
 * <p>Tripping is idempotent: a second trip leaves the first reason in place. Re-arming needs
 * signed confirmations from distinct operators and issues a fresh token.
 */
@Service
public class KillSwitchService {

    private static final Logger log = LoggerFactory.getLogger(KillSwitchService.class);

    private final RiskStateHolder riskStateHolder;
    private final RiskStatePersistenceService riskStatePersistenceService;
    private final OperatorConfirmationVerifier confirmationVerifier;
    private final AuditLog auditLog;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final AtomicReference<CancellationToken> currentToken = new AtomicReference<>(new CancellationToken());

    public KillSwitchService(
            RiskStateHolder riskStateHolder,
            RiskStatePersistenceService riskStatePersistenceService,
            OperatorConfirmationVerifier confirmationVerifier,
            AuditLog auditLog,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.riskStateHolder = riskStateHolder;
        this.riskStatePersistenceService = riskStatePersistenceService;
        this.confirmationVerifier = confirmationVerifier;
        this.auditLog = auditLog;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ========================
    // TRIP
    // ========================

    /**
     * Trips the switch. Internal callers (risk engine) use this directly; operators go through
     * {@link #manualTrip}.
     */
    public KillSwitchResult trip(TripReason reason, String detail) {
        currentToken.get().cancel(reason.name());

        Instant trippedAt = clock.instant();
        if (!riskStateHolder.trip(reason, detail, trippedAt)) {
            RiskStateSnapshot state = riskStateHolder.snapshot();
            log.warn("Kill switch already tripped ({}), ignoring {} trip: {}", state.getTripReason(), reason, detail);
            return KillSwitchResult.unchanged(KillSwitchState.TRIPPED, state.getTripReason(), state.getTripDetail());
        }

        log.error("KILL SWITCH TRIPPED: {} - {}", reason, detail);

        riskStatePersistenceService.save(riskStateHolder.snapshot());
        auditLog.append(
                AuditEventType.RISK_STATE_CHANGE,
                transitionBody(KillSwitchState.ARMED, KillSwitchState.TRIPPED, reason, detail, List.of(), trippedAt));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason.name());
        details.put("detail", detail);
        details.put("trippedAt", trippedAt.toString());
        eventPublisherHelper.publishRiskEvent(
                this, RiskEventType.KILL_SWITCH_TRIPPED, RiskLevel.CRITICAL, "Kill switch tripped: " + reason, details);

        return KillSwitchResult.builder()
                .changed(true)
                .state(KillSwitchState.TRIPPED)
                .reason(reason)
                .detail(detail)
                .at(trippedAt)
                .build();
    }

    /** Operator-initiated trip. Needs the same multi-operator confirmation as a reset. */
    public KillSwitchResult manualTrip(String nonce, List<OperatorConfirmation> confirmations, String detail) {
        List<String> operators = confirmationVerifier.verify(ConfirmationAction.KILL, nonce, confirmations);
        KillSwitchResult result = trip(TripReason.MANUAL, detailWithOperators(detail, operators));
        result.setOperators(operators);
        return result;
    }

    // ========================
    // RESET
    // ========================

    /**
     * Re-arms the switch after verifying operator confirmations. Daily counters are left
     * alone: if the loss limit is still breached, the next evaluation trips again.
     */
    public KillSwitchResult reset(String nonce, List<OperatorConfirmation> confirmations, String detail) {
        List<String> operators = confirmationVerifier.verify(ConfirmationAction.RESET, nonce, confirmations);

        TripReason previousReason = riskStateHolder.tripReason();
        if (!riskStateHolder.reset()) {
            log.info("Kill switch reset requested by {} but it is already armed", operators);
            KillSwitchResult result = KillSwitchResult.unchanged(KillSwitchState.ARMED, null, null);
            result.setOperators(operators);
            return result;
        }
        currentToken.set(new CancellationToken());

        Instant at = clock.instant();
        log.warn("Kill switch re-armed by {} (was {}): {}", operators, previousReason, detail);

        riskStatePersistenceService.save(riskStateHolder.snapshot());
        auditLog.append(
                AuditEventType.RISK_STATE_CHANGE,
                transitionBody(KillSwitchState.TRIPPED, KillSwitchState.ARMED, previousReason, detail, operators, at));
        eventPublisherHelper.publishRiskEvent(
                this, RiskEventType.KILL_SWITCH_RESET, RiskLevel.INFO, "Kill switch re-armed by " + operators);

        return KillSwitchResult.builder()
                .changed(true)
                .state(KillSwitchState.ARMED)
                .reason(previousReason)
                .detail(detail)
                .at(at)
                .operators(operators)
                .build();
    }

    // ========================
    // STATE
    // ========================

    public boolean isTripped() {
        return riskStateHolder.isTripped();
    }

    /** Token that execution started now must honor. */
    public CancellationToken currentToken() {
        return currentToken.get();
    }

    /**
     * Aligns the token with restored state: a switch persisted as TRIPPED starts with a
     * cancelled token.
     */
    public void syncTokenWithState() {
        if (riskStateHolder.isTripped()) {
            currentToken.get().cancel("RESTORED_TRIPPED");
        }
    }

    private Map<String, Object> transitionBody(
            KillSwitchState from, KillSwitchState to, TripReason reason, String detail, List<String> operators, Instant at) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("from", from.name());
        body.put("to", to.name());
        body.put("reason", reason != null ? reason.name() : null);
        body.put("detail", detail);
        body.put("operators", operators);
        body.put("at", at);
        return body;
    }

    private String detailWithOperators(String detail, List<String> operators) {
        String prefix = "confirmed by " + String.join(",", operators);
        return detail == null || detail.isBlank() ? prefix : detail + " (" + prefix + ")";
    }
}
