package com.tradeguard.oms;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tradeguard.audit.AuditLog;
import com.tradeguard.config.PipelineProperties;
import com.tradeguard.domain.enums.AuditEventType;
import com.tradeguard.domain.enums.IntentStatus;
import com.tradeguard.domain.enums.OrderStatus;
import com.tradeguard.domain.enums.RejectReason;
import com.tradeguard.domain.model.EvDecision;
import com.tradeguard.domain.model.MarketContext;
import com.tradeguard.domain.model.Order;
import com.tradeguard.domain.model.OrderHandle;
import com.tradeguard.domain.model.OrderRequest;
import com.tradeguard.domain.model.TradeIntent;
import com.tradeguard.ev.EvGate;
import com.tradeguard.event.EventPublisherHelper;
import com.tradeguard.exception.BaseException;
import com.tradeguard.exception.ValidationException;
import com.tradeguard.exception.VenueException;
import com.tradeguard.fee.FeeTaxModel;
import com.tradeguard.ledger.FxRateService;
import com.tradeguard.marketdata.MarketContextProvider;
import com.tradeguard.recovery.EngineReadiness;
import com.tradeguard.risk.KillSwitchService;
import com.tradeguard.risk.RiskDecision;
import com.tradeguard.risk.RiskEngine;
import com.tradeguard.risk.RiskViolation;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for trade intents from strategies, whether in-process or over REST.
 *
 * <p>Processing order:
 * <ol>
 *   <li>Readiness gate: refused while recovering or after a chain integrity failure</li>
 *   <li>Validation: malformed intents are audited and rejected, never retried</li>
 *   <li>Idempotency: a known intent id replays its first outcome without side effects</li>
 *   <li>On the intent's symbol lane: EV gate, risk check, execution (fills, ledger, risk
 *       evaluation)</li>
 * </ol>
 *
 * <p>Everything after validation runs on the {@link SymbolSequencer}, so two intents on the
 * same symbol never interleave and the risk check sees the position left by the previous one.
 */
@Service
public class TradeIntentPipeline {

    private static final Logger log = LoggerFactory.getLogger(TradeIntentPipeline.class);

    private final EngineReadiness engineReadiness;
    private final IntentValidator intentValidator;
    private final SymbolSequencer symbolSequencer;
    private final MarketContextProvider marketContextProvider;
    private final EvGate evGate;
    private final FeeTaxModel feeTaxModel;
    private final RiskEngine riskEngine;
    private final KillSwitchService killSwitchService;
    private final ExecutionVenue executionVenue;
    private final OrderRegistry orderRegistry;
    private final FxRateService fxRateService;
    private final AuditLog auditLog;
    private final EventPublisherHelper eventPublisherHelper;
    private final PipelineProperties properties;

    private final Cache<String, CompletableFuture<IntentOutcome>> outcomes;

    public TradeIntentPipeline(
            EngineReadiness engineReadiness,
            IntentValidator intentValidator,
            SymbolSequencer symbolSequencer,
            MarketContextProvider marketContextProvider,
            EvGate evGate,
            FeeTaxModel feeTaxModel,
            RiskEngine riskEngine,
            KillSwitchService killSwitchService,
            ExecutionVenue executionVenue,
            OrderRegistry orderRegistry,
            FxRateService fxRateService,
            AuditLog auditLog,
            EventPublisherHelper eventPublisherHelper,
            PipelineProperties properties) {
        this.engineReadiness = engineReadiness;
        this.intentValidator = intentValidator;
        this.symbolSequencer = symbolSequencer;
        this.marketContextProvider = marketContextProvider;
        this.evGate = evGate;
        this.feeTaxModel = feeTaxModel;
        this.riskEngine = riskEngine;
        this.killSwitchService = killSwitchService;
        this.executionVenue = executionVenue;
        this.orderRegistry = orderRegistry;
        this.fxRateService = fxRateService;
        this.auditLog = auditLog;
        this.eventPublisherHelper = eventPublisherHelper;
        this.properties = properties;
        this.outcomes = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMillis(properties.getOutcomeRetentionMs()))
                .maximumSize(100_000)
                .build();
    }

    // ========================
    // SUBMIT
    // ========================

    /**
     * Runs {@code intent} through the pipeline and waits for its outcome.
     *
     * @throws ValidationException if the intent is malformed
     * @throws VenueException if the intent did not finish within the intent timeout; it keeps
     *         running and a resubmission returns its outcome
     */
    public IntentOutcome submit(TradeIntent intent) {
        long startedNanos = System.nanoTime();
        engineReadiness.requireReady();

        try {
            intentValidator.validate(intent);
        } catch (ValidationException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("intentId", intent != null ? intent.getIntentId() : null);
            body.put("reason", RejectReason.VALIDATION_FAILED.name());
            body.put("detail", e.getMessage());
            auditLog.append(AuditEventType.INTENT_REJECTED, body);
            log.warn("Rejected intent: {}", e.getMessage());
            throw e;
        }

        CompletableFuture<IntentOutcome> pending = new CompletableFuture<>();
        CompletableFuture<IntentOutcome> existing = outcomes.asMap().putIfAbsent(intent.getIntentId(), pending);
        if (existing != null) {
            log.info("Duplicate intent {}, replaying its outcome", intent.getIntentId());
            return await(intent, existing).asDuplicate();
        }

        symbolSequencer.submit(intent.getSymbol(), () -> process(intent)).whenComplete((outcome, error) -> {
            if (error != null) {
                outcomes.invalidate(intent.getIntentId());
                pending.completeExceptionally(error);
            } else {
                pending.complete(outcome);
                eventPublisherHelper.publishIntentProcessed(this, outcome, startedNanos);
            }
        });
        return await(intent, pending);
    }

    private IntentOutcome await(TradeIntent intent, CompletableFuture<IntentOutcome> future) {
        try {
            return future.get(properties.getIntentTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new VenueException(
                    "Intent " + intent.getIntentId() + " still executing after " + properties.getIntentTimeoutMs() + "ms",
                    Map.<String, Object>of("intentId", intent.getIntentId()));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BaseException) {
                throw (BaseException) cause;
            }
            throw new VenueException("Intent " + intent.getIntentId() + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VenueException("Interrupted waiting for intent " + intent.getIntentId(), e);
        }
    }

    // ========================
    // LANE PROCESSING
    // ========================

    IntentOutcome process(TradeIntent intent) {
        Optional<OrderHandle> known = orderRegistry.findByIntent(intent.getIntentId());
        if (known.isPresent()) {
            log.info("Intent {} already has order {}", intent.getIntentId(), known.get().orderId());
            return fromHandle(intent, null, known.get().asDuplicate());
        }

        Optional<MarketContext> context = marketContextProvider.current(intent.getSymbol());
        if (context.isEmpty()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("intentId", intent.getIntentId());
            body.put("reason", RejectReason.NO_MARKET_DATA.name());
            body.put("symbol", intent.getSymbol());
            auditLog.append(AuditEventType.INTENT_REJECTED, body);
            log.warn("Intent {} rejected: no market context for {}", intent.getIntentId(), intent.getSymbol());
            return IntentOutcome.builder()
                    .intentId(intent.getIntentId())
                    .status(IntentStatus.ORDER_REJECTED)
                    .rejectReason(RejectReason.NO_MARKET_DATA)
                    .detail("no market context for " + intent.getSymbol())
                    .fills(List.of())
                    .build();
        }

        EvDecision decision = evGate.evaluate(intent, feeTaxModel, context.get());
        auditLog.append(AuditEventType.EV_DECISION, decision);
        if (!decision.approved()) {
            return IntentOutcome.builder()
                    .intentId(intent.getIntentId())
                    .status(IntentStatus.EV_REJECTED)
                    .rejectReason(RejectReason.EV_BELOW_THRESHOLD)
                    .detail("expected value " + decision.getExpectedValue() + " below minimum " + decision.getMinimumEv())
                    .evDecision(decision)
                    .fills(List.of())
                    .build();
        }

        RiskDecision riskDecision =
                riskEngine.check(intent, decision.getApprovedQuantity(), intent.getReferencePrice());
        if (riskDecision.isDenied()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("intentId", intent.getIntentId());
            body.put("strategyId", intent.getStrategyId());
            body.put("symbol", intent.getSymbol());
            body.put("quantity", decision.getApprovedQuantity());
            body.put("reasonCodes", riskDecision.reasonCodes());
            body.put("violations", riskDecision.getViolations().stream().map(RiskViolation::toString).toList());
            auditLog.append(AuditEventType.RISK_DENIAL, body);
            boolean killSwitch = riskDecision.hasViolation(RiskViolation.KILL_SWITCH_ACTIVE);
            return IntentOutcome.builder()
                    .intentId(intent.getIntentId())
                    .status(IntentStatus.RISK_DENIED)
                    .rejectReason(killSwitch ? RejectReason.KILL_SWITCH_ACTIVE : RejectReason.RISK_DENIED)
                    .detail(riskDecision.getViolations().toString())
                    .evDecision(decision)
                    .riskViolations(riskDecision.reasonCodes())
                    .fills(List.of())
                    .build();
        }

        String currency = intent.getQuoteCurrency() != null ? intent.getQuoteCurrency() : fxRateService.baseCurrency();
        OrderHandle handle = executionVenue.submit(
                OrderRequest.from(intent, decision, currency), killSwitchService.currentToken());
        return fromHandle(intent, decision, handle);
    }

    private IntentOutcome fromHandle(TradeIntent intent, EvDecision decision, OrderHandle handle) {
        Order order = handle.getOrder();
        IntentStatus status = statusOf(order);
        String detail = order.getRejectDetail();
        if (detail == null && order.getRejectReason() != null) {
            detail = order.getRejectReason().name();
        }
        log.info(
                "Intent {} finished {}: order {} {} filled {}/{}",
                intent.getIntentId(),
                status,
                order.getId(),
                order.getStatus(),
                order.getFilledQuantity(),
                order.getQuantity());
        return IntentOutcome.builder()
                .intentId(intent.getIntentId())
                .status(status)
                .rejectReason(order.getRejectReason())
                .detail(detail)
                .evDecision(decision)
                .order(order)
                .fills(handle.getFills())
                .duplicate(handle.isDuplicate())
                .build();
    }

    static IntentStatus statusOf(Order order) {
        OrderStatus status = order.getStatus();
        switch (status) {
            case FILLED:
                return IntentStatus.EXECUTED;
            case CANCELED:
                return order.getFilledQuantity().signum() > 0 ? IntentStatus.PARTIALLY_EXECUTED : IntentStatus.ORDER_CANCELED;
            case REJECTED:
                return IntentStatus.ORDER_REJECTED;
            default:
                return IntentStatus.ORDER_WORKING;
        }
    }
}
