package com.tradeguard.risk;

import com.tradeguard.config.StrategyProfileProperties;
import com.tradeguard.config.StrategyProfileProperties.StrategyProfile;
import com.tradeguard.domain.enums.AnomalyType;
import com.tradeguard.domain.enums.TripReason;
import com.tradeguard.domain.model.AnomalyEvent;
import com.tradeguard.domain.model.TradeIntent;
import com.tradeguard.event.EventPublisherHelper;
import com.tradeguard.event.RiskEventType;
import com.tradeguard.event.RiskLevel;
import com.tradeguard.ledger.FxRateService;
import com.tradeguard.ledger.PositionLedger;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pre-trade limits and the single entry point for state changes that may trip the kill switch.
 *
 * <p><b>check</b> runs before every order is created and only reads shared state. It reports
 * every violated limit at once and never adjusts size.
 *
 * <p><b>evaluate</b> takes ledger updates, valuations, anomalies (reconciliation and
 * cancellation failures included) and manual trips. It mutates state under the exclusive lock
 * and trips the switch when:
 * <ul>
 *   <li>realized + unrealized P&L for the day reaches the negative daily loss limit
 *       (DRAWDOWN_BREACH)</li>
 *   <li>an anomaly is fatal or marked auto-pause (ANOMALY, or RECONCILIATION_FAILURE for a
 *       failed reconciliation)</li>
 *   <li>an operator asks for it (MANUAL)</li>
 * </ul>
 *
 * <p>All amounts compared against limits are in the ledger's base currency.
 */
@Service
public class RiskEngine {

    private static final Logger log = LoggerFactory.getLogger(RiskEngine.class);

    private final RiskLimits riskLimits;
    private final RiskStateHolder riskStateHolder;
    private final KillSwitchService killSwitchService;
    private final PositionLedger positionLedger;
    private final FxRateService fxRateService;
    private final StrategyProfileProperties strategyProfileProperties;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public RiskEngine(
            RiskLimits riskLimits,
            RiskStateHolder riskStateHolder,
            KillSwitchService killSwitchService,
            PositionLedger positionLedger,
            FxRateService fxRateService,
            StrategyProfileProperties strategyProfileProperties,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.riskLimits = riskLimits;
        this.riskStateHolder = riskStateHolder;
        this.killSwitchService = killSwitchService;
        this.positionLedger = positionLedger;
        this.fxRateService = fxRateService;
        this.strategyProfileProperties = strategyProfileProperties;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ========================
    // PRE-TRADE CHECK
    // ========================

    /**
     * Checks an order of {@code quantity} at {@code price} for {@code intent} against every
     * limit.
     */
    public RiskDecision check(TradeIntent intent, BigDecimal quantity, BigDecimal price) {
        rollDayIfNeeded();
        RiskStateSnapshot state = riskStateHolder.snapshot();

        if (state.isKillSwitchActive()) {
            return deny(intent, List.of(RiskViolation.of(
                    RiskViolation.KILL_SWITCH_ACTIVE, "Kill switch is tripped (" + state.getTripReason() + ")")));
        }

        List<RiskViolation> violations = new ArrayList<>();
        checkTradingHours(violations);

        String currency = intent.getQuoteCurrency();
        BigDecimal tradeNotional = fxRateService.toBase(quantity.multiply(price), currency);
        checkTradeNotional(intent, tradeNotional, violations);

        BigDecimal projectedQuantity = positionLedger.netQuantity(intent.getSymbol())
                .add(quantity.multiply(intent.getSide().sign()));
        BigDecimal projectedExposure = fxRateService.toBase(projectedQuantity.abs().multiply(price), currency);
        if (riskLimits.getMaxPositionNotional() != null
                && projectedExposure.compareTo(riskLimits.getMaxPositionNotional()) > 0) {
            violations.add(RiskViolation.of(
                    RiskViolation.POSITION_NOTIONAL_EXCEEDED,
                    String.format("Projected %s exposure %s exceeds %s",
                            intent.getSymbol(), projectedExposure.toPlainString(), riskLimits.getMaxPositionNotional())));
        }

        if (riskLimits.getMaxAggregateNotional() != null) {
            BigDecimal currentSymbolExposure =
                    state.getExposureBySymbol().getOrDefault(intent.getSymbol(), BigDecimal.ZERO);
            BigDecimal projectedGross =
                    state.getGrossExposure().subtract(currentSymbolExposure).add(projectedExposure);
            if (projectedGross.compareTo(riskLimits.getMaxAggregateNotional()) > 0) {
                violations.add(RiskViolation.of(
                        RiskViolation.AGGREGATE_NOTIONAL_EXCEEDED,
                        String.format("Projected gross exposure %s exceeds %s",
                                projectedGross.toPlainString(), riskLimits.getMaxAggregateNotional())));
            }
        }

        if (dailyLossBreached(state.getDailyPnl())) {
            violations.add(RiskViolation.of(
                    RiskViolation.DAILY_LOSS_LIMIT_BREACHED,
                    String.format("Daily P&L %s is at or below -%s",
                            state.getDailyPnl().toPlainString(), riskLimits.getDailyLossLimit())));
        }

        return violations.isEmpty() ? RiskDecision.allow() : deny(intent, violations);
    }

    private void checkTradingHours(List<RiskViolation> violations) {
        if (!riskLimits.hasTradingHours()) {
            return;
        }
        LocalTime now = LocalTime.now(clock.withZone(riskLimits.getTradingHoursZone()));
        LocalTime start = riskLimits.getTradingHoursStart();
        LocalTime end = riskLimits.getTradingHoursEnd();
        boolean inside = start.isBefore(end)
                ? !now.isBefore(start) && now.isBefore(end)
                : !now.isBefore(start) || now.isBefore(end);
        if (!inside) {
            violations.add(RiskViolation.of(
                    RiskViolation.OUTSIDE_TRADING_HOURS,
                    "Outside trading hours " + start + "-" + end + " " + riskLimits.getTradingHoursZone()));
        }
    }

    private void checkTradeNotional(TradeIntent intent, BigDecimal notional, List<RiskViolation> violations) {
        BigDecimal limit = riskLimits.getMaxTradeNotional();
        BigDecimal profileLimit = strategyProfileProperties
                .find(intent.getStrategyId())
                .map(StrategyProfile::getMaxTradeNotional)
                .orElse(null);
        if (profileLimit != null && (limit == null || profileLimit.compareTo(limit) < 0)) {
            limit = profileLimit;
        }
        if (limit != null && notional.compareTo(limit) > 0) {
            violations.add(RiskViolation.of(
                    RiskViolation.TRADE_NOTIONAL_EXCEEDED,
                    String.format("Trade notional %s exceeds %s", notional.toPlainString(), limit)));
        }
    }

    private RiskDecision deny(TradeIntent intent, List<RiskViolation> violations) {
        RiskDecision decision = RiskDecision.deny(violations);
        log.warn("Risk denied intent {} ({} {}): {}", intent.getIntentId(), intent.getStrategyId(), intent.getSymbol(), violations);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("intentId", intent.getIntentId());
        details.put("symbol", intent.getSymbol());
        details.put("violations", decision.reasonCodes());
        eventPublisherHelper.publishRiskEvent(
                this, eventTypeOf(violations.get(0)), RiskLevel.WARNING, violations.get(0).getMessage(), details);
        return decision;
    }

    private RiskEventType eventTypeOf(RiskViolation violation) {
        switch (violation.getCode()) {
            case RiskViolation.OUTSIDE_TRADING_HOURS:
                return RiskEventType.OUTSIDE_TRADING_HOURS;
            case RiskViolation.POSITION_NOTIONAL_EXCEEDED:
                return RiskEventType.POSITION_LIMIT_BREACH;
            case RiskViolation.AGGREGATE_NOTIONAL_EXCEEDED:
                return RiskEventType.AGGREGATE_LIMIT_BREACH;
            case RiskViolation.DAILY_LOSS_LIMIT_BREACHED:
                return RiskEventType.DAILY_LOSS_LIMIT_BREACH;
            case RiskViolation.KILL_SWITCH_ACTIVE:
                return RiskEventType.KILL_SWITCH_TRIPPED;
            default:
                return RiskEventType.TRADE_LIMIT_BREACH;
        }
    }

    // ========================
    // STATE UPDATES
    // ========================

    /**
     * Applies a state update and trips the kill switch when it calls for it.
     *
     * @return the state after the update
     */
    public RiskStateSnapshot evaluate(RiskStateUpdate update) {
        rollDayIfNeeded();

        switch (update.getType()) {
            case LEDGER: {
                BigDecimal dailyPnl =
                        riskStateHolder.applyLedger(
                                update.getSymbol(), update.getRealizedPnl(), update.getSymbolExposure(), update.getFillSequence());
                tripOnDrawdown(dailyPnl);
                break;
            }
            case VALUATION: {
                BigDecimal dailyPnl =
                        riskStateHolder.applyValuation(update.getUnrealizedPnl(), update.getExposureBySymbol());
                tripOnDrawdown(dailyPnl);
                break;
            }
            case ANOMALY:
                onAnomaly(update.getAnomaly());
                break;
            case MANUAL_TRIP:
                killSwitchService.trip(TripReason.MANUAL, update.getDetail());
                break;
            default:
                throw new IllegalArgumentException("Unsupported risk update " + update.getType());
        }
        return riskStateHolder.snapshot();
    }

    private void onAnomaly(AnomalyEvent anomaly) {
        riskStateHolder.recordAnomalyCount(anomaly.getRecentCount());
        if (!anomaly.tripsKillSwitch()) {
            return;
        }
        TripReason reason =
                anomaly.getType() == AnomalyType.RECONCILIATION_FAIL ? TripReason.RECONCILIATION_FAILURE : TripReason.ANOMALY;
        killSwitchService.trip(reason, anomaly.getType() + " " + anomaly.getKey() + ": " + anomaly.getDetail());
    }

    private void tripOnDrawdown(BigDecimal dailyPnl) {
        if (dailyLossBreached(dailyPnl) && !riskStateHolder.isTripped()) {
            log.error("Daily loss limit breached: P&L {} vs limit {}", dailyPnl.toPlainString(), riskLimits.getDailyLossLimit());
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.DAILY_LOSS_LIMIT_BREACH,
                    RiskLevel.CRITICAL,
                    "Daily P&L " + dailyPnl.toPlainString() + " breached limit " + riskLimits.getDailyLossLimit());
            killSwitchService.trip(
                    TripReason.DRAWDOWN_BREACH,
                    "Daily P&L " + dailyPnl.toPlainString() + " <= -" + riskLimits.getDailyLossLimit());
        }
    }

    private boolean dailyLossBreached(BigDecimal dailyPnl) {
        return riskLimits.getDailyLossLimit() != null
                && dailyPnl.compareTo(riskLimits.getDailyLossLimit().negate()) <= 0;
    }

    private void rollDayIfNeeded() {
        LocalDate today = LocalDate.now(clock);
        if (!today.equals(riskStateHolder.tradingDay()) && riskStateHolder.rollTo(today)) {
            log.info("Risk counters rolled to trading day {}", today);
        }
    }

    public RiskStateSnapshot state() {
        return riskStateHolder.snapshot();
    }

    public RiskLimits limits() {
        return riskLimits;
    }
}
