package com.tradeguard.ev;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tradeguard.config.EvGateProperties;
import com.tradeguard.config.StrategyProfileProperties;
import com.tradeguard.config.StrategyProfileProperties.StrategyProfile;
import com.tradeguard.domain.enums.EvOutcome;
import com.tradeguard.domain.enums.LiquidityRole;
import com.tradeguard.domain.enums.SizingMode;
import com.tradeguard.domain.model.EvDecision;
import com.tradeguard.domain.model.MarketContext;
import com.tradeguard.domain.model.TradeIntent;
import com.tradeguard.domain.vo.FeeTaxEstimate;
import com.tradeguard.fee.FeeTaxModel;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Expected-value gate: approves, resizes or rejects a trade intent before it can reach risk
 * checks or a venue.
 *
 * <p>For a size q (quote currency, price P):
 * <pre>
 *   EV(q) = p_fill x (spreadBps / 1e4) x P x q
 *           - fees(q) - taxes(q)
 *           - latencyPenalty(q)
 *           - slippageBudget(q)
 * </pre>
 * Fees, taxes and the latency penalty are linear in q. The slippage budget grows with q/depth
 * and is therefore quadratic in q, which makes EV concave with EV(0) = 0.
 *
 * <p><b>Policy:</b>
 * <ol>
 *   <li>EV(requested) &gt; minimum EV: APPROVED at the requested size</li>
 *   <li>otherwise the largest size q &lt; requested (a multiple of the quantity step) with
 *       EV(q) &ge; max(minimum EV, 0) and EV(q) &gt; 0: RESIZED</li>
 *   <li>otherwise REJECTED with approved size 0</li>
 * </ol>
 *
 * <p>Decisions are cached by intent id, so re-evaluating an intent returns the first decision
 * unchanged.
 */
@Service
public class EvGate {

    private static final Logger log = LoggerFactory.getLogger(EvGate.class);

    private static final BigDecimal BPS = BigDecimal.valueOf(10_000);
    private static final BigDecimal HUNDRED_MS = BigDecimal.valueOf(100);
    private static final int SCALE = 10;

    private final EvGateProperties properties;
    private final StrategyProfileProperties strategyProfiles;
    private final FillProbabilityModel fillProbabilityModel;
    private final Clock clock;

    private final Cache<String, EvDecision> decisions = Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofHours(6))
            .maximumSize(100_000)
            .build();

    public EvGate(
            EvGateProperties properties,
            StrategyProfileProperties strategyProfiles,
            FillProbabilityModel fillProbabilityModel,
            Clock clock) {
        this.properties = properties;
        this.strategyProfiles = strategyProfiles;
        this.fillProbabilityModel = fillProbabilityModel;
        this.clock = clock;
    }

    /**
     * Evaluates {@code intent} against the current market. Produces exactly one decision per
     * intent id; later calls for the same id return the cached decision.
     */
    public EvDecision evaluate(TradeIntent intent, FeeTaxModel feeTaxModel, MarketContext marketContext) {
        return decisions.get(intent.getIntentId(), id -> decide(intent, feeTaxModel, marketContext));
    }

    // ========================
    // DECISION
    // ========================

    private EvDecision decide(TradeIntent intent, FeeTaxModel feeTaxModel, MarketContext marketContext) {
        BigDecimal spreadBps =
                intent.getExpectedEdgeBps() != null ? intent.getExpectedEdgeBps() : marketContext.spreadBps();
        BigDecimal fillProbability = fillProbabilityModel.estimate(marketContext, spreadBps);
        EvFunction ev = new EvFunction(intent, feeTaxModel, marketContext, spreadBps, fillProbability);

        BigDecimal minimumEv = minimumEvFor(intent.getStrategyId());
        BigDecimal requested = intent.getQuantity();

        EvBreakdown atRequested = ev.at(requested);
        if (atRequested.expectedValue.compareTo(minimumEv) > 0) {
            return toDecision(intent, spreadBps, fillProbability, minimumEv, atRequested, EvOutcome.APPROVED);
        }

        BigDecimal floor = minimumEv.max(BigDecimal.ZERO);
        BigDecimal resized = properties.getSizingMode() == SizingMode.GRID
                ? gridSearch(ev, requested, floor)
                : concaveSearch(ev, requested, floor);

        if (resized != null) {
            EvBreakdown atResized = ev.at(resized);
            log.info(
                    "EV resize for intent {}: {} -> {} (EV {} at requested, {} at resized)",
                    intent.getIntentId(),
                    requested,
                    resized,
                    atRequested.expectedValue,
                    atResized.expectedValue);
            return toDecision(intent, spreadBps, fillProbability, minimumEv, atResized, EvOutcome.RESIZED);
        }

        log.info(
                "EV reject for intent {}: EV {} <= minimum {} and no smaller size qualifies",
                intent.getIntentId(),
                atRequested.expectedValue,
                minimumEv);
        return toDecision(intent, spreadBps, fillProbability, minimumEv, atRequested, EvOutcome.REJECTED);
    }

    private BigDecimal minimumEvFor(String strategyId) {
        return strategyProfiles
                .find(strategyId)
                .map(StrategyProfile::getMinimumEv)
                .orElse(properties.getMinimumEv());
    }

    private EvDecision toDecision(
            TradeIntent intent,
            BigDecimal spreadBps,
            BigDecimal fillProbability,
            BigDecimal minimumEv,
            EvBreakdown breakdown,
            EvOutcome outcome) {
        return EvDecision.builder()
                .intentId(intent.getIntentId())
                .strategyId(intent.getStrategyId())
                .symbol(intent.getSymbol())
                .spreadBps(spreadBps)
                .fillProbability(fillProbability)
                .slippageBps(round(breakdown.slippageBps))
                .slippageCost(round(breakdown.slippageCost))
                .netCost(round(breakdown.feeTax.getTotal()))
                .latencyPenalty(round(breakdown.latencyPenalty))
                .expectedValue(round(breakdown.expectedValue))
                .minimumEv(minimumEv)
                .requestedQuantity(intent.getQuantity())
                .approvedQuantity(outcome == EvOutcome.REJECTED ? BigDecimal.ZERO : breakdown.quantity)
                .outcome(outcome)
                .decidedAt(clock.instant())
                .build();
    }

    // ========================
    // SIZE SEARCH
    // ========================

    /**
     * Largest qualifying size for a concave EV: ternary search for the peak over quantity steps,
     * then binary search on the decreasing side between the peak and the requested size.
     */
    private BigDecimal concaveSearch(EvFunction ev, BigDecimal requested, BigDecimal floor) {
        long steps = stepsIn(requested);
        if (sizeAtSteps(steps).compareTo(requested) >= 0) {
            steps--;
        }
        if (steps < 1) {
            return null;
        }

        long lo = 1;
        long hi = steps;
        while (hi - lo > 2) {
            long m1 = lo + (hi - lo) / 3;
            long m2 = hi - (hi - lo) / 3;
            if (ev.valueAtSteps(m1).compareTo(ev.valueAtSteps(m2)) < 0) {
                lo = m1 + 1;
            } else {
                hi = m2 - 1;
            }
        }
        long peak = lo;
        for (long k = lo + 1; k <= hi; k++) {
            if (ev.valueAtSteps(k).compareTo(ev.valueAtSteps(peak)) > 0) {
                peak = k;
            }
        }
        if (!qualifies(ev.valueAtSteps(peak), floor)) {
            return null;
        }

        long good = peak;
        long bad = steps + 1;
        while (bad - good > 1) {
            long mid = good + (bad - good) / 2;
            if (qualifies(ev.valueAtSteps(mid), floor)) {
                good = mid;
            } else {
                bad = mid;
            }
        }
        return sizeAtSteps(good);
    }

    /** Scans a bounded grid of sizes from the requested size down. Makes no shape assumption. */
    private BigDecimal gridSearch(EvFunction ev, BigDecimal requested, BigDecimal floor) {
        int gridSteps = properties.getGridSteps();
        for (int i = gridSteps - 1; i >= 1; i--) {
            BigDecimal candidate = floorToStep(requested.multiply(BigDecimal.valueOf(i))
                    .divide(BigDecimal.valueOf(gridSteps), SCALE, RoundingMode.DOWN));
            if (candidate.signum() <= 0) {
                break;
            }
            if (qualifies(ev.at(candidate).expectedValue, floor)) {
                return candidate;
            }
        }
        return null;
    }

    private boolean qualifies(BigDecimal expectedValue, BigDecimal floor) {
        return expectedValue.signum() > 0 && expectedValue.compareTo(floor) >= 0;
    }

    private long stepsIn(BigDecimal quantity) {
        return quantity.divide(properties.getQuantityStep(), 0, RoundingMode.DOWN).longValueExact();
    }

    private BigDecimal sizeAtSteps(long steps) {
        return properties.getQuantityStep().multiply(BigDecimal.valueOf(steps)).stripTrailingZeros();
    }

    private BigDecimal floorToStep(BigDecimal quantity) {
        return sizeAtSteps(stepsIn(quantity));
    }

    private static BigDecimal round(BigDecimal value) {
        return value.setScale(8, RoundingMode.HALF_UP);
    }

    // ========================
    // EV FUNCTION
    // ========================

    /** EV as a function of size for one intent and one market snapshot. */
    private final class EvFunction {

        private final TradeIntent intent;
        private final FeeTaxModel feeTaxModel;
        private final BigDecimal price;
        private final BigDecimal edgeFraction;
        private final BigDecimal fillProbability;
        private final BigDecimal latencyBps;
        private final BigDecimal fixedSlippageBps;
        private final BigDecimal depth;

        private EvFunction(
                TradeIntent intent,
                FeeTaxModel feeTaxModel,
                MarketContext context,
                BigDecimal spreadBps,
                BigDecimal fillProbability) {
            this.intent = intent;
            this.feeTaxModel = feeTaxModel;
            this.price = intent.getReferencePrice();
            this.edgeFraction = spreadBps.divide(BPS, SCALE, RoundingMode.HALF_UP);
            this.fillProbability = fillProbability;
            this.latencyBps = BigDecimal.valueOf(context.getLatencyMs())
                    .divide(HUNDRED_MS, SCALE, RoundingMode.HALF_UP)
                    .multiply(properties.getLatencyBpsPer100Ms());
            BigDecimal volatility = context.getVolatilityPct() != null ? context.getVolatilityPct() : BigDecimal.ZERO;
            this.fixedSlippageBps =
                    properties.getSlippageBaseBps().add(properties.getSlippageVolatilityBps().multiply(volatility));
            this.depth = context.getBookDepth();
        }

        BigDecimal valueAtSteps(long steps) {
            return at(sizeAtSteps(steps)).expectedValue;
        }

        EvBreakdown at(BigDecimal quantity) {
            BigDecimal notional = quantity.multiply(price);
            BigDecimal edge = fillProbability.multiply(edgeFraction).multiply(notional);
            FeeTaxEstimate feeTax = feeTaxModel.estimate(intent.getVenues(), notional, LiquidityRole.TAKER);
            BigDecimal latencyPenalty = notional.multiply(latencyBps).divide(BPS, SCALE, RoundingMode.HALF_UP);

            // Unknown depth is treated as an order that consumes the whole book.
            BigDecimal depthShare = depth != null && depth.signum() > 0
                    ? quantity.divide(depth, SCALE, RoundingMode.HALF_UP)
                    : BigDecimal.ONE;
            BigDecimal slippageBps = properties
                    .getSlippageMultiplier()
                    .multiply(fixedSlippageBps.add(properties.getSlippageImpactBps().multiply(depthShare)));
            BigDecimal slippageCost = notional.multiply(slippageBps).divide(BPS, SCALE, RoundingMode.HALF_UP);

            BigDecimal expectedValue = edge.subtract(feeTax.getTotal())
                    .subtract(latencyPenalty)
                    .subtract(slippageCost);
            return new EvBreakdown(quantity, feeTax, latencyPenalty, slippageBps, slippageCost, expectedValue);
        }
    }

    private static final class EvBreakdown {

        private final BigDecimal quantity;
        private final FeeTaxEstimate feeTax;
        private final BigDecimal latencyPenalty;
        private final BigDecimal slippageBps;
        private final BigDecimal slippageCost;
        private final BigDecimal expectedValue;

        private EvBreakdown(
                BigDecimal quantity,
                FeeTaxEstimate feeTax,
                BigDecimal latencyPenalty,
                BigDecimal slippageBps,
                BigDecimal slippageCost,
                BigDecimal expectedValue) {
            this.quantity = quantity;
            this.feeTax = feeTax;
            this.latencyPenalty = latencyPenalty;
            this.slippageBps = slippageBps;
            this.slippageCost = slippageCost;
            this.expectedValue = expectedValue;
        }
    }
}
