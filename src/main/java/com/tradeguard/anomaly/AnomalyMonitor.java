package com.tradeguard.anomaly;

import com.tradeguard.audit.AuditLog;
import com.tradeguard.config.AnomalyProperties;
import com.tradeguard.domain.enums.AnomalyType;
import com.tradeguard.domain.enums.AuditEventType;
import com.tradeguard.domain.model.AnomalyEvent;
import com.tradeguard.domain.model.MarketContext;
import com.tradeguard.domain.model.Signal;
import com.tradeguard.event.EventPublisherHelper;
import com.tradeguard.event.MarketDataEvent;
import com.tradeguard.exception.FxRateUnavailableException;
import com.tradeguard.ledger.LedgerValuation;
import com.tradeguard.ledger.PositionLedger;
import com.tradeguard.marketdata.MarketContextProvider;
import com.tradeguard.risk.RiskEngine;
import com.tradeguard.risk.RiskStateUpdate;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Background side of anomaly detection. Kept off the trading hot path.
 *
 * <p>Signals are offered to a bounded queue (market-data listeners only enqueue) and drained
 * on a fixed delay together with a portfolio P&L sample taken from the ledger. The same pass
 * pushes a fresh valuation into the risk engine, so unrealized P&L counts toward the daily
 * loss limit.
 *
 * <p>Every anomaly, whether detected here or reported by reconciliation, the cancellation
 * watchdog or fill processing, goes through {@link #report}: audited, handed to
 * {@link RiskEngine#evaluate}, then published.
 */
@Service
public class AnomalyMonitor {

    private static final Logger log = LoggerFactory.getLogger(AnomalyMonitor.class);

    static final String PORTFOLIO_KEY = "portfolio";

    private final AnomalyDetector anomalyDetector;
    private final RiskEngine riskEngine;
    private final AuditLog auditLog;
    private final PositionLedger positionLedger;
    private final MarketContextProvider marketContextProvider;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final BlockingQueue<Signal> signals;
    private final AtomicLong droppedSignals = new AtomicLong();

    public AnomalyMonitor(
            AnomalyDetector anomalyDetector,
            RiskEngine riskEngine,
            AuditLog auditLog,
            PositionLedger positionLedger,
            MarketContextProvider marketContextProvider,
            EventPublisherHelper eventPublisherHelper,
            AnomalyProperties properties,
            Clock clock) {
        this.anomalyDetector = anomalyDetector;
        this.riskEngine = riskEngine;
        this.auditLog = auditLog;
        this.positionLedger = positionLedger;
        this.marketContextProvider = marketContextProvider;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
        this.signals = new ArrayBlockingQueue<>(properties.getSignalQueueCapacity());
    }

    // ========================
    // INTAKE
    // ========================

    /** Enqueues a signal without blocking. Returns false when the queue is full. */
    public boolean submit(Signal signal) {
        if (signals.offer(signal)) {
            return true;
        }
        long dropped = droppedSignals.incrementAndGet();
        if (dropped % 1000 == 1) {
            log.warn("Anomaly signal queue full, {} signals dropped so far", dropped);
        }
        return false;
    }

    @EventListener
    public void onMarketData(MarketDataEvent event) {
        MarketContext context = event.getContext();
        Instant now = clock.instant();
        String feedKey = "feed:" + context.getSymbol();

        if (context.markPrice() != null) {
            submit(Signal.price(context.getSymbol(), context.markPrice().doubleValue(), now));
        }
        if (context.getLatencyMs() > 0) {
            submit(Signal.latency(feedKey, context.getLatencyMs(), now));
        }
        if (context.getObservedAt() != null) {
            submit(Signal.clock(feedKey, context.getObservedAt(), now));
        }
    }

    // ========================
    // DRAIN
    // ========================

    @Scheduled(fixedDelayString = "${tradeguard.anomaly.monitor-interval-ms:1000}")
    public void scheduledPass() {
        samplePortfolio();
        drain();
    }

    /** Processes every queued signal. Returns the anomalies raised. */
    public List<AnomalyEvent> drain() {
        List<Signal> batch = new ArrayList<>();
        signals.drainTo(batch);

        List<AnomalyEvent> raised = new ArrayList<>();
        for (Signal signal : batch) {
            Optional<AnomalyEvent> anomaly = anomalyDetector.observe(signal);
            if (anomaly.isPresent()) {
                report(anomaly.get());
                raised.add(anomaly.get());
            }
        }
        return raised;
    }

    /**
     * Values the ledger at current marks, pushes the valuation to the risk engine and queues a
     * portfolio P&L signal.
     */
    public void samplePortfolio() {
        LedgerValuation valuation;
        try {
            valuation = positionLedger.valuation(symbol ->
                    marketContextProvider.current(symbol).map(MarketContext::markPrice).orElse(null));
        } catch (FxRateUnavailableException e) {
            log.error("Portfolio valuation failed: {}", e.getMessage());
            report(anomalyDetector.fatal(AnomalyType.FX_UNAVAILABLE, PORTFOLIO_KEY, 1, e.getMessage()));
            return;
        }
        if (valuation.isStaleRates()) {
            log.warn("Portfolio valued with stale FX rates");
        }

        riskEngine.evaluate(RiskStateUpdate.valuation(valuation.getUnrealizedPnl(), valuation.getExposureBySymbol()));
        submit(Signal.pnl(PORTFOLIO_KEY, valuation.totalPnl().doubleValue(), clock.instant()));
    }

    // ========================
    // REPORT
    // ========================

    /** Audits the anomaly, lets the risk engine act on it, then publishes it. */
    public void report(AnomalyEvent anomaly) {
        if (anomaly.tripsKillSwitch()) {
            log.error("Anomaly {} on {} requires a trip: {}", anomaly.getType(), anomaly.getKey(), anomaly.getDetail());
        }
        auditLog.append(AuditEventType.ANOMALY, anomaly);
        riskEngine.evaluate(RiskStateUpdate.anomaly(anomaly));
        eventPublisherHelper.publishAnomaly(this, anomaly);
    }

    /** Builds and reports a fatal anomaly raised outside signal processing. */
    public AnomalyEvent reportFatal(AnomalyType type, String key, double magnitude, String detail) {
        AnomalyEvent anomaly = anomalyDetector.fatal(type, key, magnitude, detail);
        report(anomaly);
        return anomaly;
    }

    public int queuedSignals() {
        return signals.size();
    }

    public long droppedSignals() {
        return droppedSignals.get();
    }
}
