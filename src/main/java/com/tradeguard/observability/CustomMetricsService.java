package com.tradeguard.observability;

import com.tradeguard.anomaly.AnomalyMonitor;
import com.tradeguard.domain.enums.IntentStatus;
import com.tradeguard.event.AnomalyDetectedEvent;
import com.tradeguard.event.IntentProcessedEvent;
import com.tradeguard.event.OrderEvent;
import com.tradeguard.event.ReconciliationEvent;
import com.tradeguard.event.RiskEvent;
import com.tradeguard.event.RiskEventType;
import com.tradeguard.risk.RiskStateHolder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the engine's Micrometer metrics:
 * <ul>
 *   <li><b>intents.processed</b> (counter): every intent that reached an outcome</li>
 *   <li><b>intents.ev.rejected</b> / <b>intents.risk.denied</b> (counters)</li>
 *   <li><b>intent.latency</b> (timer): pipeline entry to outcome</li>
 *   <li><b>orders.filled</b> / <b>orders.rejected</b> / <b>orders.canceled</b> (counters)</li>
 *   <li><b>kill.switch.trips</b> (counter) and <b>kill.switch.state</b> (gauge 0/1)</li>
 *   <li><b>daily.pnl</b> (gauge): realized plus unrealized, base currency</li>
 *   <li><b>anomalies.detected</b> (counter) and <b>anomaly.signals.dropped</b> (gauge)</li>
 *   <li><b>reconciliation.discrepancies</b> (counter)</li>
 * </ul>
 *
 * <p>Gauges are read by Micrometer on scrape. Counters and timers are updated by event
 * listeners that run after the core listeners.
 */
@Service
public class CustomMetricsService {

    private static final Logger log = LoggerFactory.getLogger(CustomMetricsService.class);

    private final Counter intentsProcessedCounter;
    private final Counter evRejectedCounter;
    private final Counter riskDeniedCounter;
    private final Counter ordersFilledCounter;
    private final Counter ordersRejectedCounter;
    private final Counter ordersCanceledCounter;
    private final Counter killSwitchTripCounter;
    private final Counter anomalyCounter;
    private final Counter reconciliationDiscrepancyCounter;
    private final Timer intentLatencyTimer;

    public CustomMetricsService(
            MeterRegistry meterRegistry, RiskStateHolder riskStateHolder, AnomalyMonitor anomalyMonitor) {
        // Counters
        this.intentsProcessedCounter = Counter.builder("intents.processed")
                .description("Trade intents that reached a final outcome")
                .register(meterRegistry);
        this.evRejectedCounter = Counter.builder("intents.ev.rejected")
                .description("Trade intents rejected by the EV gate")
                .register(meterRegistry);
        this.riskDeniedCounter = Counter.builder("intents.risk.denied")
                .description("Trade intents denied by the risk engine")
                .register(meterRegistry);
        this.ordersFilledCounter = Counter.builder("orders.filled")
                .description("Orders completely filled")
                .register(meterRegistry);
        this.ordersRejectedCounter = Counter.builder("orders.rejected")
                .description("Orders rejected by the venue or for missing market data")
                .register(meterRegistry);
        this.ordersCanceledCounter = Counter.builder("orders.canceled")
                .description("Orders canceled by request or by the kill switch")
                .register(meterRegistry);
        this.killSwitchTripCounter = Counter.builder("kill.switch.trips")
                .description("Kill switch trips")
                .register(meterRegistry);
        this.anomalyCounter = Counter.builder("anomalies.detected")
                .description("Anomaly events raised")
                .register(meterRegistry);
        this.reconciliationDiscrepancyCounter = Counter.builder("reconciliation.discrepancies")
                .description("Discrepancies found by trade reconciliation")
                .register(meterRegistry);

        // Timer
        this.intentLatencyTimer = Timer.builder("intent.latency")
                .description("Time from intent submission to final outcome")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(5))
                .register(meterRegistry);

        // Gauges
        meterRegistry.gauge("kill.switch.state", riskStateHolder, holder -> holder.isTripped() ? 1.0 : 0.0);
        meterRegistry.gauge("daily.pnl", riskStateHolder, holder -> holder.snapshot().getDailyPnl().doubleValue());
        meterRegistry.gauge("anomaly.signals.dropped", anomalyMonitor, monitor -> monitor.droppedSignals());
    }

    @EventListener
    @Order(20)
    public void onIntentProcessed(IntentProcessedEvent event) {
        intentsProcessedCounter.increment();
        intentLatencyTimer.record(System.nanoTime() - event.getStartedNanos(), TimeUnit.NANOSECONDS);
        IntentStatus status = event.getOutcome().getStatus();
        if (status == IntentStatus.EV_REJECTED) {
            evRejectedCounter.increment();
        } else if (status == IntentStatus.RISK_DENIED) {
            riskDeniedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onOrderEvent(OrderEvent event) {
        switch (event.getEventType()) {
            case FILLED:
                ordersFilledCounter.increment();
                break;
            case REJECTED:
                ordersRejectedCounter.increment();
                break;
            case CANCELED:
                ordersCanceledCounter.increment();
                break;
            default:
                break;
        }
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        if (event.getEventType() == RiskEventType.KILL_SWITCH_TRIPPED) {
            killSwitchTripCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onAnomaly(AnomalyDetectedEvent event) {
        anomalyCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onReconciliationEvent(ReconciliationEvent event) {
        int discrepancies = event.getReport().getDiscrepancies().size();
        if (discrepancies > 0) {
            reconciliationDiscrepancyCounter.increment(discrepancies);
            log.warn("Reconciliation {} counted {} discrepancies", event.getReport().getRunId(), discrepancies);
        }
    }

    // Expose for testing
    Counter getIntentsProcessedCounter() {
        return intentsProcessedCounter;
    }

    Counter getEvRejectedCounter() {
        return evRejectedCounter;
    }

    Counter getRiskDeniedCounter() {
        return riskDeniedCounter;
    }

    Counter getOrdersFilledCounter() {
        return ordersFilledCounter;
    }

    Counter getOrdersRejectedCounter() {
        return ordersRejectedCounter;
    }

    Counter getOrdersCanceledCounter() {
        return ordersCanceledCounter;
    }

    Counter getKillSwitchTripCounter() {
        return killSwitchTripCounter;
    }

    Counter getAnomalyCounter() {
        return anomalyCounter;
    }

    Counter getReconciliationDiscrepancyCounter() {
        return reconciliationDiscrepancyCounter;
    }

    Timer getIntentLatencyTimer() {
        return intentLatencyTimer;
    }
}
