package com.tradeguard.anomaly;

import com.tradeguard.config.AnomalyProperties;
import com.tradeguard.domain.enums.AnomalyType;
import com.tradeguard.domain.enums.SignalType;
import com.tradeguard.domain.model.AnomalyEvent;
import com.tradeguard.domain.model.Signal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Flags statistical outliers and clock drift in the engine's input signals.
 *
 * <p>Per signal:
 * <ul>
 *   <li>PRICE: |z| of the price against the symbol's window above the spike threshold, or
 *       the same price repeated across the stale-feed run length.</li>
 *   <li>PNL: |z| of the P&L sample against its window.</li>
 *   <li>LATENCY: |z| against its window, or any value above the absolute ceiling.</li>
 *   <li>CLOCK: |observedAt − sourceTimestamp| above the skew tolerance. No warm-up.</li>
 * </ul>
 *
 * <p>A window keeps accepting samples until it has its warm-up count; only then is anything
 * flagged. Flagged samples still enter the window.
 *
 * <p>Every anomaly, fatal ones reported through {@link #fatal} included, is remembered for
 * the anomaly window. Once the count inside the window reaches the configured limit, the
 * event is marked auto-pause and the risk engine trips on it.
 */
@Component
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private final AnomalyProperties properties;
    private final Clock clock;

    private final Map<String, RollingStats> windows = new HashMap<>();
    private final Deque<Instant> recentAnomalies = new ArrayDeque<>();

    public AnomalyDetector(AnomalyProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public synchronized Optional<AnomalyEvent> observe(Signal signal) {
        Instant at = signal.getObservedAt() != null ? signal.getObservedAt() : clock.instant();
        switch (signal.getType()) {
            case PRICE:
                return observePrice(signal, at);
            case PNL:
                return observeStatistical(signal, AnomalyType.PNL_SPIKE, properties.getPnlWindow(), properties.getPnlWarmup(), at);
            case LATENCY:
                return observeLatency(signal, at);
            case CLOCK:
                return observeClock(signal, at);
            default:
                throw new IllegalArgumentException("Unsupported signal " + signal.getType());
        }
    }

    /**
     * Builds a fatal anomaly raised outside the statistical path (reconciliation failure,
     * cancellation timeout, missing FX) and counts it toward the anomaly window.
     */
    public synchronized AnomalyEvent fatal(AnomalyType type, String key, double magnitude, String detail) {
        Instant at = clock.instant();
        int recent = remember(at);
        return AnomalyEvent.builder()
                .type(type)
                .key(key)
                .magnitude(magnitude)
                .observedValue(magnitude)
                .recentCount(recent)
                .autoPause(recent >= properties.getConsecutiveAnomalyLimit())
                .detail(detail)
                .timestamp(at)
                .build();
    }

    /** Anomalies currently inside the sliding window. */
    public synchronized int recentCount() {
        evictBefore(clock.instant().minus(Duration.ofMillis(properties.getAnomalyWindowMs())));
        return recentAnomalies.size();
    }

    // ========================
    // PER-SIGNAL CHECKS
    // ========================

    private Optional<AnomalyEvent> observePrice(Signal signal, Instant at) {
        RollingStats stats = window(SignalType.PRICE, signal.getKey(), properties.getPriceWindow());
        double price = signal.getValue();

        if (stats.size() < properties.getPriceWarmup()) {
            stats.add(price);
            return Optional.empty();
        }

        double z = stats.zScore(price);
        int repeats = properties.getStaleFeedRepeats();
        // Fires once per run: when the run first reaches the configured length
        boolean stale = stats.lastRepeats(price, repeats - 1) && !stats.lastRepeats(price, repeats);
        stats.add(price);

        if (z > properties.getSpikeThreshold()) {
            return Optional.of(raise(AnomalyType.PRICE_SPIKE, signal.getKey(), z, properties.getSpikeThreshold(), price,
                    String.format("price %.8f, mean %.8f", price, stats.mean()), at));
        }
        if (stale) {
            return Optional.of(raise(AnomalyType.STALE_FEED, signal.getKey(), repeats, repeats, price,
                    "price repeated " + repeats + " times", at));
        }
        return Optional.empty();
    }

    private Optional<AnomalyEvent> observeStatistical(
            Signal signal, AnomalyType type, int windowSize, int warmup, Instant at) {
        RollingStats stats = window(signal.getType(), signal.getKey(), windowSize);
        if (stats.size() < warmup) {
            stats.add(signal.getValue());
            return Optional.empty();
        }
        double z = stats.zScore(signal.getValue());
        stats.add(signal.getValue());
        if (z > properties.getSpikeThreshold()) {
            return Optional.of(raise(type, signal.getKey(), z, properties.getSpikeThreshold(), signal.getValue(),
                    String.format("value %.4f, z %.2f", signal.getValue(), z), at));
        }
        return Optional.empty();
    }

    private Optional<AnomalyEvent> observeLatency(Signal signal, Instant at) {
        RollingStats stats = window(SignalType.LATENCY, signal.getKey(), properties.getLatencyWindow());
        double latency = signal.getValue();
        boolean warm = stats.size() >= properties.getLatencyWarmup();
        double z = warm ? stats.zScore(latency) : 0;
        stats.add(latency);

        if (latency > properties.getLatencyCeilingMs()) {
            return Optional.of(raise(AnomalyType.LATENCY_SPIKE, signal.getKey(), z, properties.getLatencyCeilingMs(), latency,
                    String.format("latency %.0fms above ceiling %dms", latency, properties.getLatencyCeilingMs()), at));
        }
        if (warm && z > properties.getSpikeThreshold()) {
            return Optional.of(raise(AnomalyType.LATENCY_SPIKE, signal.getKey(), z, properties.getSpikeThreshold(), latency,
                    String.format("latency %.0fms, z %.2f", latency, z), at));
        }
        return Optional.empty();
    }

    private Optional<AnomalyEvent> observeClock(Signal signal, Instant at) {
        double skewMs = signal.getSourceTimestamp() != null
                ? Duration.between(signal.getSourceTimestamp(), at).toMillis()
                : signal.getValue();
        if (Math.abs(skewMs) > properties.getClockSkewToleranceMs()) {
            return Optional.of(raise(AnomalyType.CLOCK_DRIFT, signal.getKey(), Math.abs(skewMs),
                    properties.getClockSkewToleranceMs(), skewMs, String.format("clock skew %.0fms", skewMs), at));
        }
        return Optional.empty();
    }

    // ========================
    // BOOKKEEPING
    // ========================

    private AnomalyEvent raise(
            AnomalyType type, String key, double magnitude, double threshold, double observed, String detail, Instant at) {
        int recent = remember(at);
        boolean autoPause = recent >= properties.getConsecutiveAnomalyLimit();
        log.warn("Anomaly {} on {}: {} ({} in window{})", type, key, detail, recent, autoPause ? ", auto-pause" : "");
        return AnomalyEvent.builder()
                .type(type)
                .key(key)
                .magnitude(magnitude)
                .threshold(threshold)
                .observedValue(observed)
                .recentCount(recent)
                .autoPause(autoPause)
                .detail(detail)
                .timestamp(at)
                .build();
    }

    private int remember(Instant at) {
        evictBefore(at.minus(Duration.ofMillis(properties.getAnomalyWindowMs())));
        recentAnomalies.addLast(at);
        return recentAnomalies.size();
    }

    private void evictBefore(Instant cutoff) {
        while (!recentAnomalies.isEmpty() && recentAnomalies.peekFirst().isBefore(cutoff)) {
            recentAnomalies.pollFirst();
        }
    }

    private RollingStats window(SignalType type, String key, int size) {
        return windows.computeIfAbsent(type + ":" + key, k -> new RollingStats(size));
    }
}
