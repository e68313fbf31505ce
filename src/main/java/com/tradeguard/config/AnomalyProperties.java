package com.tradeguard.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Anomaly detector thresholds, loaded from {@code tradeguard.anomaly.*}.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "tradeguard.anomaly")
public class AnomalyProperties {

    /** |z| above this flags a price, P&L or latency spike. */
    private double spikeThreshold = 3.0;

    @Min(2)
    private int priceWindow = 100;

    @Min(2)
    private int pnlWindow = 50;

    @Min(2)
    private int latencyWindow = 100;

    @Min(2)
    private int priceWarmup = 10;

    @Min(2)
    private int pnlWarmup = 5;

    @Min(2)
    private int latencyWarmup = 10;

    /** Latency above this is flagged regardless of its z-score. */
    @Min(1)
    private long latencyCeilingMs = 1000;

    @Min(1)
    private long clockSkewToleranceMs = 1000;

    /** Identical consecutive prices, current one included, that count as a stale feed. */
    @Min(2)
    private int staleFeedRepeats = 6;

    /** Anomalies inside {@link #anomalyWindowMs} needed to auto-pause. */
    @Min(1)
    private int consecutiveAnomalyLimit = 3;

    @Min(1)
    private long anomalyWindowMs = 60_000;

    @Min(1)
    private int signalQueueCapacity = 10_000;

    private long monitorIntervalMs = 1000;
}
