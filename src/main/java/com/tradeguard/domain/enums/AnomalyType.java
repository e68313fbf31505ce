package com.tradeguard.domain.enums;

/**
 * Classes of anomaly raised by the detector, reconciliation and the cancellation watchdog.
 *
 * <p>Fatal types trip the kill switch on their own; the statistical ones only trip when
 * enough of them accumulate inside the configured window.
 */
public enum AnomalyType {
    PRICE_SPIKE(false),
    PNL_SPIKE(false),
    LATENCY_SPIKE(false),
    CLOCK_DRIFT(false),
    /** Price unchanged across the last several ticks. */
    STALE_FEED(false),
    RECONCILIATION_FAIL(true),
    CANCEL_TIMEOUT(true),
    FX_UNAVAILABLE(true);

    private final boolean fatal;

    AnomalyType(boolean fatal) {
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}
