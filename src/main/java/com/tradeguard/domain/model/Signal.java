package com.tradeguard.domain.model;

import com.tradeguard.domain.enums.SignalType;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One observation for the anomaly detector.
 *
 * <p>For CLOCK signals {@code value} is ignored when {@code sourceTimestamp} is present: the
 * skew is computed as {@code observedAt - sourceTimestamp}.
 */
@Value
@Builder
public class Signal {

    SignalType type;
    String key;
    double value;
    Instant sourceTimestamp;
    Instant observedAt;

    public static Signal price(String symbol, double price, Instant at) {
        return Signal.builder().type(SignalType.PRICE).key(symbol).value(price).observedAt(at).build();
    }

    public static Signal pnl(String key, double pnl, Instant at) {
        return Signal.builder().type(SignalType.PNL).key(key).value(pnl).observedAt(at).build();
    }

    public static Signal latency(String key, double latencyMs, Instant at) {
        return Signal.builder().type(SignalType.LATENCY).key(key).value(latencyMs).observedAt(at).build();
    }

    public static Signal clock(String key, Instant sourceTimestamp, Instant observedAt) {
        return Signal.builder()
                .type(SignalType.CLOCK)
                .key(key)
                .sourceTimestamp(sourceTimestamp)
                .observedAt(observedAt)
                .build();
    }
}
