package com.tradeguard.event;

import com.tradeguard.oms.IntentOutcome;
import org.springframework.context.ApplicationEvent;

/**
 * Published once per trade intent that reached a final outcome. {@code startedNanos} is the
 * {@link System#nanoTime()} reading taken when the intent entered the pipeline.
 */
public class IntentProcessedEvent extends ApplicationEvent {

    private final IntentOutcome outcome;
    private final long startedNanos;

    public IntentProcessedEvent(Object source, IntentOutcome outcome, long startedNanos) {
        super(source);
        this.outcome = outcome;
        this.startedNanos = startedNanos;
    }

    public IntentOutcome getOutcome() {
        return outcome;
    }

    public long getStartedNanos() {
        return startedNanos;
    }
}
