package com.tradeguard.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the risk engine and the kill switch when a limit denies an intent or the
 * trading state changes.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>OrderCancellationService: cancels every open order on KILL_SWITCH_TRIPPED</li>
 *   <li>CustomMetricsService: counts breaches by type</li>
 * </ul>
 */
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(Object source, RiskEventType eventType, RiskLevel level, String message) {
        this(source, eventType, level, message, null);
    }

    public RiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.level = level;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Condition-specific data, e.g. {"projected": 12000, "limit": 10000} for a position
     * limit breach or {"reason": "ANOMALY"} for a trip.
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
