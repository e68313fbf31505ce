package com.tradeguard.event;

/**
 * Severity of a {@link RiskEvent}. WARNING for a denied intent, CRITICAL for anything that
 * halts trading.
 */
public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
