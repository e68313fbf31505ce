package com.tradeguard.domain.enums;

/** Why the kill switch moved from ARMED to TRIPPED. */
public enum TripReason {
    MANUAL,
    DRAWDOWN_BREACH,
    ANOMALY,
    RECONCILIATION_FAILURE
}
