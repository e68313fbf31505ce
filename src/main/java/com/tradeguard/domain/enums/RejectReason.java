package com.tradeguard.domain.enums;

/** Structured reason codes attached to rejected intents and orders. */
public enum RejectReason {
    VALIDATION_FAILED,
    NO_MARKET_DATA,
    EV_BELOW_THRESHOLD,
    RISK_DENIED,
    KILL_SWITCH_ACTIVE,
    VENUE_DOWN,
    VENUE_TIMEOUT,
    VENUE_ERROR,
    CANCELED_BY_KILL_SWITCH,
    CANCELED_BY_REQUEST
}
