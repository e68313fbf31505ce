package com.tradeguard.domain.enums;

/** Final disposition of a trade intent after it has passed through the pipeline. */
public enum IntentStatus {
    EXECUTED,
    PARTIALLY_EXECUTED,
    EV_REJECTED,
    RISK_DENIED,
    ORDER_REJECTED,
    ORDER_CANCELED,
    /** Accepted by a live venue and still working when the submitter stopped waiting. */
    ORDER_WORKING
}
