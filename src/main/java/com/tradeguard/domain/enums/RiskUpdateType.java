package com.tradeguard.domain.enums;

/** Kinds of input accepted by {@code RiskEngine.evaluate}. */
public enum RiskUpdateType {
    LEDGER,
    VALUATION,
    ANOMALY,
    MANUAL_TRIP
}
