package com.tradeguard.domain.enums;

/** Kinds of signal fed to the anomaly detector. */
public enum SignalType {
    PRICE,
    PNL,
    LATENCY,
    CLOCK
}
