package com.tradeguard.domain.enums;

/** Intake gate state. Only READY accepts new trade intents. */
public enum ReadinessState {
    RECOVERING,
    READY,
    HALTED
}
