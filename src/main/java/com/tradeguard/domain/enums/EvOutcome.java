package com.tradeguard.domain.enums;

/** Result tag of an expected-value evaluation. */
public enum EvOutcome {
    APPROVED,
    RESIZED,
    REJECTED
}
