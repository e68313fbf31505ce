package com.tradeguard.domain.enums;

/** Where a fill price came from: the paper simulator or a live venue confirmation. */
public enum PriceSource {
    SIMULATED,
    VENUE
}
