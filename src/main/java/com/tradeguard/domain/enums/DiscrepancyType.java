package com.tradeguard.domain.enums;

public enum DiscrepancyType {
    /** Internal fill with no external record. */
    MISSING_EXTERNAL,
    /** External record with no internal fill. */
    UNKNOWN_EXTERNAL,
    PRICE_MISMATCH,
    QUANTITY_MISMATCH,
    SIDE_MISMATCH,
    SYMBOL_MISMATCH
}
