package com.tradeguard.domain.enums;

public enum LiquidityRole {
    MAKER,
    TAKER
}
