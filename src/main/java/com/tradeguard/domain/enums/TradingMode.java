package com.tradeguard.domain.enums;

public enum TradingMode {
    PAPER,
    LIVE
}
