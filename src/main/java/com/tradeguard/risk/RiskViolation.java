package com.tradeguard.risk;

import lombok.Builder;
import lombok.Getter;

/**
 * One limit that denied an intent. {@code code} is machine-readable and is what the audit
 * entry and the error response carry.
 */
@Getter
@Builder
public class RiskViolation {

    public static final String KILL_SWITCH_ACTIVE = "KILL_SWITCH_ACTIVE";
    public static final String OUTSIDE_TRADING_HOURS = "OUTSIDE_TRADING_HOURS";
    public static final String TRADE_NOTIONAL_EXCEEDED = "TRADE_NOTIONAL_EXCEEDED";
    public static final String POSITION_NOTIONAL_EXCEEDED = "POSITION_NOTIONAL_EXCEEDED";
    public static final String AGGREGATE_NOTIONAL_EXCEEDED = "AGGREGATE_NOTIONAL_EXCEEDED";
    public static final String DAILY_LOSS_LIMIT_BREACHED = "DAILY_LOSS_LIMIT_BREACHED";

    private final String code;
    private final String message;

    public static RiskViolation of(String code, String message) {
        return RiskViolation.builder().code(code).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
