package com.tradeguard.event;

/** Classifies the risk condition behind a {@link RiskEvent}. */
public enum RiskEventType {

    /** A single order's notional is above the per-trade limit. */
    TRADE_LIMIT_BREACH,

    /** The projected position notional for a symbol is above its limit. */
    POSITION_LIMIT_BREACH,

    /** The projected gross exposure across symbols is above its limit. */
    AGGREGATE_LIMIT_BREACH,

    /** Realized plus unrealized P&L for the day is at or below the negative loss limit. */
    DAILY_LOSS_LIMIT_BREACH,

    /** An intent arrived outside the configured trading window. */
    OUTSIDE_TRADING_HOURS,

    /** The kill switch moved to TRIPPED. Open orders are being canceled. */
    KILL_SWITCH_TRIPPED,

    /** Operators re-armed the kill switch. */
    KILL_SWITCH_RESET
}
