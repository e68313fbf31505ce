package com.tradeguard.domain.enums;

/** Payload discriminator stored with every audit entry. */
public enum AuditEventType {
    INTENT_REJECTED,
    EV_DECISION,
    RISK_DENIAL,
    ORDER_TRANSITION,
    FILL,
    RISK_STATE_CHANGE,
    ANOMALY,
    CANCEL_ALL,
    RECONCILIATION,
    LEDGER_SNAPSHOT,
    RECOVERY
}
