package com.tradeguard.domain.enums;

/** Operator actions that need signed confirmations from several operators. */
public enum ConfirmationAction {
    KILL,
    RESET
}
