package com.tradeguard.domain.enums;

public enum KillSwitchState {
    ARMED,
    TRIPPED
}
