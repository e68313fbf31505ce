package com.tradeguard.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Order lifecycle: {@code NEW -> PARTIALLY_FILLED* -> FILLED | CANCELED | REJECTED}.
 *
 * <p>FILLED, CANCELED and REJECTED are terminal and may never be left. PARTIALLY_FILLED may
 * repeat (each partial fill is its own transition).
 */
public enum OrderStatus {
    NEW,
    PARTIALLY_FILLED,
    FILLED,
    CANCELED,
    REJECTED;

    private static final Set<OrderStatus> TERMINAL = EnumSet.of(FILLED, CANCELED, REJECTED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean canTransitionTo(OrderStatus target) {
        switch (this) {
            case NEW:
                return target != NEW;
            case PARTIALLY_FILLED:
                return target == PARTIALLY_FILLED || target == FILLED || target == CANCELED;
            default:
                return false;
        }
    }
}
