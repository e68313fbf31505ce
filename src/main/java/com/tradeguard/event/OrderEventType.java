package com.tradeguard.event;

/** Classifies the order state change carried by an {@link OrderEvent}. */
public enum OrderEventType {

    /** Order created and accepted by the venue. */
    ACCEPTED,

    /** Some but not all of the quantity has executed. */
    PARTIALLY_FILLED,

    /** All requested quantity has executed. */
    FILLED,

    /** Order canceled, by request or by the kill switch. */
    CANCELED,

    /** Order refused by the venue or the simulator. */
    REJECTED
}
