package com.tradeguard.oms;

import lombok.Builder;
import lombok.Value;

/** Exchange response to an order placement. */
@Value
@Builder
public class VenueAck {

    boolean accepted;
    String venueOrderId;

    /** Exchange-supplied reason when {@code accepted} is false. */
    String rejectMessage;
}
