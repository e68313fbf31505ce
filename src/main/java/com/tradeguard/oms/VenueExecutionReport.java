package com.tradeguard.oms;

import com.tradeguard.domain.enums.OrderStatus;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Exchange view of one order: its status and all trades so far. Trades already booked are
 * recognized by trade id and skipped.
 */
@Value
@Builder
public class VenueExecutionReport {

    String venueOrderId;
    OrderStatus status;

    @Singular
    List<VenueTrade> trades;

    String message;
}
