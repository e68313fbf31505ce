package com.tradeguard.domain.model;

import java.util.List;
import lombok.Value;

/**
 * What {@code submit} hands back: a snapshot of the order after execution finished on its
 * lane, the fills it produced, and whether the submission was a replay of an earlier intent.
 */
@Value
public class OrderHandle {

    Order order;
    List<Fill> fills;
    boolean duplicate;

    public String orderId() {
        return order.getId();
    }

    public static OrderHandle of(Order order, List<Fill> fills) {
        return new OrderHandle(order.snapshot(), List.copyOf(fills), false);
    }

    public OrderHandle asDuplicate() {
        return new OrderHandle(order, fills, true);
    }
}
