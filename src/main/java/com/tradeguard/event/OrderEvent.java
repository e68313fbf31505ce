package com.tradeguard.event;

import com.tradeguard.domain.enums.OrderStatus;
import com.tradeguard.domain.model.Order;
import org.springframework.context.ApplicationEvent;

/**
 * Published on every order status transition, after the transition has been audited.
 * Carries a snapshot of the order, never the live instance.
 */
public class OrderEvent extends ApplicationEvent {

    private final Order order;
    private final OrderEventType eventType;
    private final OrderStatus previousStatus;

    /**
     * @param previousStatus status before the change, null for a newly accepted order
     */
    public OrderEvent(Object source, Order order, OrderEventType eventType, OrderStatus previousStatus) {
        super(source);
        this.order = order;
        this.eventType = eventType;
        this.previousStatus = previousStatus;
    }

    public OrderEvent(Object source, Order order, OrderEventType eventType) {
        this(source, order, eventType, null);
    }

    public Order getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }

    public OrderStatus getPreviousStatus() {
        return previousStatus;
    }
}
