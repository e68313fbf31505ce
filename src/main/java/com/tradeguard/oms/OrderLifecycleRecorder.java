package com.tradeguard.oms;

import com.tradeguard.audit.AuditLog;
import com.tradeguard.domain.enums.AuditEventType;
import com.tradeguard.domain.enums.OrderStatus;
import com.tradeguard.domain.enums.RejectReason;
import com.tradeguard.domain.model.Order;
import com.tradeguard.event.EventPublisherHelper;
import com.tradeguard.event.OrderEventType;
import com.tradeguard.mapper.OrderMapper;
import com.tradeguard.repository.jpa.OrderJpaRepository;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Records order lifecycle changes. Each creation and each transition produces exactly one
 * ORDER_TRANSITION audit entry, one upsert of the orders row, and one {@code OrderEvent},
 * in that order.
 */
@Component
public class OrderLifecycleRecorder {

    private static final Logger log = LoggerFactory.getLogger(OrderLifecycleRecorder.class);

    private final AuditLog auditLog;
    private final OrderJpaRepository orderJpaRepository;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;
    private final OrderMapper orderMapper = Mappers.getMapper(OrderMapper.class);

    public OrderLifecycleRecorder(
            AuditLog auditLog,
            OrderJpaRepository orderJpaRepository,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.auditLog = auditLog;
        this.orderJpaRepository = orderJpaRepository;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    /** Records a freshly created NEW order. */
    public void created(Order order) {
        record(order, null);
        eventPublisherHelper.publishOrderAccepted(this, order.snapshot());
    }

    /** Moves {@code order} to {@code target} and records the change. */
    public void transition(Order order, OrderStatus target) {
        OrderStatus previous = order.getStatus();
        order.transitionTo(target, clock.instant());
        record(order, previous);
        eventPublisherHelper.publishOrderEvent(this, order.snapshot(), eventTypeOf(target), previous);
    }

    public void reject(Order order, RejectReason reason, String detail) {
        order.setRejectReason(reason);
        order.setRejectDetail(detail);
        log.warn("Order {} for intent {} rejected: {} {}", order.getId(), order.getIntentId(), reason, detail);
        transition(order, OrderStatus.REJECTED);
    }

    public void cancel(Order order, RejectReason reason) {
        order.setRejectReason(reason);
        log.warn("Order {} for intent {} canceled ({}), filled {}/{}",
                order.getId(), order.getIntentId(), reason, order.getFilledQuantity(), order.getQuantity());
        transition(order, OrderStatus.CANCELED);
    }

    private void record(Order order, OrderStatus previous) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("orderId", order.getId());
        body.put("intentId", order.getIntentId());
        body.put("from", previous != null ? previous.name() : null);
        body.put("to", order.getStatus().name());
        body.put("order", order.snapshot());
        auditLog.append(AuditEventType.ORDER_TRANSITION, body);
        orderJpaRepository.save(orderMapper.toEntity(order));
    }

    private OrderEventType eventTypeOf(OrderStatus status) {
        switch (status) {
            case PARTIALLY_FILLED:
                return OrderEventType.PARTIALLY_FILLED;
            case FILLED:
                return OrderEventType.FILLED;
            case CANCELED:
                return OrderEventType.CANCELED;
            case REJECTED:
                return OrderEventType.REJECTED;
            default:
                return OrderEventType.ACCEPTED;
        }
    }
}
