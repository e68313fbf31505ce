package com.tradeguard.oms;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tradeguard.config.PipelineProperties;
import com.tradeguard.domain.enums.OrderStatus;
import com.tradeguard.domain.model.Order;
import com.tradeguard.domain.model.OrderHandle;
import com.tradeguard.mapper.FillMapper;
import com.tradeguard.mapper.OrderMapper;
import com.tradeguard.repository.jpa.FillJpaRepository;
import com.tradeguard.repository.jpa.OrderJpaRepository;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.mapstruct.factory.Mappers;
import org.springframework.stereotype.Component;

/**
 * Tracks orders for the execution venues.
 *
 * <ul>
 *   <li><b>Idempotency:</b> {@link #findByIntent} checks recent handles in memory first,
 *       then the orders table, so a restart cannot create a second order for an intent.</li>
 *   <li><b>Open orders:</b> live instances of non-terminal orders, each with a future that
 *       completes with its terminal status.</li>
 *   <li><b>Cancel requests:</b> flags a working order so its venue cancels it before the
 *       next fill.</li>
 * </ul>
 */
@Component
public class OrderRegistry {

    private final OrderJpaRepository orderJpaRepository;
    private final FillJpaRepository fillJpaRepository;
    private final OrderMapper orderMapper = Mappers.getMapper(OrderMapper.class);
    private final FillMapper fillMapper = Mappers.getMapper(FillMapper.class);

    private final Cache<String, OrderHandle> handlesByIntent;
    private final Map<String, OpenOrder> openOrders = new ConcurrentHashMap<>();

    public OrderRegistry(
            OrderJpaRepository orderJpaRepository,
            FillJpaRepository fillJpaRepository,
            PipelineProperties pipelineProperties) {
        this.orderJpaRepository = orderJpaRepository;
        this.fillJpaRepository = fillJpaRepository;
        this.handlesByIntent = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMillis(pipelineProperties.getOutcomeRetentionMs()))
                .maximumSize(100_000)
                .build();
    }

    // ========================
    // IDEMPOTENCY
    // ========================

    public Optional<OrderHandle> findByIntent(String intentId) {
        OrderHandle cached = handlesByIntent.getIfPresent(intentId);
        if (cached != null) {
            return Optional.of(cached);
        }
        OpenOrder open = openOrders.values().stream()
                .filter(o -> o.order.getIntentId().equals(intentId))
                .findFirst()
                .orElse(null);
        if (open != null) {
            return Optional.of(OrderHandle.of(open.order, List.of()));
        }
        return orderJpaRepository.findByIntentId(intentId).map(entity -> OrderHandle.of(
                orderMapper.toDomain(entity), fillMapper.toDomainList(fillJpaRepository.findByOrderId(entity.getId()))));
    }

    public void complete(OrderHandle handle) {
        handlesByIntent.put(handle.getOrder().getIntentId(), handle);
    }

    // ========================
    // OPEN ORDERS
    // ========================

    public void register(Order order) {
        openOrders.put(order.getId(), new OpenOrder(order));
    }

    /** Removes a terminal order and completes its waiters. */
    public void close(Order order) {
        OpenOrder open = openOrders.remove(order.getId());
        if (open != null) {
            open.terminal.complete(order.getStatus());
        }
    }

    public Optional<Order> open(String orderId) {
        OpenOrder open = openOrders.get(orderId);
        return open != null ? Optional.of(open.order) : Optional.empty();
    }

    public List<Order> openOrders() {
        return openOrders.values().stream()
                .map(o -> {
                    synchronized (o.order) {
                        return o.order.snapshot();
                    }
                })
                .toList();
    }

    // ========================
    // CANCEL REQUESTS
    // ========================

    /**
     * Flags an open order for cancellation.
     *
     * @return completes true when the order ends CANCELED, false when it ends otherwise or is
     *         not open
     */
    public CompletableFuture<Boolean> requestCancel(String orderId) {
        OpenOrder open = openOrders.get(orderId);
        if (open == null) {
            return CompletableFuture.completedFuture(false);
        }
        open.cancelRequested = true;
        return open.terminal.thenApply(status -> status == OrderStatus.CANCELED);
    }

    public boolean isCancelRequested(String orderId) {
        OpenOrder open = openOrders.get(orderId);
        return open != null && open.cancelRequested;
    }

    private static final class OpenOrder {
        private final Order order;
        private final CompletableFuture<OrderStatus> terminal = new CompletableFuture<>();
        private volatile boolean cancelRequested;

        private OpenOrder(Order order) {
            this.order = order;
        }
    }
}
