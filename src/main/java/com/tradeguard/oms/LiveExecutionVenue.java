package com.tradeguard.oms;

import com.tradeguard.config.PipelineProperties;
import com.tradeguard.domain.enums.OrderStatus;
import com.tradeguard.domain.enums.PriceSource;
import com.tradeguard.domain.enums.RejectReason;
import com.tradeguard.domain.model.Fill;
import com.tradeguard.domain.model.LedgerUpdate;
import com.tradeguard.domain.model.Order;
import com.tradeguard.domain.model.OrderHandle;
import com.tradeguard.domain.model.OrderRequest;
import com.tradeguard.exception.VenueException;
import com.tradeguard.risk.CancellationToken;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Execution venue backed by a real exchange through {@link LiveOrderRouter}.
 *
 * <ul>
 *   <li><b>Placement:</b> one attempt bounded by the venue timeout. A timeout rejects the order
 *       with VENUE_TIMEOUT and is never retried, so an order cannot be placed twice.</li>
 *   <li><b>Fill confirmation:</b> execution reports are polled with Resilience4j retry and
 *       exponential backoff. Polling is an idempotent read; trades already booked are
 *       recognized by trade id.</li>
 *   <li><b>Cancellation:</b> once the kill-switch token is cancelled, or a cancel was
 *       requested, the exchange is asked to cancel and the order turns CANCELED when the
 *       exchange confirms. Trades the exchange reports are booked either way, since they
 *       happened.</li>
 * </ul>
 *
 * <p>Orders still working when the submitter stops waiting are polled on a fixed delay,
 * always through the symbol's lane.
 */
@Service
@ConditionalOnProperty(name = "tradeguard.pipeline.trading-mode", havingValue = "LIVE")
public class LiveExecutionVenue implements ExecutionVenue {

    private static final Logger log = LoggerFactory.getLogger(LiveExecutionVenue.class);

    private final LiveOrderRouter liveOrderRouter;
    private final OrderRegistry orderRegistry;
    private final OrderLifecycleRecorder lifecycleRecorder;
    private final FillProcessor fillProcessor;
    private final SymbolSequencer symbolSequencer;
    private final PipelineProperties properties;
    private final Clock clock;
    private final Retry queryRetry;

    private final ThreadPoolTaskExecutor venueCalls;

    private final Map<String, WorkingOrder> working = new ConcurrentHashMap<>();

    public LiveExecutionVenue(
            LiveOrderRouter liveOrderRouter,
            OrderRegistry orderRegistry,
            OrderLifecycleRecorder lifecycleRecorder,
            FillProcessor fillProcessor,
            SymbolSequencer symbolSequencer,
            PipelineProperties properties,
            Clock clock) {
        this.liveOrderRouter = liveOrderRouter;
        this.orderRegistry = orderRegistry;
        this.lifecycleRecorder = lifecycleRecorder;
        this.fillProcessor = fillProcessor;
        this.symbolSequencer = symbolSequencer;
        this.properties = properties;
        this.clock = clock;
        this.venueCalls = new ThreadPoolTaskExecutor();
        venueCalls.setCorePoolSize(properties.getVenueCallThreads());
        venueCalls.setMaxPoolSize(properties.getVenueCallThreads());
        venueCalls.setQueueCapacity(properties.getVenueCallQueueCapacity());
        venueCalls.setThreadNamePrefix("venue-call-");
        venueCalls.setDaemon(true);
        venueCalls.initialize();
        this.queryRetry = Retry.of(
                "venue-query",
                RetryConfig.custom()
                        .maxAttempts(properties.getFillPollAttempts())
                        .intervalFunction(IntervalFunction.ofExponentialBackoff(properties.getFillPollBackoffMs(), 2.0))
                        .build());
    }

    // ========================
    // SUBMIT
    // ========================

    @Override
    public OrderHandle submit(OrderRequest request, CancellationToken token) {
        Optional<OrderHandle> existing = orderRegistry.findByIntent(request.getIntentId());
        if (existing.isPresent()) {
            log.info("Intent {} already has order {}, returning it", request.getIntentId(), existing.get().orderId());
            return existing.get().asDuplicate();
        }

        Instant now = clock.instant();
        Order order = Order.builder()
                .id(UUID.randomUUID().toString())
                .intentId(request.getIntentId())
                .strategyId(request.getStrategyId())
                .symbol(request.getSymbol())
                .side(request.getSide())
                .quantity(request.getQuantity())
                .price(request.getReferencePrice())
                .venue(request.getVenue())
                .status(OrderStatus.NEW)
                .createdAt(now)
                .updatedAt(now)
                .build();
        lifecycleRecorder.created(order);
        orderRegistry.register(order);
        WorkingOrder workingOrder = new WorkingOrder(order, request, token);

        if (token.isCancelled()) {
            lifecycleRecorder.cancel(order, RejectReason.CANCELED_BY_KILL_SWITCH);
            return finish(workingOrder);
        }
        if (!place(workingOrder)) {
            return finish(workingOrder);
        }

        working.put(order.getId(), workingOrder);
        for (int attempt = 0; attempt < properties.getFillPollAttempts() && !order.getStatus().isTerminal(); attempt++) {
            poll(workingOrder);
            if (!order.getStatus().isTerminal()) {
                pause(properties.getFillPollBackoffMs());
            }
        }
        return finish(workingOrder);
    }

    private boolean place(WorkingOrder workingOrder) {
        Order order = workingOrder.order;
        VenueAck ack;
        try {
            ack = call(() -> liveOrderRouter.place(workingOrder.request, order.getId()));
        } catch (TimeoutException e) {
            log.error("Placement of order {} on {} timed out; reconciliation will surface it if it went live",
                    order.getId(), order.getVenue());
            lifecycleRecorder.reject(order, RejectReason.VENUE_TIMEOUT, e.getMessage());
            return false;
        } catch (VenueException e) {
            lifecycleRecorder.reject(order, RejectReason.VENUE_ERROR, e.getMessage());
            return false;
        }
        if (ack == null || !ack.isAccepted()) {
            lifecycleRecorder.reject(
                    order, RejectReason.VENUE_ERROR, ack != null ? ack.getRejectMessage() : "no acknowledgement");
            return false;
        }
        order.setVenueOrderId(ack.getVenueOrderId());
        log.info("Order {} placed on {} as {}", order.getId(), order.getVenue(), ack.getVenueOrderId());
        return true;
    }

    private OrderHandle finish(WorkingOrder workingOrder) {
        Order order = workingOrder.order;
        OrderHandle handle;
        synchronized (order) {
            handle = OrderHandle.of(order, workingOrder.fills);
        }
        if (order.getStatus().isTerminal()) {
            working.remove(order.getId());
            orderRegistry.close(order);
            orderRegistry.complete(handle);
        }
        return handle;
    }

    // ========================
    // POLLING
    // ========================

    /** Reads the exchange's view of the order and books anything new. Runs on the symbol's lane. */
    void poll(WorkingOrder workingOrder) {
        Order order = workingOrder.order;
        if (workingOrder.token.isCancelled() || orderRegistry.isCancelRequested(order.getId())) {
            requestVenueCancel(workingOrder);
        }

        VenueExecutionReport report;
        try {
            report = queryRetry.executeCallable(() -> call(() -> liveOrderRouter.query(order.getVenueOrderId())));
        } catch (Exception e) {
            log.warn("Execution report for order {} unavailable: {}", order.getId(), e.getMessage());
            return;
        }
        if (report == null) {
            return;
        }

        for (VenueTrade trade : report.getTrades()) {
            if (workingOrder.bookedTrades.contains(trade.getTradeId())) {
                continue;
            }
            LedgerUpdate update;
            synchronized (order) {
                Fill fill = toFill(order, workingOrder.request, trade);
                update = fillProcessor.record(order, fill);
                workingOrder.bookedTrades.add(trade.getTradeId());
                workingOrder.fills.add(fill);
                lifecycleRecorder.transition(
                        order,
                        order.remainingQuantity().signum() <= 0 ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED);
            }
            fillProcessor.afterFill(update);
        }

        if (!order.getStatus().isTerminal() && report.getStatus() != null && report.getStatus().isTerminal()) {
            applyVenueTerminal(workingOrder, report);
        }
    }

    private void applyVenueTerminal(WorkingOrder workingOrder, VenueExecutionReport report) {
        Order order = workingOrder.order;
        synchronized (order) {
            if (report.getStatus() == OrderStatus.FILLED) {
                log.warn("Venue reports order {} FILLED with {}/{} booked", order.getId(), order.getFilledQuantity(),
                        order.getQuantity());
                return;
            }
            if (report.getStatus() == OrderStatus.REJECTED && order.getStatus() == OrderStatus.NEW) {
                lifecycleRecorder.reject(order, RejectReason.VENUE_ERROR, report.getMessage());
                return;
            }
            RejectReason reason = workingOrder.token.isCancelled()
                    ? RejectReason.CANCELED_BY_KILL_SWITCH
                    : RejectReason.CANCELED_BY_REQUEST;
            lifecycleRecorder.cancel(order, reason);
        }
    }

    private void requestVenueCancel(WorkingOrder workingOrder) {
        if (!workingOrder.cancelSent.compareAndSet(false, true)) {
            return;
        }
        Order order = workingOrder.order;
        try {
            boolean accepted = call(() -> liveOrderRouter.cancel(order.getVenueOrderId()));
            log.info("Cancel for order {} sent to {}: {}", order.getId(), order.getVenue(),
                    accepted ? "accepted" : "refused");
            if (!accepted) {
                workingOrder.cancelSent.set(false);
            }
        } catch (TimeoutException | VenueException e) {
            log.error("Cancel for order {} failed: {}", order.getId(), e.getMessage());
            workingOrder.cancelSent.set(false);
        }
    }

    @Scheduled(fixedDelayString = "${tradeguard.pipeline.live-poll-interval-ms:250}")
    public void pollWorkingOrders() {
        for (WorkingOrder workingOrder : working.values()) {
            if (!workingOrder.pollQueued.compareAndSet(false, true)) {
                continue;
            }
            symbolSequencer.submit(workingOrder.order.getSymbol(), () -> {
                workingOrder.pollQueued.set(false);
                if (!workingOrder.order.getStatus().isTerminal()) {
                    poll(workingOrder);
                }
                return finish(workingOrder);
            });
        }
    }

    private Fill toFill(Order order, OrderRequest request, VenueTrade trade) {
        return Fill.builder()
                .id(trade.getTradeId())
                .orderId(order.getId())
                .symbol(order.getSymbol())
                .side(order.getSide())
                .venue(order.getVenue())
                .price(trade.getPrice())
                .quantity(trade.getQuantity())
                .fee(trade.getFee())
                .currency(trade.getCurrency() != null ? trade.getCurrency() : request.getQuoteCurrency())
                .liquidityRole(trade.getLiquidityRole())
                .priceSource(PriceSource.VENUE)
                .timestamp(trade.getTimestamp() != null ? trade.getTimestamp() : clock.instant())
                .build();
    }

    // ========================
    // CANCEL / QUERY
    // ========================

    @Override
    public CompletableFuture<Boolean> requestCancel(String orderId) {
        return orderRegistry.requestCancel(orderId);
    }

    @Override
    public List<Order> openOrders() {
        return orderRegistry.openOrders();
    }

    // ========================
    // HELPERS
    // ========================

    private <T> T call(Supplier<T> action) throws TimeoutException {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(action, venueCalls);
        } catch (RejectedExecutionException e) {
            throw new VenueException("Venue call pool saturated, exchange unresponsive", e);
        }
        try {
            return future.get(properties.getVenueTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException("Venue call exceeded " + properties.getVenueTimeoutMs() + "ms");
        } catch (ExecutionException e) {
            throw new VenueException("Venue call failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VenueException("Interrupted during venue call", e);
        }
    }

    private void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @PreDestroy
    public void shutdown() {
        venueCalls.shutdown();
    }

    static final class WorkingOrder {
        private final Order order;
        private final OrderRequest request;
        private final CancellationToken token;
        private final Set<String> bookedTrades = new HashSet<>();
        private final List<Fill> fills = new ArrayList<>();
        private final AtomicBoolean cancelSent = new AtomicBoolean();
        private final AtomicBoolean pollQueued = new AtomicBoolean();

        WorkingOrder(Order order, OrderRequest request, CancellationToken token) {
            this.order = order;
            this.request = request;
            this.token = token;
        }
    }
}
