package com.tradeguard.simulator;

import com.tradeguard.config.SimulatorProperties;
import com.tradeguard.domain.enums.LiquidityRole;
import com.tradeguard.domain.enums.OrderSide;
import com.tradeguard.domain.enums.OrderStatus;
import com.tradeguard.domain.enums.PriceSource;
import com.tradeguard.domain.enums.RejectReason;
import com.tradeguard.domain.model.Fill;
import com.tradeguard.domain.model.LedgerUpdate;
import com.tradeguard.domain.model.MarketContext;
import com.tradeguard.domain.model.Order;
import com.tradeguard.domain.model.OrderHandle;
import com.tradeguard.domain.model.OrderRequest;
import com.tradeguard.fee.FeeTaxModel;
import com.tradeguard.marketdata.MarketContextProvider;
import com.tradeguard.oms.ExecutionVenue;
import com.tradeguard.oms.FillProcessor;
import com.tradeguard.oms.OrderLifecycleRecorder;
import com.tradeguard.oms.OrderRegistry;
import com.tradeguard.risk.CancellationToken;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Paper execution venue. Fills orders against the current market context with modeled
 * slippage, splitting them into partial fills bounded by the quoted book depth.
 *
 * <p>Slippage in bps is {@code base + volatility x vol% + impact x cumulativeQty / depth}: a BUY
 * fills at {@code ref x (1 + bps/10000)}, a SELL at {@code ref x (1 - bps/10000)}. Every fill
 * pays the venue's taker fee and is tagged {@link PriceSource#SIMULATED}.
 *
 * <p>Each fill is booked inside {@link CancellationToken#runUnlessCancelled}, so once the kill
 * switch has cancelled the token no further fill is booked and the order is canceled instead.
 * A cancel request for the order is honored the same way, before the next fill.
 */
@Service
@ConditionalOnProperty(name = "tradeguard.pipeline.trading-mode", havingValue = "PAPER", matchIfMissing = true)
public class PaperExecutionSimulator implements ExecutionVenue {

    private static final Logger log = LoggerFactory.getLogger(PaperExecutionSimulator.class);

    private static final BigDecimal BPS = BigDecimal.valueOf(10_000);

    private final SimulatorProperties properties;
    private final MarketContextProvider marketContextProvider;
    private final FeeTaxModel feeTaxModel;
    private final OrderRegistry orderRegistry;
    private final OrderLifecycleRecorder lifecycleRecorder;
    private final FillProcessor fillProcessor;
    private final Clock clock;

    private final Set<String> downVenues = ConcurrentHashMap.newKeySet();

    public PaperExecutionSimulator(
            SimulatorProperties properties,
            MarketContextProvider marketContextProvider,
            FeeTaxModel feeTaxModel,
            OrderRegistry orderRegistry,
            OrderLifecycleRecorder lifecycleRecorder,
            FillProcessor fillProcessor,
            Clock clock) {
        this.properties = properties;
        this.marketContextProvider = marketContextProvider;
        this.feeTaxModel = feeTaxModel;
        this.orderRegistry = orderRegistry;
        this.lifecycleRecorder = lifecycleRecorder;
        this.fillProcessor = fillProcessor;
        this.clock = clock;
        this.downVenues.addAll(properties.getDownVenues());
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

        List<Fill> fills = new ArrayList<>();
        try {
            work(order, request, token, fills);
        } finally {
            if (!order.getStatus().isTerminal()) {
                log.error("Order {} left {} after execution, canceling", order.getId(), order.getStatus());
                lifecycleRecorder.cancel(order, RejectReason.VENUE_ERROR);
            }
            orderRegistry.close(order);
        }

        OrderHandle handle = OrderHandle.of(order, fills);
        orderRegistry.complete(handle);
        return handle;
    }

    private void work(Order order, OrderRequest request, CancellationToken token, List<Fill> fills) {
        if (token.isCancelled()) {
            lifecycleRecorder.cancel(order, RejectReason.CANCELED_BY_KILL_SWITCH);
            return;
        }
        if (isVenueDown(order.getVenue())) {
            lifecycleRecorder.reject(order, RejectReason.VENUE_DOWN, "venue " + order.getVenue() + " is down");
            return;
        }
        Optional<MarketContext> context = marketContextProvider.current(order.getSymbol());
        if (context.isEmpty()) {
            lifecycleRecorder.reject(order, RejectReason.NO_MARKET_DATA, "no market context for " + order.getSymbol());
            return;
        }

        BigDecimal depth = context.get().getBookDepth();
        BigDecimal chunkCap = depth != null && depth.signum() > 0 ? depth.multiply(properties.getMaxFillFraction()) : null;

        for (int n = 1; n <= properties.getMaxPartialFills() && !order.getStatus().isTerminal(); n++) {
            BigDecimal remaining = order.remainingQuantity();
            boolean last = n == properties.getMaxPartialFills();
            BigDecimal chunk = last || chunkCap == null ? remaining : remaining.min(chunkCap);
            if (chunk.signum() <= 0) {
                break;
            }
            int sequence = n;

            Optional<LedgerUpdate> booked = token.runUnlessCancelled(() -> {
                if (orderRegistry.isCancelRequested(order.getId())) {
                    return null;
                }
                Fill fill = buildFill(order, request, context.get(), chunk, sequence);
                synchronized (order) {
                    LedgerUpdate update = fillProcessor.record(order, fill);
                    fills.add(fill);
                    lifecycleRecorder.transition(
                            order,
                            order.remainingQuantity().signum() == 0 ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED);
                    return update;
                }
            });

            if (booked.isEmpty()) {
                lifecycleRecorder.cancel(
                        order,
                        token.isCancelled() ? RejectReason.CANCELED_BY_KILL_SWITCH : RejectReason.CANCELED_BY_REQUEST);
                return;
            }
            fillProcessor.afterFill(booked.get());

            if (!order.getStatus().isTerminal() && properties.getPartialFillDelayMs() > 0) {
                pause();
            }
        }
    }

    Fill buildFill(Order order, OrderRequest request, MarketContext context, BigDecimal quantity, int sequence) {
        BigDecimal cumulative = order.getFilledQuantity().add(quantity);
        BigDecimal bps = slippageBps(context, cumulative);
        BigDecimal reference = request.getReferencePrice();
        BigDecimal factor = order.getSide() == OrderSide.BUY
                ? BigDecimal.ONE.add(bps.divide(BPS, 12, RoundingMode.HALF_UP))
                : BigDecimal.ONE.subtract(bps.divide(BPS, 12, RoundingMode.HALF_UP));
        BigDecimal price = reference.multiply(factor).setScale(8, RoundingMode.HALF_UP);

        return Fill.builder()
                .id(order.getId() + "-" + sequence)
                .orderId(order.getId())
                .symbol(order.getSymbol())
                .side(order.getSide())
                .venue(order.getVenue())
                .price(price)
                .quantity(quantity)
                .fee(feeTaxModel.fillFee(order.getVenue(), LiquidityRole.TAKER, price.multiply(quantity)))
                .currency(request.getQuoteCurrency())
                .liquidityRole(LiquidityRole.TAKER)
                .priceSource(PriceSource.SIMULATED)
                .timestamp(clock.instant())
                .build();
    }

    BigDecimal slippageBps(MarketContext context, BigDecimal cumulativeQuantity) {
        BigDecimal bps = properties.getBaseSlippageBps();
        if (context.getVolatilityPct() != null) {
            bps = bps.add(properties.getVolatilitySlippageBps().multiply(context.getVolatilityPct()));
        }
        BigDecimal depth = context.getBookDepth();
        if (depth != null && depth.signum() > 0) {
            bps = bps.add(properties.getImpactSlippageBps()
                    .multiply(cumulativeQuantity)
                    .divide(depth, 12, RoundingMode.HALF_UP));
        }
        return bps;
    }

    private void pause() {
        try {
            Thread.sleep(properties.getPartialFillDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
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
    // VENUE AVAILABILITY
    // ========================

    public void markVenueDown(String venue) {
        log.warn("Paper venue {} marked down", venue);
        downVenues.add(venue);
    }

    public void markVenueUp(String venue) {
        log.info("Paper venue {} marked up", venue);
        downVenues.remove(venue);
    }

    public boolean isVenueDown(String venue) {
        return downVenues.contains(venue);
    }
}
