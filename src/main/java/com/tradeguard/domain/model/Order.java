package com.tradeguard.domain.model;

import com.tradeguard.domain.enums.OrderSide;
import com.tradeguard.domain.enums.OrderStatus;
import com.tradeguard.domain.enums.RejectReason;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * An order created by an execution venue for an approved intent.
 *
 * <p>Mutated only by the venue that owns it, always under that order's symbol lane. Status
 * changes go through {@link #transitionTo(OrderStatus, Instant)} so the lifecycle can never
 * leave a terminal state.
 */
@Data
@Builder(toBuilder = true)
public class Order {

    private String id;
    private String intentId;
    private String strategyId;
    private String symbol;
    private OrderSide side;
    private BigDecimal quantity;

    /** Reference price the order was approved at. */
    private BigDecimal price;

    private String venue;

    /** Identifier assigned by a live venue. Null for paper orders. */
    private String venueOrderId;

    private OrderStatus status;

    @Builder.Default
    private BigDecimal filledQuantity = BigDecimal.ZERO;

    private BigDecimal averageFillPrice;
    private RejectReason rejectReason;
    private String rejectDetail;
    private Instant createdAt;
    private Instant updatedAt;

    public BigDecimal remainingQuantity() {
        return quantity.subtract(filledQuantity);
    }

    public void transitionTo(OrderStatus target, Instant at) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal order transition " + status + " -> " + target + " for " + id);
        }
        this.status = target;
        this.updatedAt = at;
    }

    /** Folds a fill into filled quantity and the volume-weighted average price. */
    public void applyFill(Fill fill) {
        BigDecimal previousNotional =
                averageFillPrice == null ? BigDecimal.ZERO : averageFillPrice.multiply(filledQuantity);
        BigDecimal newFilled = filledQuantity.add(fill.getQuantity());
        this.averageFillPrice = previousNotional
                .add(fill.getPrice().multiply(fill.getQuantity()))
                .divide(newFilled, 8, RoundingMode.HALF_UP);
        this.filledQuantity = newFilled;
    }

    public Order snapshot() {
        return toBuilder().build();
    }
}
