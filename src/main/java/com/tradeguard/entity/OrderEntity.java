package com.tradeguard.entity;

import com.tradeguard.domain.enums.OrderSide;
import com.tradeguard.domain.enums.OrderStatus;
import com.tradeguard.domain.enums.RejectReason;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the orders table. Upserted on every status transition.
 * intent_id is unique: it is the idempotency key for intent submission.
 */
@Entity
@Table(name = "orders")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "intent_id", length = 100, unique = true, nullable = false)
    private String intentId;

    @Column(name = "strategy_id", length = 100)
    private String strategyId;

    @Column(length = 50)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(length = 4)
    private OrderSide side;

    @Column(precision = 28, scale = 10)
    private BigDecimal quantity;

    @Column(precision = 28, scale = 10)
    private BigDecimal price;

    @Column(length = 50)
    private String venue;

    @Column(name = "venue_order_id", length = 100)
    private String venueOrderId;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private OrderStatus status;

    @Column(name = "filled_quantity", precision = 28, scale = 10)
    private BigDecimal filledQuantity;

    @Column(name = "average_fill_price", precision = 28, scale = 10)
    private BigDecimal averageFillPrice;

    @Enumerated(EnumType.STRING)
    @Column(name = "reject_reason", length = 40)
    private RejectReason rejectReason;

    @Column(name = "reject_detail", length = 500)
    private String rejectDetail;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
