package com.tradeguard.entity;

import com.tradeguard.domain.enums.LiquidityRole;
import com.tradeguard.domain.enums.OrderSide;
import com.tradeguard.domain.enums.PriceSource;
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
 * JPA entity for the fills table (1 order → N fills). Reconciliation reads internal
 * trades from here.
 */
@Entity
@Table(name = "fills")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FillEntity {

    @Id
    @Column(length = 100)
    private String id;

    @Column(name = "order_id", length = 36)
    private String orderId;

    @Column(length = 50)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(length = 4)
    private OrderSide side;

    @Column(length = 50)
    private String venue;

    @Column(precision = 28, scale = 10)
    private BigDecimal price;

    @Column(precision = 28, scale = 10)
    private BigDecimal quantity;

    @Column(precision = 28, scale = 10)
    private BigDecimal fee;

    @Column(length = 10)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "liquidity_role", length = 10)
    private LiquidityRole liquidityRole;

    @Enumerated(EnumType.STRING)
    @Column(name = "price_source", length = 10)
    private PriceSource priceSource;

    private Instant timestamp;
}
