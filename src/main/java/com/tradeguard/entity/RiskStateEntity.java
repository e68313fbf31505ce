package com.tradeguard.entity;

import com.tradeguard.domain.enums.KillSwitchState;
import com.tradeguard.domain.enums.TripReason;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the risk_state table. Holds exactly one row (id 1), overwritten on every
 * kill-switch transition and on each ledger snapshot.
 */
@Entity
@Table(name = "risk_state")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RiskStateEntity {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "kill_switch_state", length = 10)
    private KillSwitchState killSwitchState;

    @Enumerated(EnumType.STRING)
    @Column(name = "trip_reason", length = 30)
    private TripReason tripReason;

    @Column(name = "trip_detail", length = 500)
    private String tripDetail;

    @Column(name = "tripped_at")
    private Instant trippedAt;

    @Column(name = "trading_day")
    private LocalDate tradingDay;

    @Column(name = "daily_realized_pnl", precision = 28, scale = 10)
    private BigDecimal dailyRealizedPnl;

    @Column(name = "unrealized_pnl", precision = 28, scale = 10)
    private BigDecimal unrealizedPnl;

    @Column(name = "consecutive_anomalies")
    private int consecutiveAnomalies;

    @Column(name = "last_fill_sequence")
    private Long lastFillSequence;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
