package com.tradeguard.risk;

import com.tradeguard.domain.enums.KillSwitchState;
import com.tradeguard.domain.enums.TripReason;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.springframework.stereotype.Component;

/**
 * The single owner of live risk state.
 *
 * <p>One {@link ReentrantReadWriteLock} guards everything: pre-trade checks read under the
 * shared lock, while P&L updates, trips and resets take the exclusive lock. No method calls
 * out to other components while holding the lock.
 */
@Component
public class RiskStateHolder {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private KillSwitchState killSwitchState = KillSwitchState.ARMED;
    private TripReason tripReason;
    private String tripDetail;
    private Instant trippedAt;
    private LocalDate tradingDay;
    private BigDecimal dailyRealizedPnl = BigDecimal.ZERO;
    private BigDecimal unrealizedPnl = BigDecimal.ZERO;
    private int consecutiveAnomalies;
    /** Audit sequence of the last fill whose realized P&L is in {@link #dailyRealizedPnl}. */
    private long lastFillSequence = -1;
    private final Map<String, BigDecimal> exposureBySymbol = new HashMap<>();

    // ========================
    // READS
    // ========================

    public RiskStateSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return RiskStateSnapshot.builder()
                    .killSwitchState(killSwitchState)
                    .tripReason(tripReason)
                    .tripDetail(tripDetail)
                    .trippedAt(trippedAt)
                    .tradingDay(tradingDay)
                    .dailyRealizedPnl(dailyRealizedPnl)
                    .unrealizedPnl(unrealizedPnl)
                    .consecutiveAnomalies(consecutiveAnomalies)
                    .lastFillSequence(lastFillSequence)
                    .exposureBySymbol(Map.copyOf(exposureBySymbol))
                    .grossExposure(grossExposureLocked())
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isTripped() {
        lock.readLock().lock();
        try {
            return killSwitchState == KillSwitchState.TRIPPED;
        } finally {
            lock.readLock().unlock();
        }
    }

    public TripReason tripReason() {
        lock.readLock().lock();
        try {
            return tripReason;
        } finally {
            lock.readLock().unlock();
        }
    }

    public LocalDate tradingDay() {
        lock.readLock().lock();
        try {
            return tradingDay;
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========================
    // WRITES
    // ========================

    /** Starts a new trading day. Returns false if {@code day} is already current. */
    public boolean rollTo(LocalDate day) {
        lock.writeLock().lock();
        try {
            if (day.equals(tradingDay)) {
                return false;
            }
            tradingDay = day;
            dailyRealizedPnl = BigDecimal.ZERO;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Adds realized P&L and replaces the symbol's exposure. Returns the new daily P&L. */
    public BigDecimal applyLedger(String symbol, BigDecimal realized, BigDecimal symbolExposure) {
        return applyLedger(symbol, realized, symbolExposure, -1);
    }

    /**
     * As {@link #applyLedger(String, BigDecimal, BigDecimal)}, for the fill recorded at audit
     * sequence {@code fillSequence}. Realized P&L of a fill at or below the last counted
     * sequence is already in the daily total and is not added again; its exposure still applies.
     * A negative sequence is always counted.
     */
    public BigDecimal applyLedger(String symbol, BigDecimal realized, BigDecimal symbolExposure, long fillSequence) {
        lock.writeLock().lock();
        try {
            boolean counted = fillSequence >= 0 && fillSequence <= lastFillSequence;
            if (realized != null && !counted) {
                dailyRealizedPnl = dailyRealizedPnl.add(realized);
            }
            if (fillSequence > lastFillSequence) {
                lastFillSequence = fillSequence;
            }
            if (symbolExposure != null) {
                if (symbolExposure.signum() == 0) {
                    exposureBySymbol.remove(symbol);
                } else {
                    exposureBySymbol.put(symbol, symbolExposure.abs());
                }
            }
            return dailyRealizedPnl.add(unrealizedPnl);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Replaces unrealized P&L and, when given, all exposures. Returns the new daily P&L. */
    public BigDecimal applyValuation(BigDecimal unrealized, Map<String, BigDecimal> exposures) {
        lock.writeLock().lock();
        try {
            if (unrealized != null) {
                unrealizedPnl = unrealized;
            }
            if (exposures != null) {
                exposureBySymbol.clear();
                exposures.forEach((symbol, value) -> exposureBySymbol.put(symbol, value.abs()));
            }
            return dailyRealizedPnl.add(unrealizedPnl);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void recordAnomalyCount(int recentCount) {
        lock.writeLock().lock();
        try {
            consecutiveAnomalies = recentCount;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** ARMED → TRIPPED. Returns false when already tripped; the first trip's reason is kept. */
    public boolean trip(TripReason reason, String detail, Instant at) {
        lock.writeLock().lock();
        try {
            if (killSwitchState == KillSwitchState.TRIPPED) {
                return false;
            }
            killSwitchState = KillSwitchState.TRIPPED;
            tripReason = reason;
            tripDetail = detail;
            trippedAt = at;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** TRIPPED → ARMED. Returns false when already armed. */
    public boolean reset() {
        lock.writeLock().lock();
        try {
            if (killSwitchState == KillSwitchState.ARMED) {
                return false;
            }
            killSwitchState = KillSwitchState.ARMED;
            tripReason = null;
            tripDetail = null;
            trippedAt = null;
            consecutiveAnomalies = 0;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Reinstates persisted state during startup recovery. Exposure is rebuilt separately. */
    public void restore(RiskStateSnapshot persisted) {
        lock.writeLock().lock();
        try {
            killSwitchState = persisted.getKillSwitchState() != null ? persisted.getKillSwitchState() : KillSwitchState.ARMED;
            tripReason = persisted.getTripReason();
            tripDetail = persisted.getTripDetail();
            trippedAt = persisted.getTrippedAt();
            tradingDay = persisted.getTradingDay();
            dailyRealizedPnl = persisted.getDailyRealizedPnl() != null ? persisted.getDailyRealizedPnl() : BigDecimal.ZERO;
            unrealizedPnl = persisted.getUnrealizedPnl() != null ? persisted.getUnrealizedPnl() : BigDecimal.ZERO;
            consecutiveAnomalies = persisted.getConsecutiveAnomalies();
            lastFillSequence = persisted.getLastFillSequence();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private BigDecimal grossExposureLocked() {
        return exposureBySymbol.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
