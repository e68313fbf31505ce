package com.tradeguard.config;

import com.tradeguard.risk.RiskLimits;
import java.math.BigDecimal;
import java.time.LocalTime;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the global {@link RiskLimits} bean from {@code tradeguard.risk.*}.
 *
 * <p>Every limit defaults to null (check disabled). Trading hours are ISO local times
 * ({@code 09:00}) in the configured zone.
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimits riskLimits(
            @Value("${tradeguard.risk.max-trade-notional:#{null}}") BigDecimal maxTradeNotional,
            @Value("${tradeguard.risk.max-position-notional:#{null}}") BigDecimal maxPositionNotional,
            @Value("${tradeguard.risk.max-aggregate-notional:#{null}}") BigDecimal maxAggregateNotional,
            @Value("${tradeguard.risk.daily-loss-limit:#{null}}") BigDecimal dailyLossLimit,
            @Value("${tradeguard.risk.trading-hours-start:#{null}}") String tradingHoursStart,
            @Value("${tradeguard.risk.trading-hours-end:#{null}}") String tradingHoursEnd,
            @Value("${tradeguard.risk.trading-hours-zone:UTC}") String tradingHoursZone) {
        return RiskLimits.builder()
                .maxTradeNotional(maxTradeNotional)
                .maxPositionNotional(maxPositionNotional)
                .maxAggregateNotional(maxAggregateNotional)
                .dailyLossLimit(dailyLossLimit)
                .tradingHoursStart(tradingHoursStart != null ? LocalTime.parse(tradingHoursStart) : null)
                .tradingHoursEnd(tradingHoursEnd != null ? LocalTime.parse(tradingHoursEnd) : null)
                .tradingHoursZone(ZoneId.of(tradingHoursZone))
                .build();
    }
}
