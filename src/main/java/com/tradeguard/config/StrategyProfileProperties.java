package com.tradeguard.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Typed per-strategy profiles, loaded from {@code tradeguard.strategy.profiles.<strategyId>}.
 *
 * <p>When no profile is configured every strategy id is accepted with global settings.
 * Once at least one profile exists, intents from unknown strategies are rejected.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "tradeguard.strategy")
public class StrategyProfileProperties {

    @Valid
    private Map<String, StrategyProfile> profiles = new LinkedHashMap<>();

    public Optional<StrategyProfile> find(String strategyId) {
        return Optional.ofNullable(profiles.get(strategyId));
    }

    public boolean restricted() {
        return !profiles.isEmpty();
    }

    @Data
    public static class StrategyProfile {

        private boolean enabled = true;

        /** Overrides the global minimum EV for this strategy. */
        private BigDecimal minimumEv;

        /** Tighter single-trade notional cap for this strategy. */
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal maxTradeNotional;

        /** Empty means any symbol. */
        private List<String> allowedSymbols = new ArrayList<>();
    }
}
