package com.tradeguard.oms;

import com.tradeguard.config.StrategyProfileProperties;
import com.tradeguard.config.StrategyProfileProperties.StrategyProfile;
import com.tradeguard.domain.model.TradeIntent;
import com.tradeguard.exception.ValidationException;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Structural and per-strategy checks on an incoming intent. A malformed intent is rejected
 * with {@link ValidationException} and never retried.
 */
@Component
public class IntentValidator {

    private static final int MAX_VENUES = 2;

    private final StrategyProfileProperties strategyProfiles;

    public IntentValidator(StrategyProfileProperties strategyProfiles) {
        this.strategyProfiles = strategyProfiles;
    }

    public void validate(TradeIntent intent) {
        if (intent == null) {
            throw new ValidationException("Trade intent is required");
        }
        requireText(intent.getIntentId(), "intentId", intent);
        requireText(intent.getStrategyId(), "strategyId", intent);
        requireText(intent.getSymbol(), "symbol", intent);
        if (intent.getSide() == null) {
            throw invalid(intent, "side is required");
        }
        requirePositive(intent.getQuantity(), "quantity", intent);
        requirePositive(intent.getReferencePrice(), "referencePrice", intent);

        if (intent.getVenues() == null || intent.getVenues().isEmpty()) {
            throw invalid(intent, "at least one venue is required");
        }
        if (intent.getVenues().size() > MAX_VENUES) {
            throw invalid(intent, "at most " + MAX_VENUES + " venues are supported");
        }
        if (intent.getVenues().stream().anyMatch(v -> v == null || v.isBlank())) {
            throw invalid(intent, "venue names must not be blank");
        }

        validateProfile(intent);
    }

    private void validateProfile(TradeIntent intent) {
        Optional<StrategyProfile> profile = strategyProfiles.find(intent.getStrategyId());
        if (profile.isEmpty()) {
            if (strategyProfiles.restricted()) {
                throw invalid(intent, "unknown strategy " + intent.getStrategyId());
            }
            return;
        }
        if (!profile.get().isEnabled()) {
            throw invalid(intent, "strategy " + intent.getStrategyId() + " is disabled");
        }
        if (!profile.get().getAllowedSymbols().isEmpty()
                && !profile.get().getAllowedSymbols().contains(intent.getSymbol())) {
            throw invalid(intent, "symbol " + intent.getSymbol() + " not allowed for strategy " + intent.getStrategyId());
        }
    }

    private void requireText(String value, String field, TradeIntent intent) {
        if (value == null || value.isBlank()) {
            throw invalid(intent, field + " is required");
        }
    }

    private void requirePositive(BigDecimal value, String field, TradeIntent intent) {
        if (value == null || value.signum() <= 0) {
            throw invalid(intent, field + " must be positive");
        }
    }

    private ValidationException invalid(TradeIntent intent, String message) {
        String intentId = intent.getIntentId() != null ? intent.getIntentId() : "";
        return new ValidationException("Invalid trade intent: " + message, Map.<String, Object>of("intentId", intentId));
    }
}
