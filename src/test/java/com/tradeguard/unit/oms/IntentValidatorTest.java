package com.tradeguard.unit.oms;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradeguard.config.StrategyProfileProperties;
import com.tradeguard.config.StrategyProfileProperties.StrategyProfile;
import com.tradeguard.domain.enums.OrderSide;
import com.tradeguard.domain.model.TradeIntent;
import com.tradeguard.exception.ValidationException;
import com.tradeguard.oms.IntentValidator;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for IntentValidator. */
class IntentValidatorTest {

    private StrategyProfileProperties profiles;
    private IntentValidator validator;

    @BeforeEach
    void setUp() {
        profiles = new StrategyProfileProperties();
        validator = new IntentValidator(profiles);
    }

    private static TradeIntent.TradeIntentBuilder valid() {
        return TradeIntent.builder()
                .intentId("i-1")
                .strategyId("arb")
                .symbol("BTCUSDT")
                .side(OrderSide.BUY)
                .quantity(BigDecimal.ONE)
                .referencePrice(new BigDecimal("100"))
                .venue("binance-tr")
                .timestamp(Instant.parse("2026-03-02T10:00:00Z"));
    }

    @Nested
    @DisplayName("Structure")
    class Structure {

        @Test
        @DisplayName("Well-formed intent passes")
        void wellFormed_passes() {
            assertThatCode(() -> validator.validate(valid().build())).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Null intent is rejected")
        void nullIntent_rejected() {
            assertThatThrownBy(() -> validator.validate(null)).isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Blank strategy id is rejected")
        void blankStrategy_rejected() {
            assertThatThrownBy(() -> validator.validate(valid().strategyId(" ").build()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("strategyId");
        }

        @Test
        @DisplayName("Zero quantity is rejected")
        void zeroQuantity_rejected() {
            assertThatThrownBy(() -> validator.validate(valid().quantity(BigDecimal.ZERO).build()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("quantity must be positive");
        }

        @Test
        @DisplayName("Missing side is rejected")
        void missingSide_rejected() {
            assertThatThrownBy(() -> validator.validate(valid().side(null).build()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("side");
        }

        @Test
        @DisplayName("No venue is rejected")
        void noVenue_rejected() {
            assertThatThrownBy(() -> validator.validate(valid().clearVenues().build()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("venue");
        }

        @Test
        @DisplayName("More than two venues is rejected")
        void threeVenues_rejected() {
            assertThatThrownBy(() -> validator.validate(valid().venues(List.of("a", "b")).build()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("at most 2");
        }
    }

    @Nested
    @DisplayName("Strategy Profiles")
    class StrategyProfiles {

        @Test
        @DisplayName("Unknown strategy is rejected once profiles are configured")
        void unknownStrategy_rejectedWhenRestricted() {
            profiles.getProfiles().put("momentum", new StrategyProfile());

            assertThatThrownBy(() -> validator.validate(valid().build()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("unknown strategy arb");
        }

        @Test
        @DisplayName("Disabled strategy is rejected")
        void disabledStrategy_rejected() {
            StrategyProfile arb = new StrategyProfile();
            arb.setEnabled(false);
            profiles.getProfiles().put("arb", arb);

            assertThatThrownBy(() -> validator.validate(valid().build()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("disabled");
        }

        @Test
        @DisplayName("Symbol outside the allowed list is rejected")
        void disallowedSymbol_rejected() {
            StrategyProfile arb = new StrategyProfile();
            arb.getAllowedSymbols().add("ETHUSDT");
            profiles.getProfiles().put("arb", arb);

            assertThatThrownBy(() -> validator.validate(valid().build()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("not allowed");
        }
    }
}
