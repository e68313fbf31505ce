package com.tradeguard.unit.ev;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

import com.tradeguard.config.EvGateProperties;
import com.tradeguard.domain.model.MarketContext;
import com.tradeguard.ev.LogisticFillProbabilityModel;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LogisticFillProbabilityModelTest {

    private EvGateProperties properties;
    private LogisticFillProbabilityModel model;

    @BeforeEach
    void setUp() {
        properties = new EvGateProperties();
        model = new LogisticFillProbabilityModel(properties);
    }

    private MarketContext ideal() {
        return MarketContext.builder()
                .symbol("BTCUSDT")
                .makerFillRate(BigDecimal.ONE)
                .depthRatio(BigDecimal.ONE)
                .latencyMs(0)
                .build();
    }

    @Test
    @DisplayName("Ideal features give 1 / (1 + e^-2)")
    void idealFeatures_giveLogisticOfFullScore() {
        BigDecimal p = model.estimate(ideal(), BigDecimal.ZERO);

        assertThat(p.doubleValue()).isCloseTo(0.880797, offset(1e-6));
    }

    @Test
    @DisplayName("Wider spread and slower venue lower the estimate")
    void worseConditions_lowerEstimate() {
        MarketContext slow = ideal().toBuilder().latencyMs(400).build();

        BigDecimal base = model.estimate(ideal(), BigDecimal.ZERO);
        BigDecimal worse = model.estimate(slow, new BigDecimal("30"));

        assertThat(worse).isLessThan(base);
    }

    @Test
    @DisplayName("Estimate is clamped to the configured bounds")
    void estimate_isClamped() {
        properties.getFillModel().setSteepness(50);
        MarketContext hopeless = MarketContext.builder()
                .symbol("BTCUSDT")
                .makerFillRate(BigDecimal.ZERO)
                .depthRatio(new BigDecimal("20"))
                .latencyMs(5000)
                .build();

        assertThat(model.estimate(ideal(), BigDecimal.ZERO)).isEqualByComparingTo("0.95");
        assertThat(model.estimate(hopeless, new BigDecimal("500"))).isEqualByComparingTo("0.1");
    }
}
