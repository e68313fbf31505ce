package com.tradeguard.config;

import com.tradeguard.domain.enums.SizingMode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Expected-value gate tuning, loaded from {@code tradeguard.ev.*}.
 *
 * <p>Slippage budget in bps = multiplier x (base + volatility x vol% + impact x size/depth).
 * Latency penalty in bps = latency/100ms x latencyBpsPer100Ms.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "tradeguard.ev")
public class EvGateProperties {

    /** Absolute EV (quote currency) an intent must exceed to be approved. */
    @NotNull
    private BigDecimal minimumEv = BigDecimal.ONE;

    @NotNull
    private SizingMode sizingMode = SizingMode.BINARY_SEARCH;

    @Min(2)
    private int gridSteps = 200;

    /** Smallest tradable quantity increment. Resized quantities are multiples of it. */
    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal quantityStep = new BigDecimal("0.0001");

    @NotNull
    @DecimalMin("0")
    private BigDecimal latencyBpsPer100Ms = new BigDecimal("2");

    @NotNull
    @DecimalMin("0")
    private BigDecimal slippageBaseBps = new BigDecimal("1");

    @NotNull
    @DecimalMin("0")
    private BigDecimal slippageVolatilityBps = new BigDecimal("10");

    @NotNull
    @DecimalMin("0")
    private BigDecimal slippageImpactBps = new BigDecimal("10");

    @NotNull
    @DecimalMin("1")
    private BigDecimal slippageMultiplier = new BigDecimal("1.5");

    @NotNull
    private FillModel fillModel = new FillModel();

    @Data
    public static class FillModel {

        private double fillRateWeight = 0.4;
        private double depthWeight = 0.2;
        private double spreadWeight = 0.2;
        private double speedWeight = 0.2;
        private double steepness = 4.0;

        /** Maker fill rate assumed when the market context does not report one. */
        private double defaultFillRate = 0.5;

        private double minProbability = 0.10;

        private double maxProbability = 0.95;
    }
}
