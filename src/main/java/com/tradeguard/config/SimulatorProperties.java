package com.tradeguard.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Paper execution tuning, loaded from {@code tradeguard.simulator.*}.
 *
 * <p>Fill slippage in bps = base + volatility x vol% + impact x (cumulative fill / depth).
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "tradeguard.simulator")
public class SimulatorProperties {

    /** Venues that start out down. More can be toggled at runtime. */
    private Set<String> downVenues = new LinkedHashSet<>();

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal baseSlippageBps = new BigDecimal("1");

    @NotNull
    @DecimalMin("0")
    private BigDecimal volatilitySlippageBps = new BigDecimal("5");

    @NotNull
    @DecimalMin("0")
    private BigDecimal impactSlippageBps = new BigDecimal("10");

    /** Largest share of the quoted depth one fill may take. */
    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal maxFillFraction = new BigDecimal("0.25");

    @Min(1)
    private int maxPartialFills = 10;

    /** Pause between partial fills. Zero fills an order in one pass. */
    @Min(0)
    private long partialFillDelayMs = 0;
}
