package com.tradeguard.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Venue fee schedules and jurisdictional tax rules, loaded from {@code tradeguard.fees.*}.
 *
 * <p>All rates are in basis points. Venues not listed fall back to the default maker/taker
 * rates and the default jurisdiction.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "tradeguard.fees")
public class FeeScheduleProperties {

    @NotNull
    @DecimalMin("0")
    private BigDecimal defaultMakerBps = new BigDecimal("10");

    @NotNull
    @DecimalMin("0")
    private BigDecimal defaultTakerBps = new BigDecimal("10");

    /** Promotional discount applied to every venue fee, in percent (0-100). */
    @NotNull
    @DecimalMin("0")
    @DecimalMax("100")
    private BigDecimal campaignDiscountPct = BigDecimal.ZERO;

    @NotBlank
    private String defaultJurisdiction = "TR";

    @Valid
    private Map<String, VenueFee> venues = new LinkedHashMap<>();

    @Valid
    private Map<String, JurisdictionTax> jurisdictions = new LinkedHashMap<>();

    @Data
    public static class VenueFee {

        @NotNull
        @DecimalMin("0")
        private BigDecimal makerBps;

        @NotNull
        @DecimalMin("0")
        private BigDecimal takerBps;

        private String jurisdiction;
    }

    @Data
    public static class JurisdictionTax {

        /** Per-leg transaction taxes keyed by name (e.g. bsmv, stamp). */
        private Map<String, BigDecimal> transactionTaxBps = new LinkedHashMap<>();

        /** Withholding on positive realized P&L. */
        @DecimalMin("0")
        private BigDecimal profitWithholdingBps = BigDecimal.ZERO;
    }
}
