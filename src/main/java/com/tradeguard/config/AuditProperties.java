package com.tradeguard.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Audit log and reconciliation settings, loaded from {@code tradeguard.audit.*}.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "tradeguard.audit")
public class AuditProperties {

    /** Maximum wait for the single writer to append an entry. */
    @Min(1)
    private long appendTimeoutMs = 2000;

    private double priceTolerance = 0.01;

    private double quantityTolerance = 0.0001;

    private long reconciliationIntervalMs = 300_000;
}
