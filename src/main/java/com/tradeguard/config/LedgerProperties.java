package com.tradeguard.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Ledger valuation and snapshot settings, loaded from {@code tradeguard.ledger.*}.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "tradeguard.ledger")
public class LedgerProperties {

    @NotBlank
    private String baseCurrency = "USDT";

    @Min(1)
    private long fxTimeoutMs = 500;

    @Min(1)
    private int fxRetryAttempts = 3;

    @Min(1)
    private long fxRetryBackoffMs = 50;

    /** Oldest last-known rate that may still be used as a stale fallback. */
    @Min(1)
    private long fxMaxStalenessMs = 300_000;

    @Min(1)
    private long snapshotIntervalMs = 60_000;
}
