package com.tradeguard.config;

import com.tradeguard.domain.enums.TradingMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Intent pipeline settings, loaded from {@code tradeguard.pipeline.*}.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "tradeguard.pipeline")
public class PipelineProperties {

    @NotNull
    private TradingMode tradingMode = TradingMode.PAPER;

    @Min(1)
    private int workerThreads = 8;

    /** How long a submitter waits for its intent to finish on the symbol lane. */
    @Min(1)
    private long intentTimeoutMs = 5000;

    /** How long completed outcomes are kept for duplicate-intent replies. */
    @Min(1)
    private long outcomeRetentionMs = 3_600_000;

    /** Venue place/cancel/query call timeout. */
    @Min(1)
    private long venueTimeoutMs = 1000;

    /** Threads for blocking venue calls; a hung exchange can tie up at most this many. */
    @Min(1)
    private int venueCallThreads = 4;

    @Min(0)
    private int venueCallQueueCapacity = 100;

    @Min(1)
    private int fillPollAttempts = 5;

    @Min(1)
    private long fillPollBackoffMs = 100;
}
