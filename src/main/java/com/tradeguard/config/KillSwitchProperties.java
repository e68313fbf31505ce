package com.tradeguard.config;

import jakarta.validation.constraints.Min;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Kill switch settings, loaded from {@code tradeguard.kill-switch.*}.
 *
 * <p>{@code operators} maps operator id to the shared secret used to sign confirmation
 * tokens. Manual trips and resets need tokens from {@link #requiredOperators} distinct
 * operators.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "tradeguard.kill-switch")
public class KillSwitchProperties {

    /** Trip-to-confirmed-cancellation deadline. */
    @Min(1)
    private long cancelDeadlineMs = 2000;

    @Min(2)
    private int requiredOperators = 2;

    private Map<String, String> operators = new LinkedHashMap<>();

    /** How long a used confirmation nonce is remembered to block replays. */
    @Min(1)
    private long nonceRetentionMs = 86_400_000;
}
