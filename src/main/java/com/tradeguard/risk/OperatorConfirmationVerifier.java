package com.tradeguard.risk;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tradeguard.config.KillSwitchProperties;
import com.tradeguard.domain.enums.ConfirmationAction;
import com.tradeguard.exception.UnauthorizedException;
import com.tradeguard.exception.ValidationException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks multi-operator confirmations for manual trips and resets.
 *
 * <p>A token is the lower-case hex HMAC-SHA256 of {@code "<ACTION>:<nonce>"} keyed with the
 * operator's configured secret. A request passes when at least the configured number of
 * distinct operators sign the same action and nonce. Each nonce is accepted once per action
 * within the retention window.
 */
@Component
public class OperatorConfirmationVerifier {

    private static final Logger log = LoggerFactory.getLogger(OperatorConfirmationVerifier.class);
    private static final String HMAC = "HmacSHA256";

    private final KillSwitchProperties properties;
    private final Cache<String, Boolean> usedNonces;

    public OperatorConfirmationVerifier(KillSwitchProperties properties) {
        this.properties = properties;
        this.usedNonces = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMillis(properties.getNonceRetentionMs()))
                .maximumSize(100_000)
                .build();
    }

    /**
     * @return the distinct operator ids that confirmed, in request order
     * @throws UnauthorizedException for an unknown operator, a bad token, a replayed nonce,
     *                               or too few distinct operators
     */
    public List<String> verify(ConfirmationAction action, String nonce, List<OperatorConfirmation> confirmations) {
        if (nonce == null || nonce.isBlank()) {
            throw new ValidationException("Confirmation nonce is required");
        }
        String nonceKey = action.name() + ":" + nonce;
        if (usedNonces.getIfPresent(nonceKey) != null) {
            log.warn("Rejected replayed {} confirmation nonce {}", action, nonce);
            throw new UnauthorizedException("Confirmation nonce already used");
        }

        Set<String> confirmed = new LinkedHashSet<>();
        for (OperatorConfirmation confirmation : confirmations != null ? confirmations : List.<OperatorConfirmation>of()) {
            String secret = properties.getOperators().get(confirmation.getOperatorId());
            if (secret == null) {
                throw new UnauthorizedException("Unknown operator " + confirmation.getOperatorId());
            }
            String expected = token(secret, action, nonce);
            String presented = confirmation.getToken() != null ? confirmation.getToken().toLowerCase() : "";
            if (!MessageDigest.isEqual(
                    expected.getBytes(StandardCharsets.US_ASCII), presented.getBytes(StandardCharsets.US_ASCII))) {
                log.warn("Invalid {} confirmation token from operator {}", action, confirmation.getOperatorId());
                throw new UnauthorizedException("Invalid confirmation token for operator " + confirmation.getOperatorId());
            }
            confirmed.add(confirmation.getOperatorId());
        }

        if (confirmed.size() < properties.getRequiredOperators()) {
            throw new UnauthorizedException(action + " requires confirmations from " + properties.getRequiredOperators()
                    + " distinct operators, got " + confirmed.size());
        }

        usedNonces.put(nonceKey, Boolean.TRUE);
        return List.copyOf(confirmed);
    }

    /** Computes the token an operator holding {@code secret} would present. */
    public static String token(String secret, ConfirmationAction action, String nonce) {
        try {
            Mac mac = Mac.getInstance(HMAC);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC));
            byte[] digest = mac.doFinal((action.name() + ":" + nonce).getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }
}
