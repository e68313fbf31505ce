package com.tradeguard.audit;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** SHA-256 chaining for audit entries. */
public final class AuditHashing {

    /** Previous hash of the first entry. */
    public static final String GENESIS_HASH = "0".repeat(64);

    private AuditHashing() {}

    /** Lower-case hex SHA-256 of {@code previousHash || payload} (UTF-8). */
    public static String entryHash(String previousHash, String payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(previousHash.getBytes(StandardCharsets.UTF_8));
            digest.update(payload.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
