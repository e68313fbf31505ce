package com.tradeguard.domain.model;

import com.tradeguard.domain.enums.AuditEventType;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One link of the hash chain. {@code entryHash = SHA-256(previousHash || payload)}, with
 * {@code payload} the canonical JSON of {type, recordedAt, body}.
 */
@Value
@Builder
public class AuditEntry {

    long sequence;
    String previousHash;
    String payload;
    String entryHash;
    AuditEventType eventType;
    Instant recordedAt;
}
