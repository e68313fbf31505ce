package com.tradeguard.entity;

import com.tradeguard.domain.enums.AuditEventType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the audit_entries table, one row per hash-chain link.
 * The sequence is assigned by the single audit writer, never by the database.
 * Rows are inserted once and never updated.
 */
@Entity
@Table(name = "audit_entries")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditEntryEntity {

    @Id
    private Long sequence;

    @Column(name = "previous_hash", length = 64, nullable = false)
    private String previousHash;

    /** Canonical JSON exactly as hashed. Stored as a CLOB so no database normalizes it. */
    @Lob
    @Column(nullable = false)
    private String payload;

    @Column(name = "entry_hash", length = 64, nullable = false)
    private String entryHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", length = 40)
    private AuditEventType eventType;

    @Column(name = "recorded_at")
    private Instant recordedAt;
}
