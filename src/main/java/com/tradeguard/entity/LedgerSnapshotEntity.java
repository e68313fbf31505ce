package com.tradeguard.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
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
 * JPA entity for the ledger_snapshots table.
 * Each row is a full copy of every position and its open lots, serialized as JSON.
 * Restart restores the newest row and replays later FILL audit entries on top.
 */
@Entity
@Table(name = "ledger_snapshots")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerSnapshotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Highest audit sequence at snapshot time, for diagnostics only. */
    @Column(name = "audit_sequence")
    private long auditSequence;

    @Lob
    @Column(name = "positions_json")
    private String positionsJson;

    @Column(name = "taken_at")
    private Instant takenAt;
}
