package com.tradeguard.audit;

import com.tradeguard.config.AuditProperties;
import com.tradeguard.domain.enums.AuditEventType;
import com.tradeguard.domain.model.AuditEntry;
import com.tradeguard.domain.model.ChainVerificationResult;
import com.tradeguard.entity.AuditEntryEntity;
import com.tradeguard.exception.ChainIntegrityException;
import com.tradeguard.mapper.AuditEntryMapper;
import com.tradeguard.repository.jpa.AuditEntryJpaRepository;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Append-only, hash-chained audit log.
 *
 * <p>Every append runs on one dedicated writer thread, which owns the chain tail (next
 * sequence and previous hash). Callers block until their entry is persisted or the append
 * timeout passes. Sequence numbers start at 0 and have no gaps: a failed insert leaves the
 * tail untouched, so the next append reuses the sequence.
 */
@Service
public class AuditLog {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    private final AuditEntryJpaRepository auditEntryJpaRepository;
    private final AuditPayloadEncoder payloadEncoder;
    private final AuditProperties auditProperties;
    private final Clock clock;
    private final AuditEntryMapper auditEntryMapper = Mappers.getMapper(AuditEntryMapper.class);

    private final ExecutorService writer = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "audit-writer");
        thread.setDaemon(true);
        return thread;
    });

    // Confined to the writer thread
    private boolean tailLoaded;
    private long nextSequence;
    private String tailHash;

    public AuditLog(
            AuditEntryJpaRepository auditEntryJpaRepository,
            AuditPayloadEncoder payloadEncoder,
            AuditProperties auditProperties,
            Clock clock) {
        this.auditEntryJpaRepository = auditEntryJpaRepository;
        this.payloadEncoder = payloadEncoder;
        this.auditProperties = auditProperties;
        this.clock = clock;
    }

    // ========================
    // APPEND
    // ========================

    /**
     * Appends an entry and waits for it to be persisted.
     *
     * @throws ChainIntegrityException if the writer does not confirm within the append timeout
     */
    public AuditEntry append(AuditEventType type, Object body) {
        Future<AuditEntry> pending = writer.submit(() -> write(type, body));
        try {
            return pending.get(auditProperties.getAppendTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.error("Audit append of {} timed out after {}ms", type, auditProperties.getAppendTimeoutMs());
            throw new ChainIntegrityException("Audit append timed out", Map.<String, Object>of("type", type.name()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChainIntegrityException("Interrupted while appending audit entry", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new ChainIntegrityException("Audit append failed", cause);
        }
    }

    private AuditEntry write(AuditEventType type, Object body) {
        loadTail();

        Instant recordedAt = clock.instant();
        String payload = payloadEncoder.encode(type, recordedAt, body);
        String entryHash = AuditHashing.entryHash(tailHash, payload);

        AuditEntry entry = AuditEntry.builder()
                .sequence(nextSequence)
                .previousHash(tailHash)
                .payload(payload)
                .entryHash(entryHash)
                .eventType(type)
                .recordedAt(recordedAt)
                .build();

        auditEntryJpaRepository.save(auditEntryMapper.toEntity(entry));

        nextSequence++;
        tailHash = entryHash;
        log.debug("Audit #{} {} {}", entry.getSequence(), type, entryHash);
        return entry;
    }

    private void loadTail() {
        if (tailLoaded) {
            return;
        }
        AuditEntryEntity tail = auditEntryJpaRepository.findTopByOrderBySequenceDesc().orElse(null);
        if (tail == null) {
            nextSequence = 0;
            tailHash = AuditHashing.GENESIS_HASH;
        } else {
            nextSequence = tail.getSequence() + 1;
            tailHash = tail.getEntryHash();
        }
        tailLoaded = true;
        log.info("Audit chain tail loaded: next sequence {}", nextSequence);
    }

    // ========================
    // READ / VERIFY
    // ========================

    /** Re-walks the stored chain from genesis. */
    public ChainVerificationResult verifyChain() {
        List<AuditEntry> entries = auditEntryMapper.toDomainList(auditEntryJpaRepository.findAllByOrderBySequenceAsc());
        ChainVerificationResult result = verify(entries);
        if (result.isValid()) {
            log.info("Audit chain verified: {} entries", result.getEntriesChecked());
        } else {
            log.error("Audit chain broken at index {}: {}", result.getFirstBrokenIndex(), result.getMessage());
        }
        return result;
    }

    /**
     * Verifies an ordered run of entries starting at genesis. Checks, per index: the sequence
     * equals the index, the previous hash matches the prior entry's hash, and the entry hash
     * matches a recomputation over the stored payload.
     */
    public static ChainVerificationResult verify(List<AuditEntry> entries) {
        String expectedPrevious = AuditHashing.GENESIS_HASH;
        for (int i = 0; i < entries.size(); i++) {
            AuditEntry entry = entries.get(i);
            if (entry.getSequence() != i) {
                return ChainVerificationResult.broken(i, i, "Expected sequence " + i + " but found " + entry.getSequence());
            }
            if (!expectedPrevious.equals(entry.getPreviousHash())) {
                return ChainVerificationResult.broken(i, i, "Previous hash does not match entry " + (i - 1));
            }
            String recomputed = AuditHashing.entryHash(entry.getPreviousHash(), entry.getPayload());
            if (!recomputed.equals(entry.getEntryHash())) {
                return ChainVerificationResult.broken(i, i, "Entry hash does not match payload");
            }
            expectedPrevious = entry.getEntryHash();
        }
        return ChainVerificationResult.intact(entries.size());
    }

    /** FILL (or other) entries appended after {@code sequence}, in chain order. */
    public List<AuditEntry> entriesAfter(long sequence, AuditEventType type) {
        return auditEntryMapper.toDomainList(
                auditEntryJpaRepository.findBySequenceGreaterThanAndEventTypeOrderBySequenceAsc(sequence, type));
    }

    /** Highest persisted sequence, or -1 for an empty log. */
    public long lastSequence() {
        return auditEntryJpaRepository
                .findTopByOrderBySequenceDesc()
                .map(AuditEntryEntity::getSequence)
                .orElse(-1L);
    }

    public <T> T decodeBody(AuditEntry entry, Class<T> bodyType) {
        return payloadEncoder.decodeBody(entry.getPayload(), bodyType);
    }

    @PreDestroy
    public void shutdown() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Audit writer did not drain within 5s");
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
    }
}
