package com.tradeguard.repository.jpa;

import com.tradeguard.domain.enums.AuditEventType;
import com.tradeguard.entity.AuditEntryEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the audit_entries table. Only the audit writer inserts; everything
 * else reads.
 */
@Repository
public interface AuditEntryJpaRepository extends JpaRepository<AuditEntryEntity, Long> {

    /** Chain tail, used to seed the writer's sequence and previous hash. */
    Optional<AuditEntryEntity> findTopByOrderBySequenceDesc();

    List<AuditEntryEntity> findAllByOrderBySequenceAsc();

    /** Entries of one type appended after {@code sequence}, used for fill replay on restart. */
    List<AuditEntryEntity> findBySequenceGreaterThanAndEventTypeOrderBySequenceAsc(
            long sequence, AuditEventType eventType);
}
