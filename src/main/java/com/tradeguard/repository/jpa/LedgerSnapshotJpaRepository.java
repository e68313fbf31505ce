package com.tradeguard.repository.jpa;

import com.tradeguard.entity.LedgerSnapshotEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** JPA repository for the ledger_snapshots table. */
@Repository
public interface LedgerSnapshotJpaRepository extends JpaRepository<LedgerSnapshotEntity, Long> {

    Optional<LedgerSnapshotEntity> findTopByOrderByIdDesc();

    /** Drops every snapshot older than the one with {@code keepId}. */
    @Modifying
    @Transactional
    @Query("DELETE FROM LedgerSnapshotEntity s WHERE s.id < :keepId")
    int deleteOlderThan(@Param("keepId") Long keepId);
}
