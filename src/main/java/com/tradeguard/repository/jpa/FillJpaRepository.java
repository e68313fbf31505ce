package com.tradeguard.repository.jpa;

import com.tradeguard.entity.FillEntity;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the fills table. Reconciliation pulls the internal side of a run
 * through {@link #findByTimestampGreaterThanEqualOrderByTimestampAsc}.
 */
@Repository
public interface FillJpaRepository extends JpaRepository<FillEntity, String> {

    List<FillEntity> findByOrderId(String orderId);

    List<FillEntity> findByTimestampGreaterThanEqualOrderByTimestampAsc(Instant since);
}
