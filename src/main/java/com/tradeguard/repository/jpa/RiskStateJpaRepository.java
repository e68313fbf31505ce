package com.tradeguard.repository.jpa;

import com.tradeguard.entity.RiskStateEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for the single-row risk_state table. */
@Repository
public interface RiskStateJpaRepository extends JpaRepository<RiskStateEntity, Long> {}
