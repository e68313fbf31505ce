package com.tradeguard.repository.jpa;

import com.tradeguard.domain.enums.OrderStatus;
import com.tradeguard.entity.OrderEntity;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for the orders table. */
@Repository
public interface OrderJpaRepository extends JpaRepository<OrderEntity, String> {

    Optional<OrderEntity> findByIntentId(String intentId);

    List<OrderEntity> findByStatusIn(Collection<OrderStatus> statuses);
}
