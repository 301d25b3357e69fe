package com.fulfillment.pipeline.persistence.repository;

import com.fulfillment.pipeline.persistence.entity.OrderTransitionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the order transition audit trail.
 */
@Repository
public interface OrderTransitionRepository extends JpaRepository<OrderTransitionEntity, Long> {

    List<OrderTransitionEntity> findByOrderIdOrderByIdAsc(String orderId);
}
