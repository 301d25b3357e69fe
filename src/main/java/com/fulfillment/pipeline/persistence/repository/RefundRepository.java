package com.fulfillment.pipeline.persistence.repository;

import com.fulfillment.pipeline.domain.RefundStatus;
import com.fulfillment.pipeline.persistence.entity.RefundEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/** Spring Data repository for refund records. */
@Repository
public interface RefundRepository extends JpaRepository<RefundEntity, String> {

    Optional<RefundEntity> findByOrderId(String orderId);

    List<RefundEntity> findByStatus(RefundStatus status);
}
