package com.fulfillment.pipeline.persistence.repository;

import com.fulfillment.pipeline.persistence.entity.ProcessedEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

/**
 * Insert-only store of admitted webhook events.
 */
@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, String> {

    boolean existsByOrderIdAndEventId(String orderId, String eventId);

    long countByOrderId(String orderId);

    @Modifying
    @Query("DELETE FROM ProcessedEventEntity e WHERE e.processedAt < :cutoff")
    int deleteProcessedBefore(@Param("cutoff") Instant cutoff);
}
