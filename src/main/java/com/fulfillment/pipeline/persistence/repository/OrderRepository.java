package com.fulfillment.pipeline.persistence.repository;

import com.fulfillment.pipeline.domain.OrderStatus;
import com.fulfillment.pipeline.domain.RefundState;
import com.fulfillment.pipeline.persistence.entity.OrderEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/** Spring Data repository for orders. */
@Repository
public interface OrderRepository extends JpaRepository<OrderEntity, String> {

    List<OrderEntity> findByUserRefOrderByCreatedAtDesc(String userRef);

    List<OrderEntity> findByStatusAndRefundStateOrderByUpdatedAtAsc(OrderStatus status, RefundState refundState);

    @Query("SELECT o.orderId FROM OrderEntity o WHERE o.status IN :statuses AND o.updatedAt < :before ORDER BY o.updatedAt ASC")
    List<String> findIdsByStatusInUpdatedBefore(@Param("statuses") Collection<OrderStatus> statuses,
                                               @Param("before") Instant before);

    @Query("SELECT o.orderId FROM OrderEntity o WHERE o.status = :status AND o.createdAt < :before")
    List<String> findIdsByStatusCreatedBefore(@Param("status") OrderStatus status, @Param("before") Instant before);

    @Query("SELECT o.orderId FROM OrderEntity o WHERE o.refundState = :refundState AND o.updatedAt < :before")
    List<String> findIdsByRefundStateUpdatedBefore(@Param("refundState") RefundState refundState,
                                                   @Param("before") Instant before);

    @Query("SELECT o.orderId FROM OrderEntity o WHERE o.status = :status AND o.affiliateCode IS NOT NULL"
            + " AND o.completedAt < :before"
            + " AND EXISTS (SELECT a.code FROM AffiliateEntity a WHERE a.code = o.affiliateCode)"
            + " AND NOT EXISTS (SELECT e.id FROM AffiliateLedgerEntryEntity e WHERE e.orderId = o.orderId)")
    List<String> findIdsWithUncreditedAffiliateCompletedBefore(@Param("status") OrderStatus status,
                                                               @Param("before") Instant before);
}
