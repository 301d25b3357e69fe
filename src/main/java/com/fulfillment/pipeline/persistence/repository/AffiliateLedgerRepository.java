package com.fulfillment.pipeline.persistence.repository;

import com.fulfillment.pipeline.persistence.entity.AffiliateLedgerEntryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AffiliateLedgerRepository extends JpaRepository<AffiliateLedgerEntryEntity, Long> {

    boolean existsByOrderId(String orderId);

    List<AffiliateLedgerEntryEntity> findByAffiliateCodeOrderByCreatedAtDesc(String affiliateCode);
}
