package com.fulfillment.pipeline.persistence.repository;

import com.fulfillment.pipeline.persistence.entity.AffiliateEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AffiliateRepository extends JpaRepository<AffiliateEntity, String> {

    Optional<AffiliateEntity> findByUserRef(String userRef);

    /** Row-locks the affiliate so concurrent credits update totals one at a time. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AffiliateEntity a WHERE a.code = :code")
    Optional<AffiliateEntity> findForUpdate(@Param("code") String code);
}
