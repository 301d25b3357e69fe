package com.fulfillment.pipeline.core;

import com.fulfillment.pipeline.domain.AdmissionResult;
import com.fulfillment.pipeline.persistence.entity.ProcessedEventEntity;
import com.fulfillment.pipeline.persistence.repository.ProcessedEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.SQLException;
import java.time.Instant;

/**
 * Admits each (order, provider event) pair once. The insert is the check: the primary key on the
 * processed-event table decides races between concurrent deliveries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventDeduplicator {

    static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    private final ProcessedEventRepository processedEventRepository;

    /**
     * Records the event as processed. When called inside the ingress transaction a DUPLICATE
     * leaves that transaction rollback-only; the caller must abort it.
     */
    public AdmissionResult admit(String orderId, String eventId) {
        if (processedEventRepository.existsByOrderIdAndEventId(orderId, eventId)) {
            log.info("Duplicate webhook event: orderId={}, eventId={}", orderId, eventId);
            return AdmissionResult.DUPLICATE;
        }
        try {
            processedEventRepository.saveAndFlush(ProcessedEventEntity.of(orderId, eventId));
            return AdmissionResult.ACCEPTED;
        } catch (DataIntegrityViolationException e) {
            if (!isUniqueViolation(e)) {
                log.error("Processed-event insert rejected: orderId={}, eventId={}, error={}",
                        orderId, eventId, e.getMostSpecificCause().getMessage());
                throw e;
            }
            log.info("Duplicate webhook event (concurrent delivery): orderId={}, eventId={}", orderId, eventId);
            return AdmissionResult.DUPLICATE;
        }
    }

    /** Only a key collision means another delivery got there first. */
    static boolean isUniqueViolation(DataIntegrityViolationException e) {
        if (e instanceof DuplicateKeyException) {
            return true;
        }
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException && UNIQUE_VIOLATION_SQL_STATE.equals(((SQLException) t).getSQLState())) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    /** Deletes processed-event records older than {@code cutoff}; returns how many were removed. */
    @Transactional
    public int purgeProcessedBefore(Instant cutoff) {
        int removed = processedEventRepository.deleteProcessedBefore(cutoff);
        if (removed > 0) {
            log.info("Purged processed webhook events: count={}, cutoff={}", removed, cutoff);
        }
        return removed;
    }
}
