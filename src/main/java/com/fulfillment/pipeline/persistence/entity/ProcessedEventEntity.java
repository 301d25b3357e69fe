package com.fulfillment.pipeline.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * One row per (order, provider event) admitted for processing. Rows are only ever inserted, so a
 * primary-key violation on insert is the duplicate signal.
 */
@Entity
@Table(name = "processed_events", indexes = {
    @Index(name = "idx_processed_event_order", columnList = "order_id"),
    @Index(name = "idx_processed_event_at", columnList = "processed_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedEventEntity implements Persistable<String> {

    @Id
    @Column(name = "dedup_key", nullable = false, updatable = false, length = 200)
    private String dedupKey;

    @Column(name = "order_id", nullable = false, updatable = false, length = 64)
    private String orderId;

    @Column(name = "event_id", nullable = false, updatable = false, length = 128)
    private String eventId;

    @Column(name = "processed_at", nullable = false, updatable = false)
    private Instant processedAt;

    public static ProcessedEventEntity of(String orderId, String eventId) {
        return ProcessedEventEntity.builder()
                .dedupKey(orderId + ":" + eventId)
                .orderId(orderId)
                .eventId(eventId)
                .build();
    }

    @Override
    public String getId() {
        return dedupKey;
    }

    /** Always new: save() must issue an INSERT, never a merge. */
    @Override
    public boolean isNew() {
        return true;
    }

    @PrePersist
    protected void onCreate() {
        if (processedAt == null) {
            processedAt = Instant.now();
        }
    }
}
