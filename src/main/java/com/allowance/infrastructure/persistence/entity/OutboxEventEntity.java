package com.allowance.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Notification waiting to be published to Kafka.
 *
 * Rows are written by the notifier and drained by the outbox publisher, so a
 * broker outage delays notifications instead of failing governance operations.
 */
@Entity
@Table(name = "outbox_events", indexes = {
    @Index(name = "idx_status_created", columnList = "status,createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxEventEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID eventId;

    @Column(nullable = false, length = 50)
    private String eventType;

    /** Family or child id the notification is addressed to. */
    @Column(nullable = false, length = 100)
    private String aggregateId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private EventStatus status = EventStatus.PENDING;

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant publishedAt;

    @Column
    private Integer retryCount;

    @Column(length = 500)
    private String errorMessage;

    public enum EventStatus {
        PENDING,
        PUBLISHED,
        FAILED
    }

    @PrePersist
    protected void onCreate() {
        if (eventId == null) {
            eventId = UUID.randomUUID();
        }
        if (retryCount == null) {
            retryCount = 0;
        }
    }

    public void markPublished(Instant at) {
        this.status = EventStatus.PUBLISHED;
        this.publishedAt = at;
    }

    /**
     * Record a failed publish. The event goes back to PENDING until it has
     * failed {@code maxAttempts} times.
     */
    public void markFailed(String error, int maxAttempts) {
        this.retryCount = retryCount == null ? 1 : retryCount + 1;
        this.errorMessage = error != null && error.length() > 500 ? error.substring(0, 500) : error;
        this.status = retryCount >= maxAttempts ? EventStatus.FAILED : EventStatus.PENDING;
    }
}
