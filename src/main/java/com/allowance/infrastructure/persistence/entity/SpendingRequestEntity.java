package com.allowance.infrastructure.persistence.entity;

import com.allowance.domain.exception.InvalidStateException;
import com.allowance.domain.model.RequestStatus;
import com.allowance.domain.model.RequestTransition;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A child's request to spend money, waiting for or answered by a parent.
 *
 * Status only moves through {@link #apply(RequestTransition, Instant)}.
 */
@Entity
@Table(name = "spending_requests", indexes = {
    @Index(name = "idx_request_child_status", columnList = "childId,status"),
    @Index(name = "idx_request_family_status", columnList = "familyId,status"),
    @Index(name = "idx_request_status_expires", columnList = "status,expiresAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpendingRequestEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID requestId;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID childId;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID familyId;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(nullable = false, length = 500)
    private String description;

    @Column(length = 64)
    private String categoryId;

    @Column(columnDefinition = "UUID")
    private UUID wishListItemId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RequestStatus status;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant expiresAt;

    @Column(columnDefinition = "UUID")
    private UUID respondedBy;

    @Column
    private Instant respondedAt;

    @Column(length = 1000)
    private String parentComment;

    @Column(nullable = false)
    private boolean learningMoment;

    /** Ledger transaction created on approval. */
    @Column(columnDefinition = "UUID")
    private UUID transactionId;

    /** When the request was cancelled or expired. */
    @Column
    private Instant closedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (requestId == null) {
            requestId = UUID.randomUUID();
        }
        if (status == null) {
            status = RequestStatus.PENDING;
        }
    }

    public boolean isPending() {
        return status == RequestStatus.PENDING;
    }

    public boolean isOverdue(Instant now) {
        return expiresAt.isBefore(now);
    }

    /**
     * Move from PENDING to the transition's terminal state.
     *
     * @throws InvalidStateException if the request is no longer pending
     */
    public void apply(RequestTransition transition, Instant at) {
        if (!isPending()) {
            throw new InvalidStateException("Spending request " + requestId + " is no longer pending (" + status + ")");
        }
        status = transition.targetStatus();
        if (transition.isParentResponse()) {
            respondedAt = at;
        } else {
            closedAt = at;
        }
    }
}
