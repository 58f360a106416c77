package com.allowance.infrastructure.persistence.entity;

import com.allowance.domain.model.LimitPeriod;
import com.allowance.domain.model.TrackerSnapshot;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * Running totals of one child for one limit window.
 *
 * spentAmount is committed spend, pendingAmount is held by pending requests.
 * Both stay non-negative. A window that has ended is history and is not updated.
 */
@Entity
@Table(name = "spending_limit_trackers", indexes = {
    @Index(name = "idx_tracker_window", columnList = "childId,period,periodStart", unique = true),
    @Index(name = "idx_tracker_period_end", columnList = "periodEnd")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpendingLimitTrackerEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID trackerId;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID childId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private LimitPeriod period;

    @Column(nullable = false)
    private Instant periodStart;

    @Column(nullable = false)
    private Instant periodEnd;

    /** Limit in force when the window was opened or last edited by a parent. */
    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal limitAmount;

    @Column(nullable = false)
    private boolean includesPendingRequests;

    @Column(nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal spentAmount = BigDecimal.ZERO;

    @Column(nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal pendingAmount = BigDecimal.ZERO;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (trackerId == null) {
            trackerId = UUID.randomUUID();
        }
    }

    public void addPending(BigDecimal amount) {
        pendingAmount = pendingAmount.add(amount);
    }

    /**
     * Release a reservation, never going below zero.
     *
     * @return the part of {@code amount} that could not be released
     */
    public BigDecimal releasePending(BigDecimal amount) {
        BigDecimal released = pendingAmount.min(amount);
        pendingAmount = pendingAmount.subtract(released);
        return amount.subtract(released);
    }

    public void addSpent(BigDecimal amount) {
        spentAmount = spentAmount.add(amount);
    }

    public BigDecimal getUsedAmount() {
        return spentAmount.add(pendingAmount);
    }

    public BigDecimal getRemainingAmount() {
        BigDecimal remaining = limitAmount.subtract(getUsedAmount());
        return remaining.signum() < 0 ? BigDecimal.ZERO : remaining;
    }

    /**
     * Share of the limit used, 0..1 and above when over the limit.
     */
    public BigDecimal getPercentUsed() {
        if (limitAmount.signum() == 0) {
            return getUsedAmount().signum() == 0 ? BigDecimal.ZERO : BigDecimal.ONE;
        }
        return getUsedAmount().divide(limitAmount, 4, RoundingMode.HALF_UP);
    }

    public TrackerSnapshot toSnapshot() {
        return TrackerSnapshot.builder()
                .period(period)
                .limitAmount(limitAmount)
                .spentAmount(spentAmount)
                .pendingAmount(pendingAmount)
                .build();
    }
}
