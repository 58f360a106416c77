package com.allowance.infrastructure.persistence.entity;

import com.allowance.domain.model.LimitPeriod;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Maximum a child may spend per period. At most one per period.
 */
@Embeddable
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "period")
@ToString
public class SpendingLimit {

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private LimitPeriod period;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal limitAmount;

    /** Pending requests hold part of the limit until they are answered. */
    @Column(nullable = false)
    private boolean includesPendingRequests;
}
