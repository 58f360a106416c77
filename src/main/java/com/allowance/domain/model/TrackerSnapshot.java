package com.allowance.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Read-only view of one limit window used during evaluation.
 */
@Value
@Builder
public class TrackerSnapshot {

    LimitPeriod period;
    BigDecimal limitAmount;
    BigDecimal spentAmount;
    BigDecimal pendingAmount;

    public BigDecimal projectedWith(BigDecimal amount) {
        return spentAmount.add(pendingAmount).add(amount);
    }
}
