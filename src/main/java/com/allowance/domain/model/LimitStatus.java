package com.allowance.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Current usage of one configured spending limit.
 */
@Value
@Builder
public class LimitStatus {

    LimitPeriod period;
    Instant periodStart;
    Instant periodEnd;
    BigDecimal limitAmount;
    BigDecimal spentAmount;
    BigDecimal pendingAmount;
    BigDecimal remainingAmount;
    BigDecimal percentUsed;
    boolean includesPendingRequests;
}
