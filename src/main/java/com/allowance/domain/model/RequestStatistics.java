package com.allowance.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Counts of a child's spending requests by outcome.
 * {@code approvalRate} is approved / (approved + denied), 0 when nothing was answered.
 */
@Value
@Builder
public class RequestStatistics {

    UUID childId;
    long total;
    long pending;
    long approved;
    long denied;
    long cancelled;
    long expired;
    BigDecimal approvalRate;
    BigDecimal approvedAmount;
}
