package com.allowance.domain.model;

import com.allowance.infrastructure.persistence.entity.CategoryRule;
import com.allowance.infrastructure.persistence.entity.SpendingLimit;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Fully materialized approval policy of one child: settings plus every category
 * rule and spending limit. Immutable.
 */
@Value
@Builder
public class SpendingPolicy {

    UUID childId;
    boolean enabled;
    boolean paused;
    String pauseReason;
    BigDecimal approvalThreshold;
    BigDecimal maxSinglePurchase;
    boolean autoApproveUnderThreshold;
    boolean autoApproveTrustedCategories;
    Set<String> trustedCategoryIds;
    int requestExpirationHours;
    Map<String, CategoryRule> categoryRules;
    Map<LimitPeriod, SpendingLimit> spendingLimits;

    public Optional<CategoryRule> ruleFor(String categoryId) {
        if (categoryId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(categoryRules.get(categoryId));
    }

    public boolean isTrusted(String categoryId) {
        return categoryId != null && trustedCategoryIds.contains(categoryId);
    }
}
