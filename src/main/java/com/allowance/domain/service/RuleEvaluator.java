package com.allowance.domain.service;

import com.allowance.config.GovernanceProperties;
import com.allowance.domain.model.Amounts;
import com.allowance.domain.model.CheckResult;
import com.allowance.domain.model.LimitPeriod;
import com.allowance.domain.model.SpendingPolicy;
import com.allowance.domain.model.TrackerLookup;
import com.allowance.domain.model.TrackerSnapshot;
import com.allowance.infrastructure.persistence.entity.CategoryRule;
import com.allowance.infrastructure.persistence.entity.SpendingLimit;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a child may spend an amount, and whether a parent must approve it.
 *
 * Rules are applied in order and the first denial wins:
 * <ol>
 *   <li>approval disabled: allowed without approval</li>
 *   <li>spending paused: denied</li>
 *   <li>above the maximum single purchase: denied</li>
 *   <li>category rule: BLOCKED denies; REQUIRES_APPROVAL, or an amount above the
 *       category threshold, forces approval</li>
 *   <li>each spending limit: denied when spent + pending + amount exceeds it,
 *       warning above the warning ratio</li>
 *   <li>approval threshold (or category threshold when set)</li>
 *   <li>trusted categories skip approval unless a category rule forced it</li>
 * </ol>
 *
 * No side effects apart from what the {@link TrackerLookup} does.
 */
@Component
@RequiredArgsConstructor
public class RuleEvaluator {

    private static final String DEFAULT_PAUSE_REASON = "Spending is currently paused";
    private static final String DEFAULT_BLOCK_REASON = "Purchases in this category are not allowed";

    private final GovernanceProperties properties;

    public CheckResult evaluate(SpendingPolicy policy, BigDecimal amount, String categoryId, TrackerLookup trackers) {
        if (!policy.isEnabled()) {
            return CheckResult.allowed(false, List.of());
        }
        if (policy.isPaused()) {
            return CheckResult.blocked(textOr(policy.getPauseReason(), DEFAULT_PAUSE_REASON), List.of());
        }
        if (policy.getMaxSinglePurchase() != null && amount.compareTo(policy.getMaxSinglePurchase()) > 0) {
            return CheckResult.blocked("Amount exceeds the maximum single purchase of "
                    + Amounts.format(policy.getMaxSinglePurchase()), List.of());
        }

        boolean forcedByCategory = false;
        BigDecimal threshold = policy.getApprovalThreshold();
        Optional<CategoryRule> rule = policy.ruleFor(categoryId);
        if (rule.isPresent()) {
            CategoryRule categoryRule = rule.get();
            switch (categoryRule.getRestriction()) {
                case BLOCKED:
                    return CheckResult.blocked(textOr(categoryRule.getRestrictionReason(), DEFAULT_BLOCK_REASON), List.of());
                case REQUIRES_APPROVAL:
                    forcedByCategory = true;
                    break;
                case ALLOWED:
                default:
                    break;
            }
            if (categoryRule.getCategoryThreshold() != null) {
                threshold = categoryRule.getCategoryThreshold();
                if (amount.compareTo(threshold) > 0) {
                    forcedByCategory = true;
                }
            }
        }

        List<String> warnings = new ArrayList<>();
        for (LimitPeriod period : LimitPeriod.values()) {
            SpendingLimit limit = policy.getSpendingLimits().get(period);
            if (limit == null) {
                continue;
            }
            TrackerSnapshot tracker = trackers.currentWindow(limit);
            BigDecimal projected = tracker.projectedWith(amount);
            BigDecimal limitAmount = tracker.getLimitAmount();
            if (projected.compareTo(limitAmount) > 0) {
                BigDecimal remaining = limitAmount.subtract(tracker.getSpentAmount()).subtract(tracker.getPendingAmount());
                return CheckResult.blocked("Would exceed " + period.getLabel() + " limit of "
                        + Amounts.format(limitAmount) + " ("
                        + Amounts.format(remaining.max(BigDecimal.ZERO)) + " remaining)", warnings);
            }
            if (limitAmount.signum() > 0) {
                if (projected.compareTo(limitAmount.multiply(properties.getWarningRatio())) > 0) {
                    BigDecimal ratio = projected.divide(limitAmount, 4, RoundingMode.HALF_UP);
                    warnings.add("This purchase uses " + ratio.movePointRight(2).setScale(0, RoundingMode.HALF_UP)
                            + "% of the " + period.getLabel() + " limit");
                }
            }
        }

        boolean requiresApproval = forcedByCategory
                || amount.compareTo(threshold) > 0
                || !policy.isAutoApproveUnderThreshold();
        if (requiresApproval && !forcedByCategory
                && policy.isAutoApproveTrustedCategories() && policy.isTrusted(categoryId)) {
            requiresApproval = false;
        }
        return CheckResult.allowed(requiresApproval, warnings);
    }

    private static String textOr(String text, String fallback) {
        return text == null || text.isBlank() ? fallback : text;
    }
}
