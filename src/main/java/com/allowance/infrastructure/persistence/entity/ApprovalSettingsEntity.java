package com.allowance.infrastructure.persistence.entity;

import com.allowance.domain.model.LimitPeriod;
import com.allowance.domain.model.SpendingPolicy;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Approval policy of one child.
 *
 * Category rules and spending limits are value collections owned by the settings
 * row and always loaded together with it, so evaluation never triggers lazy loads.
 */
@Entity
@Table(name = "approval_settings", indexes = {
    @Index(name = "idx_settings_child", columnList = "childId", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalSettingsEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID settingsId;

    @Column(nullable = false, unique = true, columnDefinition = "UUID")
    private UUID childId;

    @Column(nullable = false)
    private boolean enabled;

    @Column(nullable = false)
    private boolean paused;

    @Column(length = 500)
    private String pauseReason;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal approvalThreshold;

    @Column(precision = 19, scale = 4)
    private BigDecimal maxSinglePurchase;

    @Column(nullable = false)
    private boolean autoApproveUnderThreshold;

    @Column(nullable = false)
    private boolean autoApproveTrustedCategories;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "approval_trusted_categories", joinColumns = @JoinColumn(name = "settings_id"))
    @Column(name = "category_id", length = 64)
    @Builder.Default
    private Set<String> trustedCategoryIds = new HashSet<>();

    @Column(nullable = false)
    private int requestExpirationHours;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "category_rules", joinColumns = @JoinColumn(name = "settings_id"))
    @Builder.Default
    private Set<CategoryRule> categoryRules = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "spending_limits", joinColumns = @JoinColumn(name = "settings_id"))
    @Builder.Default
    private Set<SpendingLimit> spendingLimits = new HashSet<>();

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (settingsId == null) {
            settingsId = UUID.randomUUID();
        }
    }

    /**
     * Insert or replace the rule for the rule's category.
     */
    public void putCategoryRule(CategoryRule rule) {
        categoryRules.remove(rule);
        categoryRules.add(rule);
    }

    public boolean removeCategoryRule(String categoryId) {
        return categoryRules.removeIf(rule -> rule.getCategoryId().equals(categoryId));
    }

    public void putSpendingLimit(SpendingLimit limit) {
        spendingLimits.remove(limit);
        spendingLimits.add(limit);
    }

    public boolean removeSpendingLimit(LimitPeriod period) {
        return spendingLimits.removeIf(limit -> limit.getPeriod() == period);
    }

    public SpendingPolicy toPolicy() {
        Map<String, CategoryRule> rules = new HashMap<>();
        categoryRules.forEach(rule -> rules.put(rule.getCategoryId(), rule));

        Map<LimitPeriod, SpendingLimit> limits = new EnumMap<>(LimitPeriod.class);
        spendingLimits.forEach(limit -> limits.put(limit.getPeriod(), limit));

        return SpendingPolicy.builder()
                .childId(childId)
                .enabled(enabled)
                .paused(paused)
                .pauseReason(pauseReason)
                .approvalThreshold(approvalThreshold)
                .maxSinglePurchase(maxSinglePurchase)
                .autoApproveUnderThreshold(autoApproveUnderThreshold)
                .autoApproveTrustedCategories(autoApproveTrustedCategories)
                .trustedCategoryIds(Collections.unmodifiableSet(new HashSet<>(trustedCategoryIds)))
                .requestExpirationHours(requestExpirationHours)
                .categoryRules(Collections.unmodifiableMap(rules))
                .spendingLimits(Collections.unmodifiableMap(limits))
                .build();
    }
}
