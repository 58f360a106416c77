package com.allowance.domain.service;

import com.allowance.config.GovernanceProperties;
import com.allowance.domain.exception.NotFoundException;
import com.allowance.domain.exception.ValidationException;
import com.allowance.domain.model.Amounts;
import com.allowance.domain.model.LimitPeriod;
import com.allowance.domain.model.SettingsUpdate;
import com.allowance.domain.model.SpendingPolicy;
import com.allowance.infrastructure.persistence.entity.ApprovalSettingsEntity;
import com.allowance.infrastructure.persistence.entity.CategoryRule;
import com.allowance.infrastructure.persistence.entity.SpendingLimit;
import com.allowance.infrastructure.persistence.repository.ApprovalSettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Approval settings, category rules and spending limits per child.
 *
 * Settings are created with configured defaults the first time a child is seen.
 * Every read and write runs under the child's lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyStore {

    private static final int MAX_TEXT_LENGTH = 500;

    private final ApprovalSettingsRepository settingsRepository;
    private final LimitTracker limitTracker;
    private final ChildLockManager lockManager;
    private final GovernanceProperties properties;
    private final Clock clock;

    /**
     * Current policy of the child, creating default settings if there are none.
     */
    public SpendingPolicy getPolicy(UUID childId) {
        requireChild(childId);
        return lockManager.executeLocked(childId, () -> loadOrCreate(childId).toPolicy());
    }

    public SpendingPolicy updateSettings(UUID childId, SettingsUpdate update) {
        if (update == null) {
            throw new ValidationException("Settings update is required");
        }
        return modify(childId, settings -> {
            if (update.getEnabled() != null) {
                settings.setEnabled(update.getEnabled());
            }
            if (update.getApprovalThreshold() != null) {
                settings.setApprovalThreshold(
                        Amounts.requireNonNegative(update.getApprovalThreshold(), "approvalThreshold"));
            }
            if (update.isClearMaxSinglePurchase()) {
                settings.setMaxSinglePurchase(null);
            } else if (update.getMaxSinglePurchase() != null) {
                settings.setMaxSinglePurchase(
                        Amounts.requirePositive(update.getMaxSinglePurchase(), "maxSinglePurchase"));
            }
            if (update.getAutoApproveUnderThreshold() != null) {
                settings.setAutoApproveUnderThreshold(update.getAutoApproveUnderThreshold());
            }
            if (update.getAutoApproveTrustedCategories() != null) {
                settings.setAutoApproveTrustedCategories(update.getAutoApproveTrustedCategories());
            }
            if (update.getTrustedCategoryIds() != null) {
                if (update.getTrustedCategoryIds().stream().anyMatch(id -> id == null || id.isBlank())) {
                    throw new ValidationException("Trusted category ids cannot be blank");
                }
                settings.setTrustedCategoryIds(new HashSet<>(update.getTrustedCategoryIds()));
            }
            if (update.getRequestExpirationHours() != null) {
                if (update.getRequestExpirationHours() < 1) {
                    throw new ValidationException("requestExpirationHours must be at least 1");
                }
                settings.setRequestExpirationHours(update.getRequestExpirationHours());
            }
        });
    }

    public SpendingPolicy upsertCategoryRule(UUID childId, CategoryRule rule) {
        if (rule == null || rule.getCategoryId() == null || rule.getCategoryId().isBlank()) {
            throw new ValidationException("categoryId is required");
        }
        if (rule.getRestriction() == null) {
            throw new ValidationException("restriction is required");
        }
        CategoryRule validated = rule.toBuilder()
                .categoryThreshold(rule.getCategoryThreshold() == null ? null
                        : Amounts.requireNonNegative(rule.getCategoryThreshold(), "categoryThreshold"))
                .restrictionReason(requireShortText(rule.getRestrictionReason(), "restrictionReason"))
                .build();
        SpendingPolicy policy = modify(childId, settings -> settings.putCategoryRule(validated));
        log.info("Category rule for child {} set: {} {}", childId, validated.getCategoryId(), validated.getRestriction());
        return policy;
    }

    public SpendingPolicy removeCategoryRule(UUID childId, String categoryId) {
        return modify(childId, settings -> {
            if (!settings.removeCategoryRule(categoryId)) {
                throw new NotFoundException("No rule for category " + categoryId);
            }
        });
    }

    /**
     * Insert or replace the limit for its period. The current window, if already
     * open, picks up the new amount immediately.
     */
    public SpendingPolicy upsertSpendingLimit(UUID childId, SpendingLimit limit) {
        if (limit == null || limit.getPeriod() == null) {
            throw new ValidationException("period is required");
        }
        SpendingLimit validated = limit.toBuilder()
                .limitAmount(Amounts.requireNonNegative(limit.getLimitAmount(), "limitAmount"))
                .build();
        SpendingPolicy policy = modify(childId, settings -> {
            settings.putSpendingLimit(validated);
            limitTracker.refreshLimit(childId, validated, clock.instant());
        });
        log.info("Spending limit for child {} set: {} {}", childId, validated.getPeriod(), validated.getLimitAmount());
        return policy;
    }

    public SpendingPolicy removeSpendingLimit(UUID childId, LimitPeriod period) {
        return modify(childId, settings -> {
            if (!settings.removeSpendingLimit(period)) {
                throw new NotFoundException("No " + (period == null ? "" : period.getLabel() + " ") + "spending limit configured");
            }
        });
    }

    public SpendingPolicy setPaused(UUID childId, String reason) {
        String validatedReason = requireShortText(reason, "pauseReason");
        SpendingPolicy policy = modify(childId, settings -> {
            settings.setPaused(true);
            settings.setPauseReason(validatedReason);
        });
        log.info("Spending paused for child {}: {}", childId, validatedReason);
        return policy;
    }

    public SpendingPolicy resume(UUID childId) {
        SpendingPolicy policy = modify(childId, settings -> {
            settings.setPaused(false);
            settings.setPauseReason(null);
        });
        log.info("Spending resumed for child {}", childId);
        return policy;
    }

    private SpendingPolicy modify(UUID childId, Consumer<ApprovalSettingsEntity> change) {
        requireChild(childId);
        return lockManager.executeLocked(childId, () -> {
            ApprovalSettingsEntity settings = loadOrCreate(childId);
            change.accept(settings);
            settings.setUpdatedAt(clock.instant());
            settingsRepository.save(settings);
            return settings.toPolicy();
        });
    }

    private ApprovalSettingsEntity loadOrCreate(UUID childId) {
        return settingsRepository.findByChildId(childId).orElseGet(() -> createDefaults(childId));
    }

    private ApprovalSettingsEntity createDefaults(UUID childId) {
        GovernanceProperties.Defaults defaults = properties.getDefaults();
        Instant now = clock.instant();
        ApprovalSettingsEntity settings = ApprovalSettingsEntity.builder()
                .settingsId(UUID.randomUUID())
                .childId(childId)
                .enabled(defaults.isEnabled())
                .paused(false)
                .approvalThreshold(defaults.getApprovalThreshold())
                .autoApproveUnderThreshold(defaults.isAutoApproveUnderThreshold())
                .autoApproveTrustedCategories(false)
                .requestExpirationHours(defaults.getRequestExpirationHours())
                .createdAt(now)
                .updatedAt(now)
                .build();
        settingsRepository.save(settings);
        log.info("Created default approval settings for child {}", childId);
        return settings;
    }

    private static void requireChild(UUID childId) {
        if (childId == null) {
            throw new ValidationException("childId is required");
        }
    }

    private static String requireShortText(String text, String field) {
        if (text != null && text.length() > MAX_TEXT_LENGTH) {
            throw new ValidationException(field + " cannot exceed " + MAX_TEXT_LENGTH + " characters");
        }
        return text;
    }
}
