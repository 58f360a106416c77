package com.allowance.domain.service;

import com.allowance.domain.exception.NotFoundException;
import com.allowance.domain.exception.ValidationException;
import com.allowance.domain.model.CategoryRestriction;
import com.allowance.domain.model.CheckResult;
import com.allowance.domain.model.LimitPeriod;
import com.allowance.domain.model.SettingsUpdate;
import com.allowance.domain.model.SpendingPolicy;
import com.allowance.infrastructure.persistence.entity.CategoryRule;
import com.allowance.infrastructure.persistence.entity.SpendingLimit;
import com.allowance.infrastructure.persistence.entity.SpendingRequestEntity;
import com.allowance.support.GovernanceHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Set;
import java.util.UUID;

import static com.allowance.support.GovernanceHarness.requestInput;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(MockitoExtension.class)
class PolicyStoreTest {

    private GovernanceHarness harness;
    private PolicyStore policyStore;
    private UUID childId;

    @BeforeEach
    void setUp() {
        harness = new GovernanceHarness();
        policyStore = harness.policyStore;
        childId = UUID.randomUUID();
    }

    @Test
    void getPolicy_unknownChild_createsDefaults() {
        SpendingPolicy policy = policyStore.getPolicy(childId);

        assertTrue(policy.isEnabled());
        assertFalse(policy.isPaused());
        assertEquals(0, new BigDecimal("10.00").compareTo(policy.getApprovalThreshold()));
        assertEquals(72, policy.getRequestExpirationHours());
        assertTrue(policy.isAutoApproveUnderThreshold());
        assertNull(policy.getMaxSinglePurchase());
        assertTrue(policy.getCategoryRules().isEmpty());
        assertTrue(policy.getSpendingLimits().isEmpty());
        assertEquals(1, harness.repositories.settingsByChild.size());
    }

    @Test
    void updateSettings_changesOnlyGivenFields() {
        SpendingPolicy policy = policyStore.updateSettings(childId, SettingsUpdate.builder()
                .approvalThreshold(new BigDecimal("7.50"))
                .autoApproveTrustedCategories(true)
                .trustedCategoryIds(Set.of("school"))
                .build());

        assertEquals(0, new BigDecimal("7.50").compareTo(policy.getApprovalThreshold()));
        assertTrue(policy.isTrusted("school"));
        assertEquals(72, policy.getRequestExpirationHours());
        assertTrue(policy.isEnabled());
    }

    @Test
    void updateSettings_clearsMaxSinglePurchase() {
        policyStore.updateSettings(childId, SettingsUpdate.builder().maxSinglePurchase(new BigDecimal("40.00")).build());

        SpendingPolicy policy = policyStore.updateSettings(childId, SettingsUpdate.builder().clearMaxSinglePurchase(true).build());

        assertNull(policy.getMaxSinglePurchase());
    }

    @Test
    void updateSettings_rejectsInvalidValues() {
        assertThrows(ValidationException.class, () -> policyStore.updateSettings(childId,
                SettingsUpdate.builder().approvalThreshold(new BigDecimal("-1.00")).build()));
        assertThrows(ValidationException.class, () -> policyStore.updateSettings(childId,
                SettingsUpdate.builder().requestExpirationHours(0).build()));
        assertThrows(ValidationException.class, () -> policyStore.updateSettings(childId,
                SettingsUpdate.builder().maxSinglePurchase(BigDecimal.ZERO).build()));

        assertEquals(0, new BigDecimal("10.00").compareTo(policyStore.getPolicy(childId).getApprovalThreshold()));
    }

    @Test
    void upsertCategoryRule_replacesExistingRuleForCategory() {
        policyStore.upsertCategoryRule(childId, rule("candy", CategoryRestriction.REQUIRES_APPROVAL));

        SpendingPolicy policy = policyStore.upsertCategoryRule(childId, rule("candy", CategoryRestriction.BLOCKED));

        assertEquals(1, policy.getCategoryRules().size());
        assertEquals(CategoryRestriction.BLOCKED, policy.ruleFor("candy").orElseThrow().getRestriction());
    }

    @Test
    void upsertCategoryRule_requiresRestriction() {
        assertThrows(ValidationException.class,
                () -> policyStore.upsertCategoryRule(childId, CategoryRule.builder().categoryId("candy").build()));
    }

    @Test
    void removeCategoryRule_missing_notFound() {
        assertThrows(NotFoundException.class, () -> policyStore.removeCategoryRule(childId, "candy"));
    }

    @Test
    void removeCategoryRule_deletesRule() {
        policyStore.upsertCategoryRule(childId, rule("candy", CategoryRestriction.BLOCKED));

        SpendingPolicy policy = policyStore.removeCategoryRule(childId, "candy");

        assertTrue(policy.ruleFor("candy").isEmpty());
    }

    @Test
    void upsertSpendingLimit_onePerPeriod() {
        harness.givenLimit(childId, LimitPeriod.WEEKLY, "20.00", true);
        harness.givenLimit(childId, LimitPeriod.WEEKLY, "25.00", false);

        SpendingPolicy policy = policyStore.getPolicy(childId);

        assertEquals(1, policy.getSpendingLimits().size());
        SpendingLimit weekly = policy.getSpendingLimits().get(LimitPeriod.WEEKLY);
        assertEquals(0, new BigDecimal("25.00").compareTo(weekly.getLimitAmount()));
        assertFalse(weekly.isIncludesPendingRequests());
    }

    @Test
    void upsertSpendingLimit_rejectsNegativeAmount() {
        assertThrows(ValidationException.class, () -> harness.givenLimit(childId, LimitPeriod.DAILY, "-5.00", true));
    }

    @Test
    void removeSpendingLimit_missing_notFound() {
        assertThrows(NotFoundException.class, () -> policyStore.removeSpendingLimit(childId, LimitPeriod.MONTHLY));
    }

    @Test
    void pauseAndResume() {
        SpendingPolicy paused = policyStore.setPaused(childId, "Grounded");
        assertTrue(paused.isPaused());
        assertEquals("Grounded", paused.getPauseReason());

        SpendingPolicy resumed = policyStore.resume(childId);
        assertFalse(resumed.isPaused());
        assertNull(resumed.getPauseReason());
    }

    private static CategoryRule rule(String categoryId, CategoryRestriction restriction) {
        return CategoryRule.builder()
                .categoryId(categoryId)
                .restriction(restriction)
                .build();
    }

    @Test
    void readdedLimit_dropsReservationReleasedWhileItWasRemoved() {
        UUID familyId = UUID.randomUUID();
        harness.givenLimit(childId, LimitPeriod.WEEKLY, "20.00", true);
        SpendingRequestEntity request = harness.requestLifecycle.create(childId, requestInput(familyId, "15.00", "Lego set"));
        policyStore.removeSpendingLimit(childId, LimitPeriod.WEEKLY);
        harness.requestLifecycle.cancel(request.getRequestId(), childId);

        harness.givenLimit(childId, LimitPeriod.WEEKLY, "20.00", true);

        assertEquals(0, BigDecimal.ZERO.compareTo(harness.currentTracker(childId, LimitPeriod.WEEKLY).getPendingAmount()));
        CheckResult check = harness.spendingCheckService.checkSpending(childId, new BigDecimal("10.00"), null);
        assertTrue(check.isCanSpend());
    }

    @Test
    void readdedLimit_keepsHoldingStillPendingRequests() {
        UUID familyId = UUID.randomUUID();
        harness.givenLimit(childId, LimitPeriod.WEEKLY, "20.00", true);
        harness.requestLifecycle.create(childId, requestInput(familyId, "15.00", "Lego set"));
        policyStore.removeSpendingLimit(childId, LimitPeriod.WEEKLY);

        harness.givenLimit(childId, LimitPeriod.WEEKLY, "30.00", true);

        assertEquals(0, new BigDecimal("15.00").compareTo(harness.currentTracker(childId, LimitPeriod.WEEKLY).getPendingAmount()));
    }
}
