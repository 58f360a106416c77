package com.allowance.api;

import com.allowance.api.dto.CategoryRuleRequest;
import com.allowance.api.dto.PauseRequest;
import com.allowance.api.dto.SpendingLimitRequest;
import com.allowance.domain.model.LimitPeriod;
import com.allowance.domain.model.SettingsUpdate;
import com.allowance.domain.model.SpendingPolicy;
import com.allowance.domain.service.PolicyStore;
import com.allowance.infrastructure.persistence.entity.CategoryRule;
import com.allowance.infrastructure.persistence.entity.SpendingLimit;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST API used by parents to edit a child's approval policy.
 */
@RestController
@RequestMapping("/api/v1/children/{childId}/approval-settings")
@RequiredArgsConstructor
public class ApprovalPolicyController {

    private final PolicyStore policyStore;

    @GetMapping
    public ResponseEntity<SpendingPolicy> getSettings(@PathVariable UUID childId) {
        return ResponseEntity.ok(policyStore.getPolicy(childId));
    }

    @PutMapping
    public ResponseEntity<SpendingPolicy> updateSettings(@PathVariable UUID childId,
                                                         @Valid @RequestBody SettingsUpdate update) {
        return ResponseEntity.ok(policyStore.updateSettings(childId, update));
    }

    @PutMapping("/category-rules/{categoryId}")
    public ResponseEntity<SpendingPolicy> upsertCategoryRule(@PathVariable UUID childId,
                                                             @PathVariable String categoryId,
                                                             @Valid @RequestBody CategoryRuleRequest request) {
        CategoryRule rule = CategoryRule.builder()
                .categoryId(categoryId)
                .restriction(request.getRestriction())
                .categoryThreshold(request.getCategoryThreshold())
                .restrictionReason(request.getRestrictionReason())
                .build();
        return ResponseEntity.ok(policyStore.upsertCategoryRule(childId, rule));
    }

    @DeleteMapping("/category-rules/{categoryId}")
    public ResponseEntity<SpendingPolicy> removeCategoryRule(@PathVariable UUID childId,
                                                             @PathVariable String categoryId) {
        return ResponseEntity.ok(policyStore.removeCategoryRule(childId, categoryId));
    }

    @PutMapping("/spending-limits/{period}")
    public ResponseEntity<SpendingPolicy> upsertSpendingLimit(@PathVariable UUID childId,
                                                              @PathVariable LimitPeriod period,
                                                              @Valid @RequestBody SpendingLimitRequest request) {
        SpendingLimit limit = SpendingLimit.builder()
                .period(period)
                .limitAmount(request.getLimitAmount())
                .includesPendingRequests(request.isIncludesPendingRequests())
                .build();
        return ResponseEntity.ok(policyStore.upsertSpendingLimit(childId, limit));
    }

    @DeleteMapping("/spending-limits/{period}")
    public ResponseEntity<SpendingPolicy> removeSpendingLimit(@PathVariable UUID childId,
                                                              @PathVariable LimitPeriod period) {
        return ResponseEntity.ok(policyStore.removeSpendingLimit(childId, period));
    }

    @PostMapping("/pause")
    public ResponseEntity<SpendingPolicy> pause(@PathVariable UUID childId,
                                                @Valid @RequestBody PauseRequest request) {
        return ResponseEntity.ok(policyStore.setPaused(childId, request.getReason()));
    }

    @PostMapping("/resume")
    public ResponseEntity<SpendingPolicy> resume(@PathVariable UUID childId) {
        return ResponseEntity.ok(policyStore.resume(childId));
    }
}
