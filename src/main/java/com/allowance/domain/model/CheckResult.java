package com.allowance.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of evaluating a proposed purchase against a child's policy.
 */
@Value
@Builder
public class CheckResult {

    boolean canSpend;
    boolean requiresApproval;
    String blockReason;
    @Singular
    List<String> warnings;

    public static CheckResult blocked(String reason, List<String> warnings) {
        return CheckResult.builder()
                .canSpend(false)
                .requiresApproval(false)
                .blockReason(reason)
                .warnings(warnings)
                .build();
    }

    public static CheckResult allowed(boolean requiresApproval, List<String> warnings) {
        return CheckResult.builder()
                .canSpend(true)
                .requiresApproval(requiresApproval)
                .warnings(warnings)
                .build();
    }
}
