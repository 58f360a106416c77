package com.allowance.domain.model;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Partial update of approval settings. Null fields are left unchanged.
 * {@code clearMaxSinglePurchase} removes the purchase ceiling.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettingsUpdate {

    private Boolean enabled;

    @Digits(integer = 15, fraction = 2)
    private BigDecimal approvalThreshold;

    @Digits(integer = 15, fraction = 2)
    private BigDecimal maxSinglePurchase;

    private boolean clearMaxSinglePurchase;

    private Boolean autoApproveUnderThreshold;

    private Boolean autoApproveTrustedCategories;

    private Set<String> trustedCategoryIds;

    @Min(1)
    private Integer requestExpirationHours;
}
