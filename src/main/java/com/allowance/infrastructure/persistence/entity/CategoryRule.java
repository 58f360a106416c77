package com.allowance.infrastructure.persistence.entity;

import com.allowance.domain.model.CategoryRestriction;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Restriction a parent places on one spending category.
 * Owned by {@link ApprovalSettingsEntity}; identity is the category id.
 */
@Embeddable
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "categoryId")
@ToString
public class CategoryRule {

    @Column(name = "category_id", nullable = false, length = 64)
    private String categoryId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CategoryRestriction restriction;

    /** Overrides the global approval threshold for this category. */
    @Column(precision = 19, scale = 4)
    private BigDecimal categoryThreshold;

    @Column(length = 500)
    private String restrictionReason;
}
