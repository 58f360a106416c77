package com.allowance.api.dto;

import com.allowance.domain.model.CategoryRestriction;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CategoryRuleRequest {

    @NotNull
    private CategoryRestriction restriction;

    @PositiveOrZero
    @Digits(integer = 15, fraction = 2)
    private BigDecimal categoryThreshold;

    @Size(max = 500)
    private String restrictionReason;
}
