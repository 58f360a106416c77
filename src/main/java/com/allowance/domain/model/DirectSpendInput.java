package com.allowance.domain.model;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Purchase that passes without parental approval.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DirectSpendInput {

    @NotNull
    @Positive
    @Digits(integer = 15, fraction = 2)
    private BigDecimal amount;

    @NotBlank
    @Size(max = 500)
    private String description;

    @Size(max = 64)
    private String categoryId;
}
