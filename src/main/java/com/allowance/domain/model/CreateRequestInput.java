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
import java.util.UUID;

/**
 * Purchase a child asks a parent to approve.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateRequestInput {

    @NotNull
    private UUID familyId;

    @NotNull
    @Positive
    @Digits(integer = 15, fraction = 2)
    private BigDecimal amount;

    @NotBlank
    @Size(max = 500)
    private String description;

    @Size(max = 64)
    private String categoryId;

    private UUID wishListItemId;
}
