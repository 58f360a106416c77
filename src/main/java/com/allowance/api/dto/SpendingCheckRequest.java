package com.allowance.api.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SpendingCheckRequest {

    @NotNull
    @Positive
    @Digits(integer = 15, fraction = 2)
    private BigDecimal amount;

    @Size(max = 64)
    private String categoryId;
}
