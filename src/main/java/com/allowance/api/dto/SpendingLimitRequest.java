package com.allowance.api.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SpendingLimitRequest {

    @NotNull
    @PositiveOrZero
    @Digits(integer = 15, fraction = 2)
    private BigDecimal limitAmount;

    private boolean includesPendingRequests = true;
}
