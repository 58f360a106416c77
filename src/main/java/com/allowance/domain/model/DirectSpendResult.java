package com.allowance.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class DirectSpendResult {

    UUID transactionId;
    BigDecimal newBalance;
    List<String> warnings;
}
