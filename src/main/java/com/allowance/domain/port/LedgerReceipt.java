package com.allowance.domain.port;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class LedgerReceipt {

    UUID transactionId;
    BigDecimal newBalance;

    @JsonCreator
    public LedgerReceipt(@JsonProperty("transactionId") UUID transactionId,
                         @JsonProperty("newBalance") BigDecimal newBalance) {
        this.transactionId = transactionId;
        this.newBalance = newBalance;
    }
}
