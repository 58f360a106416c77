package com.allowance.infrastructure.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Body of a debit call to the ledger service.
 */
@Value
@Builder
public class LedgerDebitRequest {

    BigDecimal amount;
    String description;
    String categoryId;
    String source;
}
