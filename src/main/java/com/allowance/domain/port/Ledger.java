package com.allowance.domain.port;

import com.allowance.domain.exception.InsufficientFundsException;
import com.allowance.domain.exception.TransientException;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * External ledger that moves money out of a child's balance.
 */
public interface Ledger {

    /**
     * Debit the child's balance.
     *
     * @throws InsufficientFundsException balance too low
     * @throws TransientException ledger timed out or is unavailable
     */
    LedgerReceipt debit(UUID childId, BigDecimal amount, String description, String categoryId);
}
