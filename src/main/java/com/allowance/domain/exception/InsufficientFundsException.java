package com.allowance.domain.exception;

/**
 * The ledger refused a debit because the child's balance is too low.
 */
public class InsufficientFundsException extends GovernanceException {

    public InsufficientFundsException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "INSUFFICIENT_FUNDS";
    }
}
