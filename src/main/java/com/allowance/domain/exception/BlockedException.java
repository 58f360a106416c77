package com.allowance.domain.exception;

/**
 * A policy rule denies the purchase. The message is shown to the child as is.
 */
public class BlockedException extends GovernanceException {

    public BlockedException(String reason) {
        super(reason);
    }

    @Override
    public String getCode() {
        return "SPENDING_BLOCKED";
    }
}
