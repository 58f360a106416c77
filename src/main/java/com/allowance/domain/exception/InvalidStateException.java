package com.allowance.domain.exception;

/**
 * Operation not allowed in the current state, e.g. responding to a request
 * that is no longer pending.
 */
public class InvalidStateException extends GovernanceException {

    public InvalidStateException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "INVALID_STATE";
    }
}
