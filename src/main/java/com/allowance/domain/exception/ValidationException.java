package com.allowance.domain.exception;

/**
 * Malformed input. Always fixable by the caller; never retried.
 */
public class ValidationException extends GovernanceException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "VALIDATION_FAILED";
    }
}
