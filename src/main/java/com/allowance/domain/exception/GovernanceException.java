package com.allowance.domain.exception;

/**
 * Base of every failure the governance engine reports to its callers.
 */
public abstract class GovernanceException extends RuntimeException {

    protected GovernanceException(String message) {
        super(message);
    }

    protected GovernanceException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable machine-readable code for API responses.
     */
    public abstract String getCode();
}
