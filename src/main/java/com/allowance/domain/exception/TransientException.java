package com.allowance.domain.exception;

/**
 * Timeout or temporary unavailability of the ledger, the database or the child lock.
 * Safe to retry; the engine itself never retries.
 */
public class TransientException extends GovernanceException {

    public TransientException(String message) {
        super(message);
    }

    public TransientException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "TEMPORARILY_UNAVAILABLE";
    }
}
