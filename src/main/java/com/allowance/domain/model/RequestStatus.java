package com.allowance.domain.model;

/**
 * Status of a spending request. PENDING is the only non-terminal state.
 */
public enum RequestStatus {
    PENDING,
    APPROVED,
    DENIED,
    CANCELLED,
    EXPIRED;

    public boolean isTerminal() {
        return switch (this) {
            case PENDING -> false;
            case APPROVED, DENIED, CANCELLED, EXPIRED -> true;
        };
    }
}
