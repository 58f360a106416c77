package com.allowance.domain.model;

/**
 * Transitions out of {@link RequestStatus#PENDING}.
 *
 * Every transition starts at PENDING and lands on exactly one terminal state,
 * so each request releases or commits its reservation exactly once.
 */
public enum RequestTransition {
    APPROVE,
    DENY,
    CANCEL,
    EXPIRE;

    public RequestStatus targetStatus() {
        return switch (this) {
            case APPROVE -> RequestStatus.APPROVED;
            case DENY -> RequestStatus.DENIED;
            case CANCEL -> RequestStatus.CANCELLED;
            case EXPIRE -> RequestStatus.EXPIRED;
        };
    }

    public ReservationEffect reservationEffect() {
        return switch (this) {
            case APPROVE -> ReservationEffect.COMMIT;
            case DENY, CANCEL, EXPIRE -> ReservationEffect.RELEASE;
        };
    }

    /**
     * Whether the transition records a parent response (respondedBy, comment, ...).
     */
    public boolean isParentResponse() {
        return switch (this) {
            case APPROVE, DENY -> true;
            case CANCEL, EXPIRE -> false;
        };
    }
}
