package com.allowance.domain.model;

/**
 * What a terminal transition does with the amount reserved at creation.
 */
public enum ReservationEffect {
    /** Reserved amount becomes committed spend. */
    COMMIT,
    /** Reserved amount is handed back to the limit. */
    RELEASE
}
