package com.allowance.domain.model;

import com.allowance.infrastructure.persistence.entity.SpendingLimit;

/**
 * Resolves the current window of a configured limit. Implementations may create
 * the window on first access; doing so twice has no further effect.
 */
@FunctionalInterface
public interface TrackerLookup {

    TrackerSnapshot currentWindow(SpendingLimit limit);
}
