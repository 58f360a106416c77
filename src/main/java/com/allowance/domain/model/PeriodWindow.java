package com.allowance.domain.model;

import lombok.Value;

import java.time.Instant;

/**
 * Concrete [start, end) range a limit period covers.
 */
@Value
public class PeriodWindow {

    Instant start;
    Instant end;

    public boolean contains(Instant at) {
        return !at.isBefore(start) && at.isBefore(end);
    }

    public boolean hasElapsed(Instant now) {
        return !now.isBefore(end);
    }
}
