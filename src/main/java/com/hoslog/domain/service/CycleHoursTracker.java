package com.hoslog.domain.service;

import com.hoslog.domain.model.CycleState;
import lombok.extern.slf4j.Slf4j;

/**
 * Running total of committed cycle hours, clamped at the cycle limit.
 * The total only grows; {@link #reset()} starts a new cycle.
 */
@Slf4j
public class CycleHoursTracker {

    private final double hoursLimit;
    private double hoursUsed;

    public CycleHoursTracker(double hoursLimit) {
        this(0.0, hoursLimit);
    }

    public CycleHoursTracker(double initialHoursUsed, double hoursLimit) {
        CycleState initial = new CycleState(initialHoursUsed, hoursLimit);
        this.hoursUsed = initial.getHoursUsed();
        this.hoursLimit = initial.getHoursLimit();
    }

    public CycleState commit(double hoursDelta) {
        if (hoursDelta < 0 || !Double.isFinite(hoursDelta)) {
            throw new IllegalArgumentException("hoursDelta must be a non-negative number: " + hoursDelta);
        }
        double previous = hoursUsed;
        hoursUsed = Math.min(hoursUsed + hoursDelta, hoursLimit);
        if (hoursUsed == hoursLimit && previous + hoursDelta > hoursLimit) {
            log.warn("Cycle hours clamped at limit {} (requested {} + {})", hoursLimit, previous, hoursDelta);
        }
        return state();
    }

    public CycleState reset() {
        log.info("Cycle reset after {} of {} hours", hoursUsed, hoursLimit);
        hoursUsed = 0.0;
        return state();
    }

    public CycleState state() {
        return new CycleState(hoursUsed, hoursLimit);
    }
}
