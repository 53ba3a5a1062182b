package com.hoslog.domain.model;

import lombok.Value;

/**
 * Committed hours against the multi-day cycle limit.
 * Always satisfies {@code 0 <= hoursUsed <= hoursLimit}.
 */
@Value
public class CycleState {
    double hoursUsed;
    double hoursLimit;

    public CycleState(double hoursUsed, double hoursLimit) {
        if (hoursLimit <= 0 || !Double.isFinite(hoursLimit)) {
            throw new IllegalArgumentException("hoursLimit must be a positive number: " + hoursLimit);
        }
        if (hoursUsed < 0 || hoursUsed > hoursLimit || Double.isNaN(hoursUsed)) {
            throw new IllegalArgumentException(
                    "hoursUsed must be between 0 and " + hoursLimit + ": " + hoursUsed);
        }
        this.hoursUsed = hoursUsed;
        this.hoursLimit = hoursLimit;
    }

    public double hoursRemaining() {
        return hoursLimit - hoursUsed;
    }

    public double percentUsed() {
        return hoursUsed / hoursLimit * 100.0;
    }

    public boolean isNearLimit(double warningRatio) {
        return hoursUsed >= hoursLimit * warningRatio;
    }
}
