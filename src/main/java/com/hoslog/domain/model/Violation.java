package com.hoslog.domain.model;

/**
 * A breached rule together with its limit and the measured hours
 */
public record Violation(HosRule rule, double limit, double actual) {

    public double excessHours() {
        return actual - limit;
    }
}
