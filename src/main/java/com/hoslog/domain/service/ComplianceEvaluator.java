package com.hoslog.domain.service;

import com.hoslog.domain.model.ComplianceResult;
import com.hoslog.domain.model.CycleState;
import com.hoslog.domain.model.DutyStatusTotals;
import com.hoslog.domain.model.HosPolicy;
import com.hoslog.domain.model.HosRule;
import com.hoslog.domain.model.Violation;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks aggregated hours against the hours-of-service limits.
 * Limits are inclusive: hitting a limit exactly is compliant, anything above it by more than
 * {@link #EPSILON} is a violation.
 */
@RequiredArgsConstructor
public class ComplianceEvaluator {

    static final double EPSILON = 1e-9;

    private final HosPolicy policy;

    public ComplianceEvaluator() {
        this(HosPolicy.defaults());
    }

    /**
     * Daily driving and on-duty rules
     */
    public ComplianceResult evaluate(DutyStatusTotals totals) {
        List<Violation> violations = new ArrayList<>();
        check(HosRule.DRIVING_LIMIT, policy.getDrivingLimitHours(), totals.drivingHours(), violations);
        check(HosRule.ON_DUTY_LIMIT, policy.getOnDutyLimitHours(), totals.onDutyHours(), violations);
        return ComplianceResult.of(violations);
    }

    /**
     * Daily rules plus the cycle rule. The day's on-duty hours are not committed to the cycle yet,
     * so they are added to the committed hours before comparing with the cycle limit.
     */
    public ComplianceResult evaluate(DutyStatusTotals totals, CycleState cycle) {
        List<Violation> violations = new ArrayList<>(evaluate(totals).violations());
        check(HosRule.CYCLE_LIMIT, cycle.getHoursLimit(), cycle.getHoursUsed() + totals.onDutyHours(), violations);
        return ComplianceResult.of(violations);
    }

    public double remainingDrivingHours(DutyStatusTotals totals) {
        return Math.max(0.0, policy.getDrivingLimitHours() - totals.drivingHours());
    }

    public double remainingOnDutyHours(DutyStatusTotals totals) {
        return Math.max(0.0, policy.getOnDutyLimitHours() - totals.onDutyHours());
    }

    private void check(HosRule rule, double limit, double actual, List<Violation> violations) {
        if (actual > limit + EPSILON) {
            violations.add(new Violation(rule, limit, actual));
        }
    }
}
