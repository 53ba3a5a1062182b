package com.hoslog.domain.model;

import java.util.List;

/**
 * Verdict of a compliance evaluation. Violations are listed in rule order.
 */
public record ComplianceResult(boolean compliant, List<Violation> violations) {

    public ComplianceResult {
        violations = List.copyOf(violations);
    }

    public static ComplianceResult of(List<Violation> violations) {
        return new ComplianceResult(violations.isEmpty(), violations);
    }

    public boolean hasViolation(HosRule rule) {
        return violations.stream().anyMatch(violation -> violation.rule() == rule);
    }
}
