package com.hoslog.domain.model;

/**
 * Hours-of-service rules checked by the compliance evaluator
 */
public enum HosRule {
    DRIVING_LIMIT("driving-limit"),
    ON_DUTY_LIMIT("on-duty-limit"),
    CYCLE_LIMIT("cycle-limit");

    private final String value;

    HosRule(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static HosRule fromValue(String value) {
        for (HosRule rule : values()) {
            if (rule.value.equalsIgnoreCase(value)) {
                return rule;
            }
        }
        throw new IllegalArgumentException("Unknown HOS rule: " + value);
    }
}
