package com.hoslog.domain.model;

import lombok.extern.slf4j.Slf4j;

/**
 * The four legal duty statuses of a driver's log entry.
 * Each status carries its backend wire code and its fixed row on the 24-hour graph
 * (bottom to top: off duty, sleeper berth, driving, on duty not driving).
 */
@Slf4j
public enum DutyStatus {
    OFF_DUTY("OFFDUTY", 1, "Off Duty"),
    SLEEPER_BERTH("SLEEPER", 2, "Sleeper Berth"),
    DRIVING("DRIVING", 3, "Driving"),
    ON_DUTY_NOT_DRIVING("ONDUTY", 4, "On Duty (Not Driving)");

    private final String value;
    private final int rank;
    private final String label;

    DutyStatus(String value, int rank, String label) {
        this.value = value;
        this.rank = rank;
        this.label = label;
    }

    /**
     * Wire code used by the backend activity records
     */
    public String getValue() {
        return value;
    }

    public int getRank() {
        return rank;
    }

    public String getLabel() {
        return label;
    }

    public boolean isOnDuty() {
        return this == DRIVING || this == ON_DUTY_NOT_DRIVING;
    }

    public static DutyStatus fromValue(String value) {
        for (DutyStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown duty status: " + value);
    }

    public static boolean isValid(String value) {
        for (DutyStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Lenient decoder for codes arriving from the backend.
     * Unknown or missing codes fall back to OFF_DUTY.
     */
    public static DutyStatus fromWireCode(String code) {
        if (code != null && isValid(code)) {
            return fromValue(code);
        }
        log.warn("Unknown duty status code '{}' from backend, defaulting to {}", code, OFF_DUTY);
        return OFF_DUTY;
    }
}
