package com.hoslog.domain.model;

/**
 * Row of the 24-hour graph: one of the duty statuses, or UNSPECIFIED for time the log
 * does not account for.
 */
public enum TimelineStatus {
    UNSPECIFIED(null),
    OFF_DUTY(DutyStatus.OFF_DUTY),
    SLEEPER_BERTH(DutyStatus.SLEEPER_BERTH),
    DRIVING(DutyStatus.DRIVING),
    ON_DUTY_NOT_DRIVING(DutyStatus.ON_DUTY_NOT_DRIVING);

    private final DutyStatus dutyStatus;

    TimelineStatus(DutyStatus dutyStatus) {
        this.dutyStatus = dutyStatus;
    }

    public static TimelineStatus of(DutyStatus status) {
        for (TimelineStatus candidate : values()) {
            if (candidate.dutyStatus == status) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("No timeline row for " + status);
    }

    /**
     * Vertical rank on the graph, 0 for unspecified time
     */
    public int getRank() {
        return dutyStatus == null ? 0 : dutyStatus.getRank();
    }

    public boolean isSpecified() {
        return dutyStatus != null;
    }

    public DutyStatus getDutyStatus() {
        return dutyStatus;
    }
}
