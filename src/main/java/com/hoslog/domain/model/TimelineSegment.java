package com.hoslog.domain.model;

import lombok.Value;

/**
 * Constant-status stretch of the day graph, in hours from midnight
 */
@Value
public class TimelineSegment {
    double startHour;
    double endHour;
    TimelineStatus status;

    public double lengthHours() {
        return endHour - startHour;
    }

    public int getRank() {
        return status.getRank();
    }
}
