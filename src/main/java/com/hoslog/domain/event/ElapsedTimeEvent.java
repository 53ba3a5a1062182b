package com.hoslog.domain.event;

import com.hoslog.domain.model.DutyStatus;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Live reading of a driver's open activity, published once per sampling tick.
 * Display refresh only, not part of the log.
 */
@Value
public class ElapsedTimeEvent {
    String driverId;
    String activityId;
    DutyStatus status;
    double elapsedHours;
    Map<DutyStatus, Double> totals;
    Instant sampledAt;
}
