package com.hoslog.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.ZoneId;

/**
 * Hours-of-service limits and the time zone that defines a driver's day.
 * Defaults follow the US property-carrying rules: 11 hours driving, 14 hours on duty,
 * 70 hours per 8-day cycle.
 */
@Value
@Builder(toBuilder = true)
public class HosPolicy {
    public static final double DEFAULT_DRIVING_LIMIT_HOURS = 11.0;
    public static final double DEFAULT_ON_DUTY_LIMIT_HOURS = 14.0;
    public static final double DEFAULT_CYCLE_LIMIT_HOURS = 70.0;
    public static final int DEFAULT_CYCLE_DAYS = 8;
    public static final double DEFAULT_CYCLE_WARNING_RATIO = 0.8;

    @Builder.Default
    double drivingLimitHours = DEFAULT_DRIVING_LIMIT_HOURS;
    @Builder.Default
    double onDutyLimitHours = DEFAULT_ON_DUTY_LIMIT_HOURS;
    @Builder.Default
    double cycleLimitHours = DEFAULT_CYCLE_LIMIT_HOURS;
    @Builder.Default
    int cycleDays = DEFAULT_CYCLE_DAYS;
    @Builder.Default
    double cycleWarningRatio = DEFAULT_CYCLE_WARNING_RATIO;
    @Builder.Default
    ZoneId zone = ZoneId.of("UTC");

    public static HosPolicy defaults() {
        return HosPolicy.builder().build();
    }
}
