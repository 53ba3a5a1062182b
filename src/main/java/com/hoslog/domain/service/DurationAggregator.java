package com.hoslog.domain.service;

import com.hoslog.domain.model.ActivityRecord;
import com.hoslog.domain.model.DailyLog;
import com.hoslog.domain.model.DutyStatus;
import com.hoslog.domain.model.DutyStatusTotals;
import com.hoslog.domain.model.Hours;
import com.hoslog.domain.model.OpenActivity;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Sums time spent per duty status over a daily log.
 * Pure: the same inputs always produce the same totals. Durations are added exactly and
 * converted to fractional hours once, without rounding.
 */
public class DurationAggregator {

    public DutyStatusTotals aggregate(DailyLog dailyLog) {
        return aggregate(dailyLog, Optional.empty(), null);
    }

    /**
     * @param dailyLog         completed records of the day
     * @param openActivity     the still-open activity, if any
     * @param referenceInstant instant the open activity is measured up to; ignored without one
     */
    public DutyStatusTotals aggregate(DailyLog dailyLog, Optional<OpenActivity> openActivity, Instant referenceInstant) {
        Map<DutyStatus, Duration> durations = new EnumMap<>(DutyStatus.class);
        for (DutyStatus status : DutyStatus.values()) {
            durations.put(status, Duration.ZERO);
        }

        for (ActivityRecord record : dailyLog.getRecords()) {
            durations.merge(record.getStatus(), record.getDuration(), Duration::plus);
        }

        if (openActivity.isPresent()) {
            if (referenceInstant == null) {
                throw new IllegalArgumentException("referenceInstant is required with an open activity");
            }
            OpenActivity open = openActivity.get();
            durations.merge(open.getStatus(), open.elapsed(referenceInstant), Duration::plus);
        }

        Map<DutyStatus, Double> hours = new EnumMap<>(DutyStatus.class);
        durations.forEach((status, duration) -> hours.put(status, Hours.of(duration)));
        return DutyStatusTotals.ofHours(hours);
    }
}
