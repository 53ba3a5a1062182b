package com.hoslog.domain.service;

import com.hoslog.domain.exception.AlreadyTrackingException;
import com.hoslog.domain.exception.InvalidTimeRangeException;
import com.hoslog.domain.exception.NotTrackingException;
import com.hoslog.domain.model.ActivityRecord;
import com.hoslog.domain.model.DutyStatus;
import com.hoslog.domain.model.OpenActivity;
import com.hoslog.domain.model.Telemetry;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Duty-status state machine for one driver.
 * <p>
 * Idle (no open activity) or Tracking (exactly one open activity). {@link #start} moves
 * Idle to Tracking, {@link #stop} closes the open activity into an {@link ActivityRecord}
 * and moves back to Idle. Illegal transitions throw and leave the state untouched.
 * <p>
 * Not thread-safe: callers must route every call for a driver through a single
 * execution context.
 */
@Slf4j
public class ActivityLedger {

    private final String driverId;
    private final Supplier<String> idGenerator;
    private final List<ActivityRecord> completed = new ArrayList<>();
    private OpenActivity openActivity;

    public ActivityLedger(String driverId) {
        this(driverId, () -> "activity-" + UUID.randomUUID());
    }

    public ActivityLedger(String driverId, Supplier<String> idGenerator) {
        this.driverId = Objects.requireNonNull(driverId, "driverId");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    /**
     * Open a new activity.
     *
     * @throws AlreadyTrackingException if an activity is already open
     * @throws InvalidTimeRangeException if {@code atTime} is before the end of the last completed activity
     */
    public OpenActivity start(DutyStatus status, Instant atTime, String location, String notes) {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(atTime, "atTime");
        if (openActivity != null) {
            throw new AlreadyTrackingException(driverId, openActivity.getStatus());
        }
        Optional<Instant> lastEnd = lastEndTime();
        if (lastEnd.isPresent() && atTime.isBefore(lastEnd.get())) {
            throw new InvalidTimeRangeException("Cannot start at " + atTime
                    + ": previous activity of driver " + driverId + " ended at " + lastEnd.get());
        }

        openActivity = OpenActivity.builder()
                .id(idGenerator.get())
                .status(status)
                .startTime(atTime)
                .location(location)
                .notes(notes)
                .build();
        log.info("Driver {} started {} at {}", driverId, status, atTime);
        return openActivity;
    }

    public ActivityRecord stop(Instant atTime) {
        return stop(atTime, Telemetry.none());
    }

    /**
     * Close the open activity.
     *
     * @throws NotTrackingException if no activity is open
     * @throws InvalidTimeRangeException if {@code atTime} is before the open activity's start
     */
    public ActivityRecord stop(Instant atTime, Telemetry telemetry) {
        Objects.requireNonNull(atTime, "atTime");
        if (openActivity == null) {
            throw new NotTrackingException(driverId);
        }
        if (atTime.isBefore(openActivity.getStartTime())) {
            throw new InvalidTimeRangeException("Cannot stop at " + atTime
                    + ": activity " + openActivity.getId() + " started at " + openActivity.getStartTime());
        }

        Telemetry readings = telemetry == null ? Telemetry.none() : telemetry;
        ActivityRecord record = ActivityRecord.builder()
                .id(openActivity.getId())
                .status(openActivity.getStatus())
                .startTime(openActivity.getStartTime())
                .endTime(atTime)
                .location(openActivity.getLocation())
                .notes(openActivity.getNotes())
                .odometer(readings.getOdometer())
                .engineHours(readings.getEngineHours())
                .build();

        completed.add(record);
        openActivity = null;
        log.info("Driver {} stopped {} at {} after {} hours",
                driverId, record.getStatus(), atTime, String.format("%.2f", record.getDurationHours()));
        return record;
    }

    public String getDriverId() {
        return driverId;
    }

    public boolean isTracking() {
        return openActivity != null;
    }

    public Optional<OpenActivity> currentActivity() {
        return Optional.ofNullable(openActivity);
    }

    /**
     * Completed activities in the order they were closed
     */
    public List<ActivityRecord> completedActivities() {
        return Collections.unmodifiableList(completed);
    }

    /**
     * Completed activities touching the given day, unclipped
     */
    public List<ActivityRecord> completedOn(LocalDate date, ZoneId zone) {
        Instant dayStart = date.atStartOfDay(zone).toInstant();
        Instant dayEnd = date.plusDays(1).atStartOfDay(zone).toInstant();
        List<ActivityRecord> result = new ArrayList<>();
        for (ActivityRecord record : completed) {
            if (record.overlaps(dayStart, dayEnd)) {
                result.add(record);
            }
        }
        return result;
    }

    private Optional<Instant> lastEndTime() {
        if (completed.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(completed.get(completed.size() - 1).getEndTime());
    }
}
