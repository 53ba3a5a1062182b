package com.hoslog.domain.model;

import com.hoslog.domain.exception.InvalidTimeRangeException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Completed duty-status activity. Immutable; the duration is derived from the
 * start and end instants and cannot be set independently.
 */
@Value
public class ActivityRecord {
    String id;
    DutyStatus status;
    Instant startTime;
    Instant endTime;
    String location;
    String notes;          // Optional free text entered by the driver
    Double odometer;       // Pass-through telemetry, may be null
    Double engineHours;    // Pass-through telemetry, may be null

    @Builder(toBuilder = true)
    public ActivityRecord(String id, DutyStatus status, Instant startTime, Instant endTime,
                          String location, String notes, Double odometer, Double engineHours) {
        this.id = Objects.requireNonNull(id, "id");
        this.status = Objects.requireNonNull(status, "status");
        this.startTime = Objects.requireNonNull(startTime, "startTime");
        this.endTime = Objects.requireNonNull(endTime, "endTime");
        if (endTime.isBefore(startTime)) {
            throw new InvalidTimeRangeException(
                    "Activity " + id + " ends at " + endTime + " before it starts at " + startTime);
        }
        this.location = location;
        this.notes = notes;
        this.odometer = odometer;
        this.engineHours = engineHours;
    }

    public Duration getDuration() {
        return Duration.between(startTime, endTime);
    }

    public double getDurationHours() {
        return Hours.of(getDuration());
    }

    public boolean overlaps(Instant from, Instant to) {
        return startTime.isBefore(to) && endTime.isAfter(from);
    }

    /**
     * Portion of this record inside [from, to), empty when the record lies outside the window
     */
    public Optional<ActivityRecord> clipTo(Instant from, Instant to) {
        if (!overlaps(from, to)) {
            return Optional.empty();
        }
        if (!startTime.isBefore(from) && !endTime.isAfter(to)) {
            return Optional.of(this);
        }
        Instant clippedStart = startTime.isBefore(from) ? from : startTime;
        Instant clippedEnd = endTime.isAfter(to) ? to : endTime;
        return Optional.of(toBuilder()
                .startTime(clippedStart)
                .endTime(clippedEnd)
                .build());
    }
}
