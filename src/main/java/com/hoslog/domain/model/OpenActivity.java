package com.hoslog.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Duty-status segment that has started but not been closed yet.
 * Only {@link com.hoslog.domain.service.ActivityLedger} creates and clears these.
 */
@Value
public class OpenActivity {
    String id;
    DutyStatus status;
    Instant startTime;
    String location;
    String notes;

    @Builder
    public OpenActivity(String id, DutyStatus status, Instant startTime, String location, String notes) {
        this.id = Objects.requireNonNull(id, "id");
        this.status = Objects.requireNonNull(status, "status");
        this.startTime = Objects.requireNonNull(startTime, "startTime");
        this.location = location;
        this.notes = notes;
    }

    /**
     * Time elapsed since start, never negative
     */
    public Duration elapsed(Instant reference) {
        Duration elapsed = Duration.between(startTime, reference);
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    public double elapsedHours(Instant reference) {
        return Hours.of(elapsed(reference));
    }

    /**
     * Same activity seen from {@code from} onwards, used to count only the part inside a day
     */
    public OpenActivity clippedFrom(Instant from) {
        if (!startTime.isBefore(from)) {
            return this;
        }
        return new OpenActivity(id, status, from, location, notes);
    }
}
