package com.hoslog.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * A planned or driven trip. Locations, distance and duration come from the caller's
 * route lookup and are carried as-is.
 */
@Value
@Builder(toBuilder = true)
public class Trip {
    String id;
    String driverId;
    LocalDate date;
    String currentLocation;
    String pickupLocation;
    String dropoffLocation;
    double cycleHoursUsed;   // Hours this trip adds to the cycle when completed
    TripStatus status;
    double distanceMiles;
    double durationHours;

    public boolean isCompleted() {
        return status == TripStatus.COMPLETED;
    }
}
