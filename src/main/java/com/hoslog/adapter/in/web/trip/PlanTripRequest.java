package com.hoslog.adapter.in.web.trip;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of POST /api/drivers/:driverId/trips. Distance and duration come from the client's route lookup.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlanTripRequest(
        String currentLocation,
        String pickupLocation,
        String dropoffLocation,
        Double cycleHoursUsed,
        Double distanceMiles,
        Double durationHours
) {}
