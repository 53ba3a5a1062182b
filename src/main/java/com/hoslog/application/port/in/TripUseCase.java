package com.hoslog.application.port.in;

import com.hoslog.domain.model.CycleState;
import com.hoslog.domain.model.Trip;
import io.vertx.core.Future;

import java.util.List;

/**
 * Input port for trips and the cycle hours they consume
 */
public interface TripUseCase {

    Future<Trip> planTrip(PlanTripCommand command);

    /**
     * Mark a trip completed and commit its cycle hours
     * @return Future with the updated trip, failed with {@link TripNotFoundException} for an unknown id
     */
    Future<Trip> completeTrip(String driverId, String tripId);

    /**
     * Trips of a driver, newest first
     */
    Future<List<Trip>> listTrips(String driverId);

    Future<CycleState> cycleState(String driverId);

    /**
     * Start a new cycle at zero hours
     */
    Future<CycleState> resetCycle(String driverId);

    record PlanTripCommand(
            String driverId,
            String currentLocation,
            String pickupLocation,
            String dropoffLocation,
            Double cycleHoursUsed,
            Double distanceMiles,
            Double durationHours
    ) {}

    class TripNotFoundException extends RuntimeException {
        public TripNotFoundException(String driverId, String tripId) {
            super("Trip " + tripId + " not found for driver " + driverId);
        }
    }
}
