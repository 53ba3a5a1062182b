package com.hoslog.application.port.out;

import com.hoslog.domain.model.Trip;
import io.vertx.core.Future;

import java.util.List;
import java.util.Optional;

public interface TripRepository {

    Future<Trip> save(Trip trip);

    Future<Optional<Trip>> findById(String driverId, String tripId);

    /**
     * Trips of a driver, newest first
     */
    Future<List<Trip>> findByDriver(String driverId);
}
