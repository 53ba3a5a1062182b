package com.hoslog.adapter.out.persistence;

import com.hoslog.application.port.out.TripRepository;
import com.hoslog.domain.model.Trip;
import io.vertx.core.Future;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of TripRepository.
 * Trips keep their insertion order per driver; updates replace in place.
 */
public class InMemoryTripAdapter implements TripRepository {

    private final Map<String, Map<String, Trip>> tripsByDriver = new ConcurrentHashMap<>();

    @Override
    public Future<Trip> save(Trip trip) {
        Map<String, Trip> trips = tripsByDriver.computeIfAbsent(trip.getDriverId(),
                id -> Collections.synchronizedMap(new LinkedHashMap<>()));
        trips.put(trip.getId(), trip);
        return Future.succeededFuture(trip);
    }

    @Override
    public Future<Optional<Trip>> findById(String driverId, String tripId) {
        Map<String, Trip> trips = tripsByDriver.getOrDefault(driverId, Map.of());
        return Future.succeededFuture(Optional.ofNullable(trips.get(tripId)));
    }

    @Override
    public Future<List<Trip>> findByDriver(String driverId) {
        Map<String, Trip> trips = tripsByDriver.getOrDefault(driverId, Map.of());
        List<Trip> result;
        synchronized (trips) {
            result = new ArrayList<>(trips.values());
        }
        Collections.reverse(result);
        result.sort(Comparator.comparing(Trip::getDate).reversed());
        return Future.succeededFuture(result);
    }
}
