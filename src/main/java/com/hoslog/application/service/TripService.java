package com.hoslog.application.service;

import com.hoslog.application.port.in.TripUseCase;
import com.hoslog.application.port.out.TripRepository;
import com.hoslog.domain.model.CycleState;
import com.hoslog.domain.model.HosPolicy;
import com.hoslog.domain.model.Trip;
import com.hoslog.domain.model.TripStatus;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Trip bookkeeping. Completing a trip is the event that feeds the driver's cycle hours.
 */
@Slf4j
public class TripService implements TripUseCase {

    private final DriverLedgerRegistry registry;
    private final TripRepository tripRepository;
    private final TripCommandValidator validator;
    private final HosPolicy policy;
    private final Clock clock;
    private final Supplier<String> tripIdGenerator;

    public TripService(DriverLedgerRegistry registry, TripRepository tripRepository,
                       TripCommandValidator validator, HosPolicy policy, Clock clock) {
        this(registry, tripRepository, validator, policy, clock, () -> "trip-" + UUID.randomUUID());
    }

    public TripService(DriverLedgerRegistry registry, TripRepository tripRepository,
                       TripCommandValidator validator, HosPolicy policy, Clock clock,
                       Supplier<String> tripIdGenerator) {
        this.registry = registry;
        this.tripRepository = tripRepository;
        this.validator = validator;
        this.policy = policy;
        this.clock = clock;
        this.tripIdGenerator = tripIdGenerator;
    }

    @Override
    public Future<Trip> planTrip(PlanTripCommand command) {
        ValidationResult validation = validator.validate(command);
        if (!validation.isValid()) {
            log.warn("Rejected trip for driver {}: {}", command.driverId(), validation.errors());
            return Future.failedFuture(validation.toException());
        }

        Trip trip = Trip.builder()
                .id(tripIdGenerator.get())
                .driverId(command.driverId())
                .date(LocalDate.ofInstant(clock.instant(), policy.getZone()))
                .currentLocation(command.currentLocation())
                .pickupLocation(command.pickupLocation())
                .dropoffLocation(command.dropoffLocation())
                .cycleHoursUsed(command.cycleHoursUsed())
                .status(TripStatus.IN_PROGRESS)
                .distanceMiles(orZero(command.distanceMiles()))
                .durationHours(orZero(command.durationHours()))
                .build();

        CycleState cycle = registry.cycleState(command.driverId());
        if (cycle.hoursRemaining() < trip.getCycleHoursUsed()) {
            log.warn("Trip {} needs {} cycle hours but driver {} has only {} left",
                    trip.getId(), trip.getCycleHoursUsed(), command.driverId(), cycle.hoursRemaining());
        }

        return tripRepository.save(trip)
                .onSuccess(saved -> log.info("Planned trip {} for driver {}: {} -> {}",
                        saved.getId(), saved.getDriverId(), saved.getPickupLocation(), saved.getDropoffLocation()))
                .onFailure(error -> log.error("Failed to save trip for driver {}: {}",
                        command.driverId(), error.getMessage()));
    }

    @Override
    public Future<Trip> completeTrip(String driverId, String tripId) {
        return tripRepository.findById(driverId, tripId)
                .compose(found -> {
                    if (found.isEmpty()) {
                        return Future.failedFuture(new TripNotFoundException(driverId, tripId));
                    }
                    Trip trip = found.get();
                    if (trip.isCompleted()) {
                        log.info("Trip {} already completed, cycle hours not committed again", tripId);
                        return Future.succeededFuture(trip);
                    }
                    Trip completed = trip.toBuilder().status(TripStatus.COMPLETED).build();
                    return tripRepository.save(completed)
                            .onSuccess(saved -> {
                                CycleState cycle = registry.cycleTracker(driverId).commit(saved.getCycleHoursUsed());
                                log.info("Completed trip {} for driver {}, cycle now {}/{} hours",
                                        tripId, driverId, cycle.getHoursUsed(), cycle.getHoursLimit());
                                if (cycle.isNearLimit(policy.getCycleWarningRatio())) {
                                    log.warn("Driver {} is approaching the cycle limit: {}/{} hours",
                                            driverId, cycle.getHoursUsed(), cycle.getHoursLimit());
                                }
                            });
                });
    }

    @Override
    public Future<List<Trip>> listTrips(String driverId) {
        return tripRepository.findByDriver(driverId);
    }

    @Override
    public Future<CycleState> cycleState(String driverId) {
        return Future.succeededFuture(registry.cycleState(driverId));
    }

    @Override
    public Future<CycleState> resetCycle(String driverId) {
        log.info("Resetting cycle hours for driver {}", driverId);
        return Future.succeededFuture(registry.cycleTracker(driverId).reset());
    }

    private double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
