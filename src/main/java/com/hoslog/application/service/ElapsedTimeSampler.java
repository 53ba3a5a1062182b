package com.hoslog.application.service;

import com.hoslog.application.port.in.ActivityTrackingUseCase.ActivitySnapshot;
import com.hoslog.domain.event.ElapsedTimeEvent;
import com.hoslog.domain.model.OpenActivity;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

/**
 * Re-aggregates every open activity on a fixed interval and publishes the live totals
 * on the event bus. Advisory only: the ledger never waits on it.
 */
@Slf4j
public class ElapsedTimeSampler {

    public static final String ADDRESS = "hos.activity.elapsed";
    static final long DEFAULT_INTERVAL_MS = 1000;

    private final Vertx vertx;
    private final DriverLedgerRegistry registry;
    private final ActivityTrackingService trackingService;
    private final long intervalMs;
    private Long timerId;

    public ElapsedTimeSampler(Vertx vertx, DriverLedgerRegistry registry, ActivityTrackingService trackingService) {
        this(vertx, registry, trackingService, DEFAULT_INTERVAL_MS);
    }

    public ElapsedTimeSampler(Vertx vertx, DriverLedgerRegistry registry,
                              ActivityTrackingService trackingService, long intervalMs) {
        this.vertx = vertx;
        this.registry = registry;
        this.trackingService = trackingService;
        this.intervalMs = intervalMs;
    }

    public void start() {
        if (timerId != null) {
            return;
        }
        timerId = vertx.setPeriodic(intervalMs, id -> sample());
        log.info("Elapsed time sampler started (interval: {} ms)", intervalMs);
    }

    public void stop() {
        if (timerId != null) {
            vertx.cancelTimer(timerId);
            timerId = null;
            log.info("Elapsed time sampler stopped");
        }
    }

    /**
     * Publish one event per driver with an open activity
     * @return number of events published
     */
    int sample() {
        int published = 0;
        for (String driverId : registry.trackingDrivers()) {
            ActivitySnapshot snapshot = trackingService.snapshot(driverId);
            if (snapshot.openActivity().isEmpty()) {
                continue;
            }
            OpenActivity open = snapshot.openActivity().get();
            ElapsedTimeEvent event = new ElapsedTimeEvent(
                    driverId,
                    open.getId(),
                    open.getStatus(),
                    snapshot.elapsedHours(),
                    snapshot.totals().asMap(),
                    snapshot.asOf());
            vertx.eventBus().publish(ADDRESS, event);
            published++;
        }
        if (published > 0) {
            log.debug("Published {} elapsed time samples", published);
        }
        return published;
    }
}
