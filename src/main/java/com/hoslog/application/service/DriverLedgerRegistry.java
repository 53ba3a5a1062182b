package com.hoslog.application.service;

import com.hoslog.domain.model.CycleState;
import com.hoslog.domain.model.HosPolicy;
import com.hoslog.domain.service.ActivityLedger;
import com.hoslog.domain.service.CycleHoursTracker;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Holds the single authoritative ledger and cycle tracker of every driver session.
 * Services share one registry instance; nothing else creates ledgers.
 */
@Slf4j
public class DriverLedgerRegistry {

    private final HosPolicy policy;
    private final Supplier<String> activityIdGenerator;
    private final Map<String, DriverSession> sessions = new ConcurrentHashMap<>();

    public DriverLedgerRegistry(HosPolicy policy) {
        this(policy, () -> "activity-" + UUID.randomUUID());
    }

    public DriverLedgerRegistry(HosPolicy policy, Supplier<String> activityIdGenerator) {
        this.policy = policy;
        this.activityIdGenerator = activityIdGenerator;
    }

    public DriverSession session(String driverId) {
        return sessions.computeIfAbsent(driverId, id -> {
            log.info("Opening duty-status session for driver {}", id);
            return new DriverSession(
                    new ActivityLedger(id, activityIdGenerator),
                    new CycleHoursTracker(policy.getCycleLimitHours()));
        });
    }

    /**
     * Existing session only, for read paths that must not open one
     */
    public Optional<DriverSession> find(String driverId) {
        return Optional.ofNullable(sessions.get(driverId));
    }

    public ActivityLedger ledger(String driverId) {
        return session(driverId).ledger();
    }

    public CycleHoursTracker cycleTracker(String driverId) {
        return session(driverId).cycleTracker();
    }

    /**
     * Committed cycle hours, a fresh cycle for drivers without a session
     */
    public CycleState cycleState(String driverId) {
        return find(driverId)
                .map(session -> session.cycleTracker().state())
                .orElseGet(() -> new CycleState(0.0, policy.getCycleLimitHours()));
    }

    /**
     * Drivers that currently have an open activity
     */
    public List<String> trackingDrivers() {
        return sessions.entrySet().stream()
                .filter(entry -> entry.getValue().ledger().isTracking())
                .map(Map.Entry::getKey)
                .sorted()
                .collect(Collectors.toList());
    }

    public record DriverSession(ActivityLedger ledger, CycleHoursTracker cycleTracker) {}
}
