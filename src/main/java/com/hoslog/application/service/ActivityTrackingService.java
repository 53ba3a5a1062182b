package com.hoslog.application.service;

import com.hoslog.application.port.in.ActivityTrackingUseCase;
import com.hoslog.application.port.out.ActivityRecordRepository;
import com.hoslog.application.port.out.ActivitySyncPort;
import com.hoslog.application.service.DriverLedgerRegistry.DriverSession;
import com.hoslog.domain.exception.DutyStatusException;
import com.hoslog.domain.model.ActivityRecord;
import com.hoslog.domain.model.DailyLog;
import com.hoslog.domain.model.DutyStatus;
import com.hoslog.domain.model.DutyStatusTotals;
import com.hoslog.domain.model.HosPolicy;
import com.hoslog.domain.model.OpenActivity;
import com.hoslog.domain.model.Telemetry;
import com.hoslog.domain.service.ActivityLedger;
import com.hoslog.domain.service.DurationAggregator;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Application service driving the per-driver ledgers.
 * <p>
 * The ledger transition is the authoritative step. Saving and syncing the outcome is fired
 * afterwards and only logged when it fails; the returned future never waits for it.
 */
@Slf4j
@RequiredArgsConstructor
public class ActivityTrackingService implements ActivityTrackingUseCase {

    private final DriverLedgerRegistry registry;
    private final ActivityRecordRepository recordRepository;
    private final ActivitySyncPort syncPort;
    private final ActivityCommandValidator validator;
    private final DurationAggregator aggregator;
    private final HosPolicy policy;
    private final Clock clock;

    @Override
    public Future<OpenActivity> startActivity(StartActivityCommand command) {
        ValidationResult validation = validator.validate(command);
        if (!validation.isValid()) {
            log.warn("Rejected start request for driver {}: {}", command.driverId(), validation.errors());
            return Future.failedFuture(validation.toException());
        }

        OpenActivity activity;
        try {
            activity = registry.ledger(command.driverId()).start(
                    DutyStatus.fromValue(command.status()),
                    clock.instant(),
                    command.location(),
                    blankToNull(command.notes()));
        } catch (DutyStatusException e) {
            log.warn("Start rejected for driver {}: {}", command.driverId(), e.getMessage());
            return Future.failedFuture(e);
        }

        attempt(() -> syncPort.publishStarted(command.driverId(), activity))
                .onFailure(error -> log.warn("Backend sync of started activity {} failed, keeping local state: {}",
                        activity.getId(), error.getMessage()));

        return Future.succeededFuture(activity);
    }

    @Override
    public Future<ActivityRecord> stopActivity(StopActivityCommand command) {
        ValidationResult validation = validator.validate(command);
        if (!validation.isValid()) {
            log.warn("Rejected stop request for driver {}: {}", command.driverId(), validation.errors());
            return Future.failedFuture(validation.toException());
        }

        ActivityRecord record;
        try {
            record = registry.ledger(command.driverId()).stop(
                    clock.instant(),
                    new Telemetry(command.odometer(), command.engineHours()));
        } catch (DutyStatusException e) {
            log.warn("Stop rejected for driver {}: {}", command.driverId(), e.getMessage());
            return Future.failedFuture(e);
        }

        attempt(() -> recordRepository.save(command.driverId(), record))
                .onFailure(error -> log.error("Failed to store activity {} for driver {}, ledger keeps it: {}",
                        record.getId(), command.driverId(), error.getMessage()));
        attempt(() -> syncPort.publishCompleted(command.driverId(), record))
                .onFailure(error -> log.warn("Backend sync of activity {} failed, keeping local state: {}",
                        record.getId(), error.getMessage()));

        return Future.succeededFuture(record);
    }

    @Override
    public Future<ActivitySnapshot> currentTotals(String driverId) {
        return Future.succeededFuture(snapshot(driverId));
    }

    /**
     * Totals for the current day from the in-memory ledger only, cheap enough to sample every second
     */
    ActivitySnapshot snapshot(String driverId) {
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, policy.getZone());
        Optional<ActivityLedger> ledger = registry.find(driverId).map(DriverSession::ledger);

        DailyLog todayLog = DailyLog.assemble(driverId, today, policy.getZone(),
                ledger.map(l -> l.completedOn(today, policy.getZone())).orElse(List.of()));
        Optional<OpenActivity> open = ledger.flatMap(ActivityLedger::currentActivity);
        Optional<OpenActivity> openToday = open.map(activity -> activity.clippedFrom(todayLog.dayStart()));
        DutyStatusTotals totals = aggregator.aggregate(todayLog, openToday, now);
        return new ActivitySnapshot(driverId, open, totals, now);
    }

    /**
     * Runs a collaborator call made after the ledger transition; a synchronous throw becomes a failed future
     */
    private Future<Void> attempt(Supplier<Future<Void>> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }

    private String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }
}
