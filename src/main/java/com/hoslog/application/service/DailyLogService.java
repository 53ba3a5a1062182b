package com.hoslog.application.service;

import com.hoslog.application.port.in.DailyLogQueryUseCase;
import com.hoslog.application.port.out.ActivityRecordRepository;
import com.hoslog.application.service.DriverLedgerRegistry.DriverSession;
import com.hoslog.domain.model.ActivityRecord;
import com.hoslog.domain.model.ComplianceResult;
import com.hoslog.domain.model.CycleState;
import com.hoslog.domain.model.DailyLog;
import com.hoslog.domain.model.DutyStatusTimeline;
import com.hoslog.domain.model.DutyStatusTotals;
import com.hoslog.domain.model.HosPolicy;
import com.hoslog.domain.model.OpenActivity;
import com.hoslog.domain.service.ActivityLedger;
import com.hoslog.domain.service.ComplianceEvaluator;
import com.hoslog.domain.service.DurationAggregator;
import com.hoslog.domain.service.DutyStatusGraphBuilder;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Assembles daily logs from stored records plus the driver's in-memory ledger,
 * and derives totals, the 24-hour graph and the compliance verdict from them.
 */
@Slf4j
@RequiredArgsConstructor
public class DailyLogService implements DailyLogQueryUseCase {

    private final DriverLedgerRegistry registry;
    private final ActivityRecordRepository recordRepository;
    private final DurationAggregator aggregator;
    private final DutyStatusGraphBuilder graphBuilder;
    private final ComplianceEvaluator complianceEvaluator;
    private final HosPolicy policy;
    private final Clock clock;

    @Override
    public Future<DailyLog> getDailyLog(String driverId, LocalDate date) {
        if (driverId == null || driverId.isBlank() || date == null) {
            return Future.failedFuture(new IllegalArgumentException("driverId and date are required"));
        }

        DailyLog empty = DailyLog.empty(driverId, date, policy.getZone());
        Optional<ActivityLedger> ledger = registry.find(driverId).map(DriverSession::ledger);

        return recordRepository.findByDriverBetween(driverId, empty.dayStart(), empty.dayEnd())
                .recover(error -> {
                    // The ledger is authoritative for the session, so a failing store only loses older records
                    log.warn("Could not read stored records of driver {} for {}, using in-memory ledger only: {}",
                            driverId, date, error.getMessage());
                    return Future.succeededFuture(List.of());
                })
                .map(stored -> {
                    List<ActivityRecord> candidates = new ArrayList<>(ledger
                            .map(l -> l.completedOn(date, policy.getZone()))
                            .orElse(List.of()));
                    candidates.addAll(stored);
                    DailyLog dailyLog = DailyLog.assemble(driverId, date, policy.getZone(), candidates);
                    log.debug("Assembled daily log of driver {} for {} with {} records",
                            driverId, date, dailyLog.getRecords().size());
                    return dailyLog;
                });
    }

    @Override
    public Future<DailyLogRecap> getRecap(String driverId, LocalDate date) {
        return getDailyLog(driverId, date).compose(dailyLog -> {
            try {
                return Future.succeededFuture(recap(dailyLog));
            } catch (RuntimeException e) {
                log.error("Failed to build recap of driver {} for {}: {}", driverId, date, e.getMessage());
                return Future.failedFuture(e);
            }
        });
    }

    private DailyLogRecap recap(DailyLog dailyLog) {
        Instant now = clock.instant();
        Instant reference = now.isAfter(dailyLog.dayEnd()) ? dailyLog.dayEnd() : now;

        Optional<OpenActivity> openActivity = registry.find(dailyLog.getDriverId())
                .flatMap(session -> session.ledger().currentActivity())
                .filter(open -> open.getStartTime().isBefore(dailyLog.dayEnd()) && !now.isBefore(dailyLog.dayStart()));
        Optional<OpenActivity> openInDay = openActivity.map(open -> open.clippedFrom(dailyLog.dayStart()));

        DutyStatusTotals totals = aggregator.aggregate(dailyLog, openInDay, reference);
        DutyStatusTimeline timeline = graphBuilder.buildTimeline(dailyLog, openInDay, reference);
        CycleState cycle = registry.cycleState(dailyLog.getDriverId());
        ComplianceResult compliance = complianceEvaluator.evaluate(totals, cycle);

        if (!compliance.compliant()) {
            log.warn("Driver {} is out of compliance on {}: {}",
                    dailyLog.getDriverId(), dailyLog.getDate(), compliance.violations());
        }

        return new DailyLogRecap(
                dailyLog,
                openActivity,
                totals,
                timeline,
                compliance,
                cycle,
                complianceEvaluator.remainingDrivingHours(totals),
                complianceEvaluator.remainingOnDutyHours(totals));
    }
}
