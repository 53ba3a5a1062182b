package com.hoslog.application.port.in;

import com.hoslog.domain.model.ComplianceResult;
import com.hoslog.domain.model.CycleState;
import com.hoslog.domain.model.DailyLog;
import com.hoslog.domain.model.DutyStatusTimeline;
import com.hoslog.domain.model.DutyStatusTotals;
import com.hoslog.domain.model.OpenActivity;
import io.vertx.core.Future;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Input port for reading a driver's daily log and its compliance recap
 */
public interface DailyLogQueryUseCase {

    Future<DailyLog> getDailyLog(String driverId, LocalDate date);

    /**
     * Log, totals, 24-hour timeline and compliance verdict for a day.
     * An activity still open on that day is counted up to now (or midnight).
     */
    Future<DailyLogRecap> getRecap(String driverId, LocalDate date);

    record DailyLogRecap(
            DailyLog log,
            Optional<OpenActivity> openActivity,
            DutyStatusTotals totals,
            DutyStatusTimeline timeline,
            ComplianceResult compliance,
            CycleState cycle,
            double remainingDrivingHours,
            double remainingOnDutyHours
    ) {}
}
