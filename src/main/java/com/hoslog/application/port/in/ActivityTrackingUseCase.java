package com.hoslog.application.port.in;

import com.hoslog.domain.model.ActivityRecord;
import com.hoslog.domain.model.DutyStatusTotals;
import com.hoslog.domain.model.OpenActivity;
import io.vertx.core.Future;

import java.time.Instant;
import java.util.Optional;

/**
 * Input port for starting and stopping duty-status activities
 */
public interface ActivityTrackingUseCase {

    /**
     * Open a new activity for the driver at the current instant
     * @return Future with the open activity, failed with a ledger exception on an illegal transition
     */
    Future<OpenActivity> startActivity(StartActivityCommand command);

    /**
     * Close the driver's open activity at the current instant.
     * Persistence and backend sync happen in the background and never fail this future.
     * @return Future with the completed record
     */
    Future<ActivityRecord> stopActivity(StopActivityCommand command);

    /**
     * Today's totals including the open activity measured up to now
     */
    Future<ActivitySnapshot> currentTotals(String driverId);

    record StartActivityCommand(
            String driverId,
            String status,
            String location,
            String notes
    ) {}

    record StopActivityCommand(
            String driverId,
            Double odometer,
            Double engineHours
    ) {}

    record ActivitySnapshot(
            String driverId,
            Optional<OpenActivity> openActivity,
            DutyStatusTotals totals,
            Instant asOf
    ) {
        public double elapsedHours() {
            return openActivity.map(open -> open.elapsedHours(asOf)).orElse(0.0);
        }
    }
}
