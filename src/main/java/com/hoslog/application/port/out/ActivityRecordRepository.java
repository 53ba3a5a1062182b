package com.hoslog.application.port.out;

import com.hoslog.domain.model.ActivityRecord;
import io.vertx.core.Future;

import java.time.Instant;
import java.util.List;

/**
 * Output port for storing completed activity records
 */
public interface ActivityRecordRepository {

    Future<Void> save(String driverId, ActivityRecord record);

    /**
     * Records of a driver overlapping [from, to), ordered by start time
     */
    Future<List<ActivityRecord>> findByDriverBetween(String driverId, Instant from, Instant to);
}
