package com.hoslog.adapter.out.http;

import com.hoslog.application.port.out.ActivitySyncPort;
import com.hoslog.domain.model.ActivityRecord;
import com.hoslog.domain.model.OpenActivity;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

/**
 * Used when backend sync is disabled in configuration
 */
@Slf4j
public class NoOpActivitySyncAdapter implements ActivitySyncPort {

    @Override
    public Future<Void> publishStarted(String driverId, OpenActivity activity) {
        log.debug("Sync disabled, not publishing started activity {}", activity.getId());
        return Future.succeededFuture();
    }

    @Override
    public Future<Void> publishCompleted(String driverId, ActivityRecord record) {
        log.debug("Sync disabled, not publishing activity {}", record.getId());
        return Future.succeededFuture();
    }
}
