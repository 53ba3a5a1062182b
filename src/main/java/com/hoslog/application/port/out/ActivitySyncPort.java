package com.hoslog.application.port.out;

import com.hoslog.domain.model.ActivityRecord;
import com.hoslog.domain.model.OpenActivity;
import io.vertx.core.Future;

/**
 * Output port pushing activity changes to the backend log service
 */
public interface ActivitySyncPort {

    Future<Void> publishStarted(String driverId, OpenActivity activity);

    Future<Void> publishCompleted(String driverId, ActivityRecord record);
}
