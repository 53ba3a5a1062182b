package com.hoslog.adapter.out.http;

import com.hoslog.domain.model.ActivityRecord;
import com.hoslog.domain.model.OpenActivity;
import io.vertx.core.json.JsonObject;

/**
 * Converts activities to the backend's JSON records.
 * Statuses use the backend wire codes and instants ISO-8601 text.
 */
public final class ActivityWireMapper {

    private ActivityWireMapper() {
    }

    public static JsonObject toWire(String driverId, ActivityRecord record) {
        return new JsonObject()
                .put("id", record.getId())
                .put("driverId", driverId)
                .put("status", record.getStatus().getValue())
                .put("startTime", record.getStartTime().toString())
                .put("endTime", record.getEndTime().toString())
                .put("location", record.getLocation())
                .put("notes", record.getNotes())
                .put("durationHours", record.getDurationHours())
                .put("odometer", record.getOdometer())
                .put("engineHours", record.getEngineHours());
    }

    /**
     * An open activity is sent with a null end time
     */
    public static JsonObject toWire(String driverId, OpenActivity activity) {
        return new JsonObject()
                .put("id", activity.getId())
                .put("driverId", driverId)
                .put("status", activity.getStatus().getValue())
                .put("startTime", activity.getStartTime().toString())
                .putNull("endTime")
                .put("location", activity.getLocation())
                .put("notes", activity.getNotes());
    }
}
