package com.hoslog.adapter.in.web;

import com.hoslog.application.port.in.ActivityTrackingUseCase.ActivitySnapshot;
import com.hoslog.application.port.in.DailyLogQueryUseCase.DailyLogRecap;
import com.hoslog.domain.model.ActivityRecord;
import com.hoslog.domain.model.ComplianceResult;
import com.hoslog.domain.model.CycleState;
import com.hoslog.domain.model.DailyLog;
import com.hoslog.domain.model.DutyStatus;
import com.hoslog.domain.model.DutyStatusTimeline;
import com.hoslog.domain.model.DutyStatusTotals;
import com.hoslog.domain.model.GraphPoint;
import com.hoslog.domain.model.HosPolicy;
import com.hoslog.domain.model.OpenActivity;
import com.hoslog.domain.model.TimelineSegment;
import com.hoslog.domain.model.Trip;
import com.hoslog.domain.model.Violation;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * JSON views of the domain objects returned by the API.
 * Hours are sent unrounded; rounding is left to the client.
 */
@RequiredArgsConstructor
public class JsonViews {

    private final HosPolicy policy;

    public JsonObject openActivity(OpenActivity activity) {
        return new JsonObject()
                .put("id", activity.getId())
                .put("status", activity.getStatus().getValue())
                .put("label", activity.getStatus().getLabel())
                .put("startTime", activity.getStartTime().toString())
                .put("location", activity.getLocation())
                .put("notes", activity.getNotes());
    }

    public JsonObject record(ActivityRecord record) {
        return new JsonObject()
                .put("id", record.getId())
                .put("status", record.getStatus().getValue())
                .put("label", record.getStatus().getLabel())
                .put("startTime", record.getStartTime().toString())
                .put("endTime", record.getEndTime().toString())
                .put("durationHours", record.getDurationHours())
                .put("location", record.getLocation())
                .put("notes", record.getNotes())
                .put("odometer", record.getOdometer())
                .put("engineHours", record.getEngineHours());
    }

    public JsonObject totals(DutyStatusTotals totals) {
        JsonObject byStatus = new JsonObject();
        for (DutyStatus status : DutyStatus.values()) {
            byStatus.put(status.getValue(), totals.hours(status));
        }
        return new JsonObject()
                .put("byStatus", byStatus)
                .put("drivingHours", totals.drivingHours())
                .put("onDutyHours", totals.onDutyHours())
                .put("totalHours", totals.totalHours());
    }

    public JsonObject snapshot(ActivitySnapshot snapshot) {
        return new JsonObject()
                .put("driverId", snapshot.driverId())
                .put("activeActivity", snapshot.openActivity().map(this::openActivity).orElse(null))
                .put("elapsedHours", snapshot.elapsedHours())
                .put("totals", totals(snapshot.totals()))
                .put("asOf", snapshot.asOf().toString());
    }

    public JsonObject dailyLog(DailyLog log) {
        JsonArray records = new JsonArray();
        log.getRecords().forEach(record -> records.add(record(record)));
        return new JsonObject()
                .put("driverId", log.getDriverId())
                .put("date", log.getDate().toString())
                .put("timezone", log.getZone().getId())
                .put("records", records);
    }

    public JsonObject timeline(DutyStatusTimeline timeline) {
        JsonArray segments = new JsonArray();
        for (TimelineSegment segment : timeline.getSegments()) {
            segments.add(new JsonObject()
                    .put("startHour", segment.getStartHour())
                    .put("endHour", segment.getEndHour())
                    .put("status", segment.getStatus().name())
                    .put("rank", segment.getRank()));
        }
        JsonArray points = new JsonArray();
        for (GraphPoint point : timeline.graphPoints()) {
            points.add(new JsonArray().add(point.getHour()).add(point.getRank()));
        }
        return new JsonObject()
                .put("date", timeline.getDate().toString())
                .put("segments", segments)
                .put("points", points)
                .put("unspecifiedHours", timeline.unspecifiedHours());
    }

    public JsonObject compliance(ComplianceResult result) {
        JsonArray violations = new JsonArray();
        for (Violation violation : result.violations()) {
            violations.add(new JsonObject()
                    .put("rule", violation.rule().getValue())
                    .put("limit", violation.limit())
                    .put("actual", violation.actual()));
        }
        return new JsonObject()
                .put("compliant", result.compliant())
                .put("violations", violations);
    }

    public JsonObject cycle(CycleState cycle) {
        return new JsonObject()
                .put("hoursUsed", cycle.getHoursUsed())
                .put("hoursLimit", cycle.getHoursLimit())
                .put("hoursRemaining", cycle.hoursRemaining())
                .put("percentUsed", cycle.percentUsed())
                .put("cycleDays", policy.getCycleDays())
                .put("nearLimit", cycle.isNearLimit(policy.getCycleWarningRatio()));
    }

    public JsonObject recap(DailyLogRecap recap) {
        return new JsonObject()
                .put("log", dailyLog(recap.log()))
                .put("activeActivity", recap.openActivity().map(this::openActivity).orElse(null))
                .put("totals", totals(recap.totals()))
                .put("timeline", timeline(recap.timeline()))
                .put("compliance", compliance(recap.compliance()))
                .put("cycle", cycle(recap.cycle()))
                .put("remainingDrivingHours", recap.remainingDrivingHours())
                .put("remainingOnDutyHours", recap.remainingOnDutyHours());
    }

    public JsonObject trip(Trip trip) {
        return new JsonObject()
                .put("id", trip.getId())
                .put("driverId", trip.getDriverId())
                .put("date", trip.getDate().toString())
                .put("currentLocation", trip.getCurrentLocation())
                .put("pickupLocation", trip.getPickupLocation())
                .put("dropoffLocation", trip.getDropoffLocation())
                .put("cycleHoursUsed", trip.getCycleHoursUsed())
                .put("status", trip.getStatus().getValue())
                .put("distanceMiles", trip.getDistanceMiles())
                .put("durationHours", trip.getDurationHours());
    }

    public JsonArray trips(List<Trip> trips) {
        JsonArray array = new JsonArray();
        trips.forEach(trip -> array.add(trip(trip)));
        return array;
    }
}
