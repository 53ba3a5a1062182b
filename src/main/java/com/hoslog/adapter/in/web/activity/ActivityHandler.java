package com.hoslog.adapter.in.web.activity;

import com.hoslog.adapter.in.web.ApiResponse;
import com.hoslog.adapter.in.web.ErrorResponder;
import com.hoslog.adapter.in.web.JsonViews;
import com.hoslog.application.port.in.ActivityTrackingUseCase;
import com.hoslog.application.port.in.ActivityTrackingUseCase.StartActivityCommand;
import com.hoslog.application.port.in.ActivityTrackingUseCase.StopActivityCommand;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * HTTP handlers for the activity tracker:
 * POST .../activities/start, POST .../activities/stop, GET .../activities/current
 */
@Slf4j
@RequiredArgsConstructor
public class ActivityHandler {

    private final ActivityTrackingUseCase trackingUseCase;
    private final JsonViews views;

    public void start(RoutingContext context) {
        String driverId = context.pathParam("driverId");
        JsonObject body = context.body().asJsonObject();
        if (body == null) {
            ApiResponse.error("Request body is required").send(context, 400);
            return;
        }

        StartActivityRequest request;
        try {
            request = body.mapTo(StartActivityRequest.class);
        } catch (IllegalArgumentException | DecodeException e) {
            log.warn("Unreadable start request for driver {}: {}", driverId, e.getMessage());
            ApiResponse.error("Invalid request format: " + e.getMessage()).send(context, 400);
            return;
        }

        trackingUseCase.startActivity(new StartActivityCommand(driverId, request.status(), request.location(), request.notes()))
                .onSuccess(activity -> ApiResponse
                        .success("Started " + activity.getStatus().getLabel(), views.openActivity(activity))
                        .send(context, 201))
                .onFailure(error -> ErrorResponder.respond(context, error));
    }

    public void stop(RoutingContext context) {
        String driverId = context.pathParam("driverId");
        JsonObject body = context.body().asJsonObject();

        StopActivityRequest request;
        try {
            request = body == null ? new StopActivityRequest(null, null) : body.mapTo(StopActivityRequest.class);
        } catch (IllegalArgumentException | DecodeException e) {
            log.warn("Unreadable stop request for driver {}: {}", driverId, e.getMessage());
            ApiResponse.error("Invalid request format: " + e.getMessage()).send(context, 400);
            return;
        }

        trackingUseCase.stopActivity(new StopActivityCommand(driverId, request.odometer(), request.engineHours()))
                .onSuccess(record -> ApiResponse
                        .success(String.format(Locale.ROOT, "Stopped %s - Duration: %.2f hrs",
                                record.getStatus().getLabel(), record.getDurationHours()), views.record(record))
                        .send(context, 200))
                .onFailure(error -> ErrorResponder.respond(context, error));
    }

    public void current(RoutingContext context) {
        String driverId = context.pathParam("driverId");
        trackingUseCase.currentTotals(driverId)
                .onSuccess(snapshot -> ApiResponse.success(null, views.snapshot(snapshot)).send(context, 200))
                .onFailure(error -> ErrorResponder.respond(context, error));
    }
}
