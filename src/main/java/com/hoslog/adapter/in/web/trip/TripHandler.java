package com.hoslog.adapter.in.web.trip;

import com.hoslog.adapter.in.web.ApiResponse;
import com.hoslog.adapter.in.web.ErrorResponder;
import com.hoslog.adapter.in.web.JsonViews;
import com.hoslog.application.port.in.TripUseCase;
import com.hoslog.application.port.in.TripUseCase.PlanTripCommand;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handlers for trips and cycle hours
 */
@Slf4j
@RequiredArgsConstructor
public class TripHandler {

    private final TripUseCase tripUseCase;
    private final JsonViews views;

    public void plan(RoutingContext context) {
        String driverId = context.pathParam("driverId");
        JsonObject body = context.body().asJsonObject();
        if (body == null) {
            ApiResponse.error("Request body is required").send(context, 400);
            return;
        }

        PlanTripRequest request;
        try {
            request = body.mapTo(PlanTripRequest.class);
        } catch (IllegalArgumentException | DecodeException e) {
            log.warn("Unreadable trip request for driver {}: {}", driverId, e.getMessage());
            ApiResponse.error("Invalid request format: " + e.getMessage()).send(context, 400);
            return;
        }

        PlanTripCommand command = new PlanTripCommand(
                driverId,
                request.currentLocation(),
                request.pickupLocation(),
                request.dropoffLocation(),
                request.cycleHoursUsed(),
                request.distanceMiles(),
                request.durationHours()
        );

        tripUseCase.planTrip(command)
                .onSuccess(trip -> ApiResponse.success("Trip created successfully", views.trip(trip)).send(context, 201))
                .onFailure(error -> ErrorResponder.respond(context, error));
    }

    public void complete(RoutingContext context) {
        tripUseCase.completeTrip(context.pathParam("driverId"), context.pathParam("tripId"))
                .onSuccess(trip -> ApiResponse.success("Trip completed", views.trip(trip)).send(context, 200))
                .onFailure(error -> ErrorResponder.respond(context, error));
    }

    public void list(RoutingContext context) {
        tripUseCase.listTrips(context.pathParam("driverId"))
                .onSuccess(trips -> ApiResponse.success(null, views.trips(trips)).send(context, 200))
                .onFailure(error -> ErrorResponder.respond(context, error));
    }

    public void cycle(RoutingContext context) {
        tripUseCase.cycleState(context.pathParam("driverId"))
                .onSuccess(cycle -> ApiResponse.success(null, views.cycle(cycle)).send(context, 200))
                .onFailure(error -> ErrorResponder.respond(context, error));
    }

    public void resetCycle(RoutingContext context) {
        tripUseCase.resetCycle(context.pathParam("driverId"))
                .onSuccess(cycle -> ApiResponse.success("Cycle reset", views.cycle(cycle)).send(context, 200))
                .onFailure(error -> ErrorResponder.respond(context, error));
    }
}
