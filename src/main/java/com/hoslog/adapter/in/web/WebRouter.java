package com.hoslog.adapter.in.web;

import com.hoslog.adapter.in.web.activity.ActivityHandler;
import com.hoslog.adapter.in.web.dailylog.DailyLogHandler;
import com.hoslog.adapter.in.web.trip.TripHandler;
import io.vertx.core.json.DecodeException;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import lombok.RequiredArgsConstructor;

/**
 * Router configuration for the duty-status API
 */
@RequiredArgsConstructor
public class WebRouter {

    private static final String DRIVER = "/api/drivers/:driverId";

    private final Router router;
    private final ActivityHandler activityHandler;
    private final DailyLogHandler dailyLogHandler;
    private final TripHandler tripHandler;

    public void setupRoutes() {
        // CORS headers
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, POST, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Requested-With");
            ctx.next();
        });

        router.options("/api/*").handler(ctx -> ctx.response().setStatusCode(204).end());

        router.route("/api/*").handler(BodyHandler.create());

        // Activity tracker
        router.post(DRIVER + "/activities/start").handler(activityHandler::start);
        router.post(DRIVER + "/activities/stop").handler(activityHandler::stop);
        router.get(DRIVER + "/activities/current").handler(activityHandler::current);

        // Daily log recap
        router.get(DRIVER + "/logs/:date").handler(dailyLogHandler::recap);

        // Trips and cycle hours
        router.post(DRIVER + "/trips").handler(tripHandler::plan);
        router.get(DRIVER + "/trips").handler(tripHandler::list);
        router.post(DRIVER + "/trips/:tripId/complete").handler(tripHandler::complete);
        router.get(DRIVER + "/cycle").handler(tripHandler::cycle);
        router.post(DRIVER + "/cycle/reset").handler(tripHandler::resetCycle);

        router.get("/health")
                .handler(ctx -> ctx.response()
                        .putHeader("Content-Type", "application/json")
                        .end("{\"status\":\"UP\",\"service\":\"hos-duty-log\"}"));

        router.route().failureHandler(ctx -> {
            Throwable failure = ctx.failure();
            if (failure instanceof DecodeException) {
                ApiResponse.error("Request body is not valid JSON").send(ctx, 400);
            } else if (failure != null) {
                ErrorResponder.respond(ctx, failure);
            } else {
                ApiResponse.error("Request failed").send(ctx, ctx.statusCode());
            }
        });
    }
}
