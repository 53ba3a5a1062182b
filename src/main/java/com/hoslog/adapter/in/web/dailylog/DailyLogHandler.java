package com.hoslog.adapter.in.web.dailylog;

import com.hoslog.adapter.in.web.ApiResponse;
import com.hoslog.adapter.in.web.ErrorResponder;
import com.hoslog.adapter.in.web.JsonViews;
import com.hoslog.application.port.in.DailyLogQueryUseCase;
import com.hoslog.domain.model.HosPolicy;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * HTTP handler for GET /api/drivers/:driverId/logs/:date.
 * The date is ISO (YYYY-MM-DD) or "today" in the policy time zone.
 */
@RequiredArgsConstructor
public class DailyLogHandler {

    private final DailyLogQueryUseCase dailyLogQueryUseCase;
    private final JsonViews views;
    private final HosPolicy policy;
    private final Clock clock;

    public void recap(RoutingContext context) {
        String driverId = context.pathParam("driverId");
        String dateParam = context.pathParam("date");

        LocalDate date;
        try {
            date = "today".equalsIgnoreCase(dateParam)
                    ? LocalDate.ofInstant(clock.instant(), policy.getZone())
                    : LocalDate.parse(dateParam);
        } catch (DateTimeParseException e) {
            ApiResponse.error("date must be in ISO format (YYYY-MM-DD) or 'today'").send(context, 400);
            return;
        }

        dailyLogQueryUseCase.getRecap(driverId, date)
                .onSuccess(recap -> ApiResponse.success(null, views.recap(recap)).send(context, 200))
                .onFailure(error -> ErrorResponder.respond(context, error));
    }
}
