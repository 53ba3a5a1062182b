package com.hoslog.adapter.in.web;

import com.hoslog.application.port.in.CommandValidationException;
import com.hoslog.application.port.in.TripUseCase.TripNotFoundException;
import com.hoslog.domain.exception.AlreadyTrackingException;
import com.hoslog.domain.exception.InvalidTimeRangeException;
import com.hoslog.domain.exception.NotTrackingException;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps failures of the use cases to HTTP status codes
 */
@Slf4j
public final class ErrorResponder {

    private ErrorResponder() {
    }

    public static int statusCodeFor(Throwable error) {
        if (error instanceof IllegalArgumentException) {
            return 400;
        }
        if (error instanceof TripNotFoundException) {
            return 404;
        }
        if (error instanceof AlreadyTrackingException
                || error instanceof NotTrackingException
                || error instanceof InvalidTimeRangeException) {
            return 409;
        }
        return 500;
    }

    public static void respond(RoutingContext context, Throwable error) {
        int statusCode = statusCodeFor(error);
        if (statusCode >= 500) {
            log.error("Request {} {} failed", context.request().method(), context.request().path(), error);
        } else {
            log.info("Request {} {} rejected ({}): {}",
                    context.request().method(), context.request().path(), statusCode, error.getMessage());
        }
        if (error instanceof CommandValidationException) {
            ApiResponse.error(error.getMessage(), ((CommandValidationException) error).getErrors()).send(context, statusCode);
        } else {
            ApiResponse.error(error.getMessage()).send(context, statusCode);
        }
    }
}
