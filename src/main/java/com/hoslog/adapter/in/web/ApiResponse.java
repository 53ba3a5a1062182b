package com.hoslog.adapter.in.web;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

import java.util.List;

/**
 * Envelope for every JSON response of the API
 */
public record ApiResponse(
        String status,
        String message,
        Object data,
        List<String> errors
) {
    public static ApiResponse success(String message, Object data) {
        return new ApiResponse("success", message, data, null);
    }

    public static ApiResponse error(String message, List<String> errors) {
        return new ApiResponse("error", message, null, errors);
    }

    public static ApiResponse error(String message) {
        return new ApiResponse("error", message, null, null);
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject().put("status", status);
        if (message != null) {
            json.put("message", message);
        }
        if (data != null) {
            json.put("data", data);
        }
        if (errors != null && !errors.isEmpty()) {
            json.put("errors", new JsonArray(errors));
        }
        return json;
    }

    public void send(RoutingContext context, int statusCode) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(toJson().encode());
    }
}
