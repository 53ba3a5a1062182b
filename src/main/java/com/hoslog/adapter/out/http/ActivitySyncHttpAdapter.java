package com.hoslog.adapter.out.http;

import com.hoslog.application.port.out.ActivitySyncPort;
import com.hoslog.domain.model.ActivityRecord;
import com.hoslog.domain.model.OpenActivity;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP adapter posting activity records to the backend log service.
 * Implements ActivitySyncPort. Failures are returned as failed futures for the caller to log;
 * no retries here.
 */
@Slf4j
public class ActivitySyncHttpAdapter implements ActivitySyncPort {

    static final String ACTIVITIES_PATH = "/api/activities/";

    private final WebClient client;
    private final String endpoint;
    private final long timeoutMs;

    public ActivitySyncHttpAdapter(Vertx vertx, String baseUrl, long timeoutMs) {
        this(WebClient.create(vertx), baseUrl, timeoutMs);
    }

    ActivitySyncHttpAdapter(WebClient client, String baseUrl, long timeoutMs) {
        this.client = client;
        this.endpoint = stripTrailingSlash(baseUrl) + ACTIVITIES_PATH;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public Future<Void> publishStarted(String driverId, OpenActivity activity) {
        return post(ActivityWireMapper.toWire(driverId, activity), activity.getId());
    }

    @Override
    public Future<Void> publishCompleted(String driverId, ActivityRecord record) {
        return post(ActivityWireMapper.toWire(driverId, record), record.getId());
    }

    private Future<Void> post(JsonObject body, String activityId) {
        log.debug("Posting activity {} to {}", activityId, endpoint);
        return client.postAbs(endpoint)
                .timeout(timeoutMs)
                .sendJsonObject(body)
                .compose(response -> checkStatus(response, activityId));
    }

    private Future<Void> checkStatus(HttpResponse<Buffer> response, String activityId) {
        if (response.statusCode() >= 200 && response.statusCode() < 300) {
            log.debug("Backend accepted activity {} ({})", activityId, response.statusCode());
            return Future.succeededFuture();
        }
        return Future.failedFuture(new IllegalStateException(
                "Backend rejected activity " + activityId + " with status " + response.statusCode()));
    }

    public void close() {
        client.close();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
