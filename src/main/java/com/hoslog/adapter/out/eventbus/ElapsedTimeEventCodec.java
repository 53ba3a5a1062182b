package com.hoslog.adapter.out.eventbus;

import com.hoslog.domain.event.ElapsedTimeEvent;
import com.hoslog.domain.model.DutyStatus;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.eventbus.MessageCodec;
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Message codec for ElapsedTimeEvent so samples can cross the clustered event bus.
 * Statuses travel as their wire codes.
 */
public class ElapsedTimeEventCodec implements MessageCodec<ElapsedTimeEvent, ElapsedTimeEvent> {

    @Override
    public void encodeToWire(Buffer buffer, ElapsedTimeEvent event) {
        JsonObject totals = new JsonObject();
        event.getTotals().forEach((status, hours) -> totals.put(status.getValue(), hours));

        JsonObject json = new JsonObject()
                .put("driverId", event.getDriverId())
                .put("activityId", event.getActivityId())
                .put("status", event.getStatus().getValue())
                .put("elapsedHours", event.getElapsedHours())
                .put("totals", totals)
                .put("sampledAt", event.getSampledAt().toString());

        Buffer encoded = json.toBuffer();
        buffer.appendInt(encoded.length());
        buffer.appendBuffer(encoded);
    }

    @Override
    public ElapsedTimeEvent decodeFromWire(int position, Buffer buffer) {
        int length = buffer.getInt(position);
        int offset = position + 4;
        JsonObject json = new JsonObject(buffer.getBuffer(offset, offset + length));

        Map<DutyStatus, Double> totals = new EnumMap<>(DutyStatus.class);
        JsonObject encodedTotals = json.getJsonObject("totals", new JsonObject());
        for (String code : encodedTotals.fieldNames()) {
            totals.merge(DutyStatus.fromWireCode(code), encodedTotals.getDouble(code), Double::sum);
        }

        return new ElapsedTimeEvent(
                json.getString("driverId"),
                json.getString("activityId"),
                DutyStatus.fromWireCode(json.getString("status")),
                json.getDouble("elapsedHours"),
                totals,
                Instant.parse(json.getString("sampledAt"))
        );
    }

    @Override
    public ElapsedTimeEvent transform(ElapsedTimeEvent event) {
        // Immutable, safe to share locally
        return event;
    }

    @Override
    public String name() {
        return "ElapsedTimeEventCodec";
    }

    @Override
    public byte systemCodecID() {
        return -1;
    }
}
