package com.hoslog.domain.model;

import lombok.Value;

/**
 * Odometer and engine-hour readings supplied by the vehicle when an activity ends.
 * Opaque to the core: stored and forwarded, never computed.
 */
@Value
public class Telemetry {
    private static final Telemetry NONE = new Telemetry(null, null);

    Double odometer;
    Double engineHours;

    public static Telemetry none() {
        return NONE;
    }
}
