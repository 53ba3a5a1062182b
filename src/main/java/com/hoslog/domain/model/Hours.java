package com.hoslog.domain.model;

import java.time.Duration;

/**
 * Converts a {@link Duration} to fractional hours
 */
public final class Hours {

    private static final double NANOS_PER_HOUR = 3_600_000_000_000.0;

    private Hours() {
    }

    public static double of(Duration duration) {
        return duration.toNanos() / NANOS_PER_HOUR;
    }
}
