package com.hoslog.infrastructure.config;

import com.hoslog.domain.model.HosPolicy;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Builds the HOS policy from the {@code hos} section of the configuration.
 * Missing keys keep the regulatory defaults.
 */
@Slf4j
public final class HosPolicyFactory {

    private HosPolicyFactory() {
    }

    public static HosPolicy fromConfig(JsonObject config) {
        JsonObject hos = config.getJsonObject("hos", new JsonObject());

        HosPolicy policy = HosPolicy.builder()
                .drivingLimitHours(positive(hos, "driving-limit-hours", HosPolicy.DEFAULT_DRIVING_LIMIT_HOURS))
                .onDutyLimitHours(positive(hos, "on-duty-limit-hours", HosPolicy.DEFAULT_ON_DUTY_LIMIT_HOURS))
                .cycleLimitHours(positive(hos, "cycle-limit-hours", HosPolicy.DEFAULT_CYCLE_LIMIT_HOURS))
                .cycleDays(cycleDays(hos))
                .cycleWarningRatio(warningRatio(hos))
                .zone(zone(hos.getString("timezone", "UTC")))
                .build();

        log.info("HOS policy: driving {} h, on duty {} h, cycle {} h / {} days, zone {}",
                policy.getDrivingLimitHours(), policy.getOnDutyLimitHours(),
                policy.getCycleLimitHours(), policy.getCycleDays(), policy.getZone());
        return policy;
    }

    private static double positive(JsonObject section, String key, double defaultValue) {
        double value = section.getDouble(key, defaultValue);
        if (value <= 0) {
            throw new IllegalArgumentException("hos." + key + " must be positive, got " + value);
        }
        return value;
    }

    private static int cycleDays(JsonObject section) {
        int value = section.getInteger("cycle-days", HosPolicy.DEFAULT_CYCLE_DAYS);
        if (value <= 0) {
            throw new IllegalArgumentException("hos.cycle-days must be positive, got " + value);
        }
        return value;
    }

    private static double warningRatio(JsonObject section) {
        double value = section.getDouble("cycle-warning-ratio", HosPolicy.DEFAULT_CYCLE_WARNING_RATIO);
        if (!(value > 0 && value <= 1)) {
            throw new IllegalArgumentException("hos.cycle-warning-ratio must be in (0, 1], got " + value);
        }
        return value;
    }

    private static ZoneId zone(String id) {
        try {
            return ZoneId.of(id);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("hos.timezone is not a valid zone id: " + id, e);
        }
    }
}
