package com.hoslog.infrastructure.config;

import com.hoslog.domain.model.HosPolicy;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class HosPolicyFactoryTest {

    @Test
    void fromConfig_shouldReadHosSection() {
        HosPolicy policy = HosPolicyFactory.fromConfig(ApplicationConfigLoader.load("application-test.yml"));

        assertEquals(10.0, policy.getDrivingLimitHours());
        assertEquals(HosPolicy.DEFAULT_ON_DUTY_LIMIT_HOURS, policy.getOnDutyLimitHours());
        assertEquals(60.0, policy.getCycleLimitHours());
        assertEquals(7, policy.getCycleDays());
        assertEquals(ZoneId.of("UTC"), policy.getZone());
    }

    @Test
    void fromConfig_emptyConfigShouldUseDefaults() {
        assertEquals(HosPolicy.defaults(), HosPolicyFactory.fromConfig(new JsonObject()));
    }

    @Test
    void fromConfig_shouldRejectNonPositiveLimit() {
        JsonObject config = new JsonObject().put("hos", new JsonObject().put("driving-limit-hours", 0));

        assertThrows(IllegalArgumentException.class, () -> HosPolicyFactory.fromConfig(config));
    }

    @Test
    void fromConfig_shouldRejectUnknownZone() {
        JsonObject config = new JsonObject().put("hos", new JsonObject().put("timezone", "Mars/Olympus_Mons"));

        assertThrows(IllegalArgumentException.class, () -> HosPolicyFactory.fromConfig(config));
    }

    @Test
    void fromConfig_shouldRejectNonPositiveCycleDays() {
        JsonObject config = new JsonObject().put("hos", new JsonObject().put("cycle-days", 0));

        assertThrows(IllegalArgumentException.class, () -> HosPolicyFactory.fromConfig(config));
    }

    @Test
    void fromConfig_shouldKeepWarningRatioWithinUnitInterval() {
        JsonObject zero = new JsonObject().put("hos", new JsonObject().put("cycle-warning-ratio", 0.0));
        JsonObject percent = new JsonObject().put("hos", new JsonObject().put("cycle-warning-ratio", 80));
        JsonObject full = new JsonObject().put("hos", new JsonObject().put("cycle-warning-ratio", 1.0));

        assertThrows(IllegalArgumentException.class, () -> HosPolicyFactory.fromConfig(zero));
        assertThrows(IllegalArgumentException.class, () -> HosPolicyFactory.fromConfig(percent));
        assertEquals(1.0, HosPolicyFactory.fromConfig(full).getCycleWarningRatio());
    }
}
