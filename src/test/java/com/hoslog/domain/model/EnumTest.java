package com.hoslog.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for enums
 */
class EnumTest {

    @Test
    void testDutyStatusWireCodes() {
        // Test fromValue
        assertEquals(DutyStatus.ON_DUTY_NOT_DRIVING, DutyStatus.fromValue("ONDUTY"));
        assertEquals(DutyStatus.OFF_DUTY, DutyStatus.fromValue("OFFDUTY"));
        assertEquals(DutyStatus.DRIVING, DutyStatus.fromValue("DRIVING"));
        assertEquals(DutyStatus.SLEEPER_BERTH, DutyStatus.fromValue("SLEEPER"));

        // Test case insensitivity
        assertEquals(DutyStatus.DRIVING, DutyStatus.fromValue("driving"));
        assertEquals(DutyStatus.SLEEPER_BERTH, DutyStatus.fromValue("sleeper"));

        // Test isValid
        assertTrue(DutyStatus.isValid("ONDUTY"));
        assertFalse(DutyStatus.isValid("ON_DUTY"));
        assertFalse(DutyStatus.isValid("YARD_MOVE"));

        // Test invalid value
        assertThrows(IllegalArgumentException.class, () -> DutyStatus.fromValue("YARD_MOVE"));
    }

    @Test
    void testDutyStatusRoundTripForAllStatuses() {
        for (DutyStatus status : DutyStatus.values()) {
            assertEquals(status, DutyStatus.fromValue(status.getValue()));
            assertEquals(status, DutyStatus.fromWireCode(status.getValue()));
        }
    }

    @Test
    void testWireCodesAreDistinct() {
        long distinct = java.util.Arrays.stream(DutyStatus.values())
                .map(DutyStatus::getValue)
                .distinct()
                .count();
        assertEquals(DutyStatus.values().length, distinct);
    }

    @Test
    void testUnknownWireCodeFallsBackToOffDuty() {
        assertEquals(DutyStatus.OFF_DUTY, DutyStatus.fromWireCode("PERSONAL_CONVEYANCE"));
        assertEquals(DutyStatus.OFF_DUTY, DutyStatus.fromWireCode(null));
        assertEquals(DutyStatus.OFF_DUTY, DutyStatus.fromWireCode(""));
    }

    @Test
    void testDutyStatusRanks() {
        assertEquals(1, DutyStatus.OFF_DUTY.getRank());
        assertEquals(2, DutyStatus.SLEEPER_BERTH.getRank());
        assertEquals(3, DutyStatus.DRIVING.getRank());
        assertEquals(4, DutyStatus.ON_DUTY_NOT_DRIVING.getRank());
    }

    @Test
    void testDutyStatusOnDuty() {
        assertTrue(DutyStatus.DRIVING.isOnDuty());
        assertTrue(DutyStatus.ON_DUTY_NOT_DRIVING.isOnDuty());
        assertFalse(DutyStatus.OFF_DUTY.isOnDuty());
        assertFalse(DutyStatus.SLEEPER_BERTH.isOnDuty());
        assertEquals("On Duty (Not Driving)", DutyStatus.ON_DUTY_NOT_DRIVING.getLabel());
    }

    @Test
    void testTimelineStatus() {
        for (DutyStatus status : DutyStatus.values()) {
            TimelineStatus row = TimelineStatus.of(status);
            assertEquals(status, row.getDutyStatus());
            assertEquals(status.getRank(), row.getRank());
            assertTrue(row.isSpecified());
        }
        assertEquals(0, TimelineStatus.UNSPECIFIED.getRank());
        assertFalse(TimelineStatus.UNSPECIFIED.isSpecified());
    }

    @Test
    void testHosRule() {
        assertEquals("driving-limit", HosRule.DRIVING_LIMIT.getValue());
        assertEquals("on-duty-limit", HosRule.ON_DUTY_LIMIT.getValue());
        assertEquals("cycle-limit", HosRule.CYCLE_LIMIT.getValue());
        assertEquals(HosRule.CYCLE_LIMIT, HosRule.fromValue("CYCLE-LIMIT"));
        assertThrows(IllegalArgumentException.class, () -> HosRule.fromValue("weekly-limit"));
    }

    @Test
    void testTripStatus() {
        assertEquals(TripStatus.IN_PROGRESS, TripStatus.fromValue("in-progress"));
        assertEquals("completed", TripStatus.COMPLETED.getValue());
        assertThrows(IllegalArgumentException.class, () -> TripStatus.fromValue("cancelled"));
    }
}
