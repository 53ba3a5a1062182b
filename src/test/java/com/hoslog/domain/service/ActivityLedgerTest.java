package com.hoslog.domain.service;

import com.hoslog.domain.exception.AlreadyTrackingException;
import com.hoslog.domain.exception.InvalidTimeRangeException;
import com.hoslog.domain.exception.NotTrackingException;
import com.hoslog.domain.model.ActivityRecord;
import com.hoslog.domain.model.DutyStatus;
import com.hoslog.domain.model.OpenActivity;
import com.hoslog.domain.model.Telemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the per-driver duty-status state machine
 */
class ActivityLedgerTest {

    private static final Instant SIX = Instant.parse("2026-01-06T06:00:00Z");

    private ActivityLedger ledger;

    @BeforeEach
    void setUp() {
        AtomicInteger sequence = new AtomicInteger();
        ledger = new ActivityLedger("driver-1", () -> "activity-" + sequence.incrementAndGet());
    }

    @Test
    void start_shouldOpenActivityWhenIdle() {
        // When
        OpenActivity open = ledger.start(DutyStatus.DRIVING, SIX, "Long Beach, CA", "Pre-trip done");

        // Then
        assertTrue(ledger.isTracking());
        assertEquals("activity-1", open.getId());
        assertEquals(DutyStatus.DRIVING, open.getStatus());
        assertEquals(SIX, open.getStartTime());
        assertEquals(open, ledger.currentActivity().orElseThrow());
        assertTrue(ledger.completedActivities().isEmpty());
    }

    @Test
    void start_shouldRejectSecondOpenActivity() {
        // Given
        ledger.start(DutyStatus.DRIVING, SIX, null, null);

        // When
        AlreadyTrackingException ex = assertThrows(AlreadyTrackingException.class,
                () -> ledger.start(DutyStatus.ON_DUTY_NOT_DRIVING, SIX.plusSeconds(60), null, null));

        // Then the original activity is untouched
        assertEquals(DutyStatus.DRIVING, ledger.currentActivity().orElseThrow().getStatus());
        assertEquals(SIX, ledger.currentActivity().orElseThrow().getStartTime());
        assertTrue(ex.getMessage().contains("driver-1"));
    }

    @Test
    void stop_shouldCloseActivityIntoRecord() {
        // Given
        ledger.start(DutyStatus.DRIVING, SIX, "Long Beach, CA", null);
        Instant nineThirty = SIX.plus(Duration.ofMinutes(210));

        // When
        ActivityRecord record = ledger.stop(nineThirty);

        // Then
        assertFalse(ledger.isTracking());
        assertTrue(ledger.currentActivity().isEmpty());
        assertEquals(List.of(record), ledger.completedActivities());
        assertEquals("activity-1", record.getId());
        assertEquals(SIX, record.getStartTime());
        assertEquals(nineThirty, record.getEndTime());
        assertEquals(3.5, record.getDurationHours());
        assertEquals("Long Beach, CA", record.getLocation());
    }

    @Test
    void stop_shouldCarryTelemetry() {
        ledger.start(DutyStatus.DRIVING, SIX, null, null);

        ActivityRecord record = ledger.stop(SIX.plusSeconds(3600), new Telemetry(145350.0, 8522.5));

        assertEquals(145350.0, record.getOdometer());
        assertEquals(8522.5, record.getEngineHours());
    }

    @Test
    void stop_shouldFailWhenIdleAndLeaveStateUnchanged() {
        // Given one completed activity
        ledger.start(DutyStatus.OFF_DUTY, SIX, null, null);
        ledger.stop(SIX.plusSeconds(600));
        List<ActivityRecord> before = List.copyOf(ledger.completedActivities());

        // When / Then
        assertThrows(NotTrackingException.class, () -> ledger.stop(SIX.plusSeconds(1200)));
        assertEquals(before, ledger.completedActivities());
        assertFalse(ledger.isTracking());
    }

    @Test
    void stop_shouldRejectEndBeforeStart() {
        ledger.start(DutyStatus.DRIVING, SIX, null, null);

        assertThrows(InvalidTimeRangeException.class, () -> ledger.stop(SIX.minusSeconds(1)));
        assertTrue(ledger.isTracking());
        assertTrue(ledger.completedActivities().isEmpty());
    }

    @Test
    void stop_atStartInstantShouldProduceZeroLengthRecord() {
        ledger.start(DutyStatus.SLEEPER_BERTH, SIX, null, null);

        ActivityRecord record = ledger.stop(SIX);

        assertEquals(0.0, record.getDurationHours());
    }

    @Test
    void start_shouldRejectInstantBeforeLastRecordEnd() {
        ledger.start(DutyStatus.DRIVING, SIX, null, null);
        ledger.stop(SIX.plusSeconds(3600));

        assertThrows(InvalidTimeRangeException.class,
                () -> ledger.start(DutyStatus.OFF_DUTY, SIX.plusSeconds(1800), null, null));
        assertFalse(ledger.isTracking());

        // back-to-back is fine
        ledger.start(DutyStatus.OFF_DUTY, SIX.plusSeconds(3600), null, null);
        assertTrue(ledger.isTracking());
    }

    @Test
    void completedActivities_shouldNotBeModifiable() {
        ledger.start(DutyStatus.DRIVING, SIX, null, null);
        ledger.stop(SIX.plusSeconds(60));

        assertThrows(UnsupportedOperationException.class, () -> ledger.completedActivities().clear());
    }

    @Test
    void completedOn_shouldReturnRecordsTouchingTheDay() {
        ledger.start(DutyStatus.SLEEPER_BERTH, Instant.parse("2026-01-05T22:00:00Z"), null, null);
        ledger.stop(Instant.parse("2026-01-06T05:00:00Z"));
        ledger.start(DutyStatus.DRIVING, Instant.parse("2026-01-07T01:00:00Z"), null, null);
        ledger.stop(Instant.parse("2026-01-07T02:00:00Z"));

        List<ActivityRecord> jan6 = ledger.completedOn(LocalDate.of(2026, 1, 6), ZoneOffset.UTC);

        assertEquals(1, jan6.size());
        assertEquals(Instant.parse("2026-01-05T22:00:00Z"), jan6.get(0).getStartTime());
    }

    @Test
    void randomSequences_shouldKeepOneOpenActivityAndNonOverlappingRecords() {
        Random random = new Random(42);
        Instant now = SIX;

        for (int i = 0; i < 500; i++) {
            now = now.plusSeconds(random.nextInt(1800));
            try {
                if (random.nextBoolean()) {
                    ledger.start(DutyStatus.values()[random.nextInt(4)], now, null, null);
                } else {
                    ledger.stop(now);
                }
            } catch (AlreadyTrackingException | NotTrackingException e) {
                // expected for illegal transitions
            }

            List<ActivityRecord> records = ledger.completedActivities();
            for (int j = 1; j < records.size(); j++) {
                assertFalse(records.get(j).getStartTime().isBefore(records.get(j - 1).getEndTime()));
            }
            ledger.currentActivity().ifPresent(open -> {
                if (!records.isEmpty()) {
                    assertFalse(open.getStartTime().isBefore(records.get(records.size() - 1).getEndTime()));
                }
            });
        }
    }
}
