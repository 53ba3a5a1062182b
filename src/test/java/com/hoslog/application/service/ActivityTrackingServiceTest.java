package com.hoslog.application.service;

import com.hoslog.MutableClock;
import com.hoslog.application.port.in.ActivityTrackingUseCase.ActivitySnapshot;
import com.hoslog.application.port.in.ActivityTrackingUseCase.StartActivityCommand;
import com.hoslog.application.port.in.ActivityTrackingUseCase.StopActivityCommand;
import com.hoslog.application.port.out.ActivityRecordRepository;
import com.hoslog.application.port.out.ActivitySyncPort;
import com.hoslog.domain.exception.AlreadyTrackingException;
import com.hoslog.domain.exception.NotTrackingException;
import com.hoslog.domain.model.ActivityRecord;
import com.hoslog.domain.model.DutyStatus;
import com.hoslog.domain.model.HosPolicy;
import com.hoslog.domain.model.OpenActivity;
import com.hoslog.domain.service.DurationAggregator;
import io.vertx.core.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ActivityTrackingServiceTest {

    private static final Instant SIX = Instant.parse("2026-01-06T06:00:00Z");

    @Mock
    private ActivityRecordRepository recordRepository;

    @Mock
    private ActivitySyncPort syncPort;

    private MutableClock clock;
    private DriverLedgerRegistry registry;
    private ActivityTrackingService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        clock = new MutableClock(SIX);
        HosPolicy policy = HosPolicy.defaults();
        registry = new DriverLedgerRegistry(policy);
        service = new ActivityTrackingService(registry, recordRepository, syncPort,
                new ActivityCommandValidator(), new DurationAggregator(), policy, clock);

        when(recordRepository.save(anyString(), any())).thenReturn(Future.succeededFuture());
        when(syncPort.publishStarted(anyString(), any())).thenReturn(Future.succeededFuture());
        when(syncPort.publishCompleted(anyString(), any())).thenReturn(Future.succeededFuture());
    }

    @Test
    void startActivity_shouldOpenActivityAtClockTime() {
        // When
        Future<OpenActivity> result = service.startActivity(
                new StartActivityCommand("driver-1", "DRIVING", "Long Beach, CA", "  "));

        // Then
        assertTrue(result.succeeded());
        OpenActivity open = result.result();
        assertEquals(DutyStatus.DRIVING, open.getStatus());
        assertEquals(SIX, open.getStartTime());
        assertNull(open.getNotes());
        assertTrue(registry.ledger("driver-1").isTracking());
        verify(syncPort).publishStarted("driver-1", open);
    }

    @Test
    void startActivity_shouldFailValidationForUnknownStatus() {
        Future<OpenActivity> result = service.startActivity(
                new StartActivityCommand("driver-1", "YARD_MOVE", null, null));

        assertTrue(result.failed());
        assertInstanceOf(IllegalArgumentException.class, result.cause());
        assertTrue(result.cause().getMessage().contains("status must be one of"));
        assertFalse(registry.ledger("driver-1").isTracking());
        verifyNoInteractions(syncPort);
    }

    @Test
    void startActivity_whileTrackingShouldFail() {
        service.startActivity(new StartActivityCommand("driver-1", "DRIVING", null, null));

        Future<OpenActivity> result = service.startActivity(
                new StartActivityCommand("driver-1", "ONDUTY", null, null));

        assertTrue(result.failed());
        assertInstanceOf(AlreadyTrackingException.class, result.cause());
    }

    @Test
    void stopActivity_shouldCloseAndPersistRecord() {
        // Given
        service.startActivity(new StartActivityCommand("driver-1", "DRIVING", null, null));
        clock.advance(Duration.ofMinutes(210));

        // When
        Future<ActivityRecord> result = service.stopActivity(new StopActivityCommand("driver-1", 145350.0, null));

        // Then
        assertTrue(result.succeeded());
        assertEquals(3.5, result.result().getDurationHours());
        assertEquals(145350.0, result.result().getOdometer());

        ArgumentCaptor<ActivityRecord> captor = ArgumentCaptor.forClass(ActivityRecord.class);
        verify(recordRepository).save(eq("driver-1"), captor.capture());
        assertEquals(result.result(), captor.getValue());
        verify(syncPort).publishCompleted("driver-1", result.result());
    }

    @Test
    void stopActivity_whenIdleShouldFail() {
        Future<ActivityRecord> result = service.stopActivity(new StopActivityCommand("driver-1", null, null));

        assertTrue(result.failed());
        assertInstanceOf(NotTrackingException.class, result.cause());
        verifyNoInteractions(recordRepository);
    }

    @Test
    void stopActivity_shouldSucceedWhenStoreAndSyncFail() {
        // Given
        when(recordRepository.save(anyString(), any()))
                .thenReturn(Future.failedFuture(new RuntimeException("disk full")));
        when(syncPort.publishCompleted(anyString(), any()))
                .thenReturn(Future.failedFuture(new RuntimeException("backend down")));
        service.startActivity(new StartActivityCommand("driver-1", "ONDUTY", null, null));
        clock.advance(Duration.ofHours(1));

        // When
        Future<ActivityRecord> result = service.stopActivity(new StopActivityCommand("driver-1", null, null));

        // Then the ledger transition stands
        assertTrue(result.succeeded());
        assertFalse(registry.ledger("driver-1").isTracking());
        assertEquals(1, registry.ledger("driver-1").completedActivities().size());
    }

    @Test
    void stopActivity_shouldRejectNegativeOdometer() {
        service.startActivity(new StartActivityCommand("driver-1", "DRIVING", null, null));

        Future<ActivityRecord> result = service.stopActivity(new StopActivityCommand("driver-1", -5.0, null));

        assertTrue(result.failed());
        assertInstanceOf(IllegalArgumentException.class, result.cause());
        assertTrue(registry.ledger("driver-1").isTracking());
    }

    @Test
    void currentTotals_shouldIncludeOpenActivity() {
        // Given 3.5h driving done, then on duty for 30 minutes so far
        service.startActivity(new StartActivityCommand("driver-1", "DRIVING", null, null));
        clock.advance(Duration.ofMinutes(210));
        service.stopActivity(new StopActivityCommand("driver-1", null, null));
        service.startActivity(new StartActivityCommand("driver-1", "ONDUTY", null, null));
        clock.advance(Duration.ofMinutes(30));

        // When
        ActivitySnapshot snapshot = service.currentTotals("driver-1").result();

        // Then
        assertEquals(3.5, snapshot.totals().drivingHours());
        assertEquals(0.5, snapshot.totals().hours(DutyStatus.ON_DUTY_NOT_DRIVING));
        assertEquals(0.5, snapshot.elapsedHours());
        assertEquals(clock.instant(), snapshot.asOf());
    }

    @Test
    void currentTotals_shouldOnlyCountTodayOfActivityStartedYesterday() {
        // Given sleeper berth since 22:00 yesterday, now 02:00
        clock.set(Instant.parse("2026-01-05T22:00:00Z"));
        service.startActivity(new StartActivityCommand("driver-1", "SLEEPER", null, null));
        clock.set(Instant.parse("2026-01-06T02:00:00Z"));

        // When
        ActivitySnapshot snapshot = service.currentTotals("driver-1").result();

        // Then
        assertEquals(2.0, snapshot.totals().hours(DutyStatus.SLEEPER_BERTH));
        assertEquals(4.0, snapshot.elapsedHours());
    }

    @Test
    void startActivity_shouldSucceedWhenSyncThrowsSynchronously() {
        // Given a sync port that throws instead of returning a failed future
        when(syncPort.publishStarted(anyString(), any())).thenThrow(new RuntimeException("unknown protocol"));

        // When
        Future<OpenActivity> result = service.startActivity(
                new StartActivityCommand("driver-1", "DRIVING", null, null));

        // Then
        assertTrue(result.succeeded());
        assertTrue(registry.ledger("driver-1").isTracking());
    }

    @Test
    void stopActivity_shouldSucceedWhenStoreAndSyncThrowSynchronously() {
        // Given
        when(recordRepository.save(anyString(), any())).thenThrow(new IllegalStateException("store closed"));
        when(syncPort.publishCompleted(anyString(), any())).thenThrow(new RuntimeException("unknown protocol"));
        service.startActivity(new StartActivityCommand("driver-1", "DRIVING", null, null));
        clock.advance(Duration.ofHours(2));

        // When
        Future<ActivityRecord> result = service.stopActivity(new StopActivityCommand("driver-1", null, null));

        // Then
        assertTrue(result.succeeded());
        assertEquals(2.0, result.result().getDurationHours());
        assertFalse(registry.ledger("driver-1").isTracking());
        verify(syncPort).publishCompleted("driver-1", result.result());
    }

    @Test
    void currentTotals_unknownDriverShouldNotOpenSession() {
        ActivitySnapshot snapshot = service.currentTotals("driver-unknown").result();

        assertTrue(snapshot.openActivity().isEmpty());
        assertEquals(0.0, snapshot.totals().totalHours());
        assertTrue(registry.find("driver-unknown").isEmpty());
    }
}
