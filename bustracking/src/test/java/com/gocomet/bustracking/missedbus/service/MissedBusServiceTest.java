package com.gocomet.bustracking.missedbus.service;

import com.gocomet.bustracking.broadcast.RealtimeBroadcaster;
import com.gocomet.bustracking.bus.model.Bus;
import com.gocomet.bustracking.bus.service.BusAssignmentService;
import com.gocomet.bustracking.common.config.MissedBusProperties;
import com.gocomet.bustracking.common.event.CoordinationEvent;
import com.gocomet.bustracking.common.exception.NotOwnerException;
import com.gocomet.bustracking.common.ratelimit.RequestRateLimiter;
import com.gocomet.bustracking.event.CoordinationEventProducer;
import com.gocomet.bustracking.feature.FeatureSwitchService;
import com.gocomet.bustracking.missedbus.dto.MissedBusRequestResponse;
import com.gocomet.bustracking.missedbus.dto.MissedBusResultEvent;
import com.gocomet.bustracking.missedbus.dto.RaiseMissedBusRequest;
import com.gocomet.bustracking.missedbus.dto.RaiseMissedBusResponse;
import com.gocomet.bustracking.missedbus.model.MissedBusMessages;
import com.gocomet.bustracking.missedbus.model.MissedBusRequest;
import com.gocomet.bustracking.missedbus.model.MissedBusStatus;
import com.gocomet.bustracking.missedbus.model.NoCandidatePolicy;
import com.gocomet.bustracking.missedbus.model.RaiseStage;
import com.gocomet.bustracking.missedbus.repository.MissedBusRequestRepository;
import com.gocomet.bustracking.notification.dto.RiderNotification;
import com.gocomet.bustracking.notification.service.NotificationDispatcher;
import com.gocomet.bustracking.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MissedBusServiceTest {

    private static final String STUDENT = "stu-1";
    private static final String OPERATION = "op-123";

    @Mock
    private MissedBusRequestRepository requestRepository;

    @Mock
    private CandidateMatcher candidateMatcher;

    @Mock
    private FeatureSwitchService featureSwitchService;

    @Mock
    private RequestRateLimiter rateLimiter;

    @Mock
    private BusAssignmentService busAssignmentService;

    @Mock
    private RealtimeBroadcaster broadcaster;

    @Mock
    private CoordinationEventProducer eventProducer;

    @Mock
    private NotificationDispatcher notificationDispatcher;

    private MutableClock clock;
    private MissedBusProperties properties;
    private MissedBusService missedBusService;
    private UUID requestId;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        properties = new MissedBusProperties();
        missedBusService = new MissedBusService(requestRepository, candidateMatcher, featureSwitchService,
                rateLimiter, busAssignmentService, broadcaster, eventProducer, notificationDispatcher,
                properties, clock);
        requestId = UUID.randomUUID();
    }

    private RaiseMissedBusRequest raiseRequest() {
        return RaiseMissedBusRequest.builder()
                .operationId(OPERATION)
                .routeId("R1")
                .stopId("S3")
                .assignedBusId("BUS-7")
                .assignedTripId("T-7")
                .build();
    }

    private MissedBusRequest stored(MissedBusStatus status) {
        return MissedBusRequest.builder()
                .id(requestId)
                .operationId(OPERATION)
                .studentId(STUDENT)
                .routeId("R1")
                .stopId("S3")
                .assignedBusId("BUS-7")
                .status(status)
                .createdAt(clock.instant())
                .expiresAt(clock.instant().plus(Duration.ofMinutes(15)))
                .pendingKey(status == MissedBusStatus.PENDING ? STUDENT : null)
                .build();
    }

    private void stubFreshRaise() {
        when(featureSwitchService.isMissedBusInMaintenance()).thenReturn(false);
        when(requestRepository.findByStudentIdAndOperationId(STUDENT, OPERATION)).thenReturn(Optional.empty());
        when(requestRepository.findActive(eq(STUDENT), any(Instant.class))).thenReturn(List.of());
        when(rateLimiter.tryAcquire(eq("missed-bus:" + STUDENT), eq(3), eq(Duration.ofHours(24)))).thenReturn(true);
        when(requestRepository.saveAndFlush(any(MissedBusRequest.class))).thenAnswer(inv -> {
            MissedBusRequest saved = inv.getArgument(0);
            saved.setId(requestId);
            return saved;
        });
    }

    // ---- raise ----

    @Test
    void testRaise_Maintenance_ReturnsMaintenanceWithoutTouchingStore() {
        // Arrange
        when(featureSwitchService.isMissedBusInMaintenance()).thenReturn(true);

        // Act
        RaiseMissedBusResponse response = missedBusService.raise(STUDENT, raiseRequest());

        // Assert
        assertEquals(RaiseStage.MAINTENANCE, response.getStage());
        assertEquals(MissedBusMessages.MAINTENANCE, response.getMessage());
        verifyNoInteractions(requestRepository, rateLimiter, candidateMatcher);
    }

    @Test
    void testRaise_CandidateFound_ApprovesAndNotifiesRiderAndDriver() {
        // Arrange
        stubFreshRaise();
        when(candidateMatcher.findAndReserve(any(MissedBusRequest.class)))
                .thenReturn(Optional.of(new MatchCandidate("BUS-9", "T-9", "Main Gate", 420.0)));
        when(requestRepository.approve(eq(requestId), eq("BUS-9"), eq("T-9"), anyString(), any(Instant.class)))
                .thenReturn(1);

        // Act
        RaiseMissedBusResponse response = missedBusService.raise(STUDENT, raiseRequest());

        // Assert
        assertEquals(RaiseStage.CREATED, response.getStage());
        assertEquals(MissedBusStatus.APPROVED, response.getStatus());
        assertEquals("Good news, Bus BUS-9 will pick you up. Please head to Main Gate.", response.getMessage());
        assertFalse(response.isReplayed());

        ArgumentCaptor<Object> pickup = ArgumentCaptor.forClass(Object.class);
        verify(broadcaster).publish(eq("driver_wait_request_BUS-9"), eq("missed_bus_pickup"), pickup.capture());
        assertEquals(requestId, ((MissedBusResultEvent) pickup.getValue()).getRequestId());
        verify(broadcaster).publish(eq("student_stu-1"), eq("missed_bus_approved"), any(MissedBusResultEvent.class));
        verify(notificationDispatcher).enqueue(any(RiderNotification.class));

        ArgumentCaptor<CoordinationEvent> events = ArgumentCaptor.forClass(CoordinationEvent.class);
        verify(eventProducer, times(2)).publish(events.capture());
        assertEquals(CoordinationEvent.EventType.MISSED_BUS_REQUESTED, events.getAllValues().get(0).getEventType());
        assertEquals(CoordinationEvent.EventType.MISSED_BUS_APPROVED, events.getAllValues().get(1).getEventType());

        ArgumentCaptor<MissedBusRequest> saved = ArgumentCaptor.forClass(MissedBusRequest.class);
        verify(requestRepository).saveAndFlush(saved.capture());
        assertEquals(clock.instant(), saved.getValue().getLastMatchAttemptAt());
        assertTrue(saved.getValue().isSeatHeld());
    }

    @Test
    void testRaise_SameOperationTwice_SecondReplaysWithoutNewRow() {
        // Arrange
        stubFreshRaise();
        when(candidateMatcher.findAndReserve(any(MissedBusRequest.class))).thenReturn(Optional.empty());
        RaiseMissedBusResponse first = missedBusService.raise(STUDENT, raiseRequest());
        when(requestRepository.findByStudentIdAndOperationId(STUDENT, OPERATION))
                .thenReturn(Optional.of(stored(MissedBusStatus.PENDING)));

        // Act
        RaiseMissedBusResponse second = missedBusService.raise(STUDENT, raiseRequest());

        // Assert
        assertEquals(RaiseStage.CREATED, first.getStage());
        assertEquals(RaiseStage.CREATED, second.getStage());
        assertTrue(second.isReplayed());
        assertEquals(first.getRequestId(), second.getRequestId());
        verify(requestRepository, times(1)).saveAndFlush(any(MissedBusRequest.class));
        verify(rateLimiter, times(1)).tryAcquire(anyString(), anyInt(), any(Duration.class));
    }

    @Test
    void testRaise_NewOperationWhilePending_ReturnsDuplicate() {
        // Arrange
        when(featureSwitchService.isMissedBusInMaintenance()).thenReturn(false);
        when(requestRepository.findByStudentIdAndOperationId(STUDENT, "op-other")).thenReturn(Optional.empty());
        when(requestRepository.findActive(eq(STUDENT), any(Instant.class)))
                .thenReturn(List.of(stored(MissedBusStatus.PENDING)));
        RaiseMissedBusRequest request = raiseRequest();
        request.setOperationId("op-other");

        // Act
        RaiseMissedBusResponse response = missedBusService.raise(STUDENT, request);

        // Assert
        assertEquals(RaiseStage.DUPLICATE, response.getStage());
        assertEquals(requestId, response.getExistingRequestId());
        verify(requestRepository, never()).saveAndFlush(any());
        verifyNoInteractions(rateLimiter);
    }

    @Test
    void testRaise_OverDailyLimit_ReturnsRateLimited() {
        // Arrange
        when(featureSwitchService.isMissedBusInMaintenance()).thenReturn(false);
        when(requestRepository.findByStudentIdAndOperationId(STUDENT, OPERATION)).thenReturn(Optional.empty());
        when(requestRepository.findActive(eq(STUDENT), any(Instant.class))).thenReturn(List.of());
        when(rateLimiter.tryAcquire(anyString(), anyInt(), any(Duration.class))).thenReturn(false);

        // Act
        RaiseMissedBusResponse response = missedBusService.raise(STUDENT, raiseRequest());

        // Assert
        assertEquals(RaiseStage.RATE_LIMITED, response.getStage());
        verify(requestRepository, never()).saveAndFlush(any());
    }

    @Test
    void testRaise_NoCandidateUnderKeepPending_StaysPending() {
        // Arrange
        stubFreshRaise();
        when(candidateMatcher.findAndReserve(any(MissedBusRequest.class))).thenReturn(Optional.empty());

        // Act
        RaiseMissedBusResponse response = missedBusService.raise(STUDENT, raiseRequest());

        // Assert
        assertEquals(MissedBusStatus.PENDING, response.getStatus());
        assertEquals(MissedBusMessages.REQUEST_PENDING, response.getMessage());
        verify(requestRepository, never()).resolvePending(any(), any(), any(), any());
        verifyNoInteractions(broadcaster);
    }

    @Test
    void testRaise_NoCandidateUnderRejectPolicy_RejectsAndNotifies() {
        // Arrange
        properties.setNoCandidatePolicy(NoCandidatePolicy.REJECT);
        stubFreshRaise();
        when(candidateMatcher.findAndReserve(any(MissedBusRequest.class))).thenReturn(Optional.empty());
        when(requestRepository.resolvePending(eq(requestId), eq(MissedBusStatus.REJECTED),
                eq(MissedBusMessages.NO_CANDIDATES), any(Instant.class))).thenReturn(1);

        // Act
        RaiseMissedBusResponse response = missedBusService.raise(STUDENT, raiseRequest());

        // Assert
        assertEquals(MissedBusStatus.REJECTED, response.getStatus());
        verify(broadcaster).publish(eq("student_stu-1"), eq("missed_bus_rejected"), any());
    }

    @Test
    void testRaise_CancelledWhileMatching_ReleasesReservedSeat() {
        // Arrange
        stubFreshRaise();
        when(candidateMatcher.findAndReserve(any(MissedBusRequest.class)))
                .thenReturn(Optional.of(new MatchCandidate("BUS-9", "T-9", "Main Gate", 420.0)));
        when(requestRepository.approve(any(), anyString(), anyString(), anyString(), any(Instant.class)))
                .thenReturn(0);
        when(requestRepository.findById(requestId)).thenReturn(Optional.of(stored(MissedBusStatus.CANCELLED)));

        // Act
        RaiseMissedBusResponse response = missedBusService.raise(STUDENT, raiseRequest());

        // Assert
        assertEquals(MissedBusStatus.CANCELLED, response.getStatus());
        verify(candidateMatcher).releaseSeat("BUS-9");
        verify(broadcaster, never()).publish(eq("driver_wait_request_BUS-9"), anyString(), any());
    }

    @Test
    void testRaise_StoreUnavailable_ReportsMaintenance() {
        // Arrange
        when(featureSwitchService.isMissedBusInMaintenance()).thenReturn(false);
        when(requestRepository.findByStudentIdAndOperationId(STUDENT, OPERATION))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        // Act
        RaiseMissedBusResponse response = missedBusService.raise(STUDENT, raiseRequest());

        // Assert
        assertEquals(RaiseStage.MAINTENANCE, response.getStage());
    }

    @Test
    void testRaise_MatchingFailsOnInfrastructure_RequestStaysPending() {
        // Arrange
        stubFreshRaise();
        when(candidateMatcher.findAndReserve(any(MissedBusRequest.class)))
                .thenThrow(new DataAccessResourceFailureException("redis down"));

        // Act
        RaiseMissedBusResponse response = missedBusService.raise(STUDENT, raiseRequest());

        // Assert
        assertEquals(RaiseStage.CREATED, response.getStage());
        assertEquals(MissedBusStatus.PENDING, response.getStatus());
    }

    @Test
    void testRaise_ConcurrentSameOperation_UniqueConflictBecomesReplay() {
        // Arrange
        when(featureSwitchService.isMissedBusInMaintenance()).thenReturn(false);
        when(requestRepository.findByStudentIdAndOperationId(STUDENT, OPERATION))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(stored(MissedBusStatus.PENDING)));
        when(requestRepository.findActive(eq(STUDENT), any(Instant.class))).thenReturn(List.of());
        when(rateLimiter.tryAcquire(anyString(), anyInt(), any(Duration.class))).thenReturn(true);
        when(requestRepository.saveAndFlush(any(MissedBusRequest.class)))
                .thenThrow(new DataIntegrityViolationException("uk_missed_bus_student_operation"));

        // Act
        RaiseMissedBusResponse response = missedBusService.raise(STUDENT, raiseRequest());

        // Assert
        assertEquals(RaiseStage.CREATED, response.getStage());
        assertTrue(response.isReplayed());
        assertEquals(requestId, response.getRequestId());
        verifyNoInteractions(candidateMatcher);
    }

    // ---- cancel ----

    @Test
    void testCancel_Pending_CancelsRequest() {
        // Arrange
        when(requestRepository.findById(requestId)).thenReturn(Optional.of(stored(MissedBusStatus.PENDING)));
        when(requestRepository.resolvePending(eq(requestId), eq(MissedBusStatus.CANCELLED),
                eq(MissedBusMessages.REQUEST_CANCELLED), any(Instant.class))).thenReturn(1);

        // Act
        MissedBusRequestResponse response = missedBusService.cancel(requestId, STUDENT);

        // Assert
        assertEquals(MissedBusStatus.CANCELLED, response.getStatus());
        verify(eventProducer).publish(any(CoordinationEvent.class));
    }

    @Test
    void testCancel_Approved_ReturnsUnchanged() {
        when(requestRepository.findById(requestId)).thenReturn(Optional.of(stored(MissedBusStatus.APPROVED)));

        MissedBusRequestResponse response = missedBusService.cancel(requestId, STUDENT);

        assertEquals(MissedBusStatus.APPROVED, response.getStatus());
        verify(requestRepository, never()).resolvePending(any(), any(), any(), any());
        verifyNoInteractions(eventProducer, candidateMatcher);
    }

    @Test
    void testCancel_ApprovedByMatcherMidCancel_ReturnsApprovedWithoutPublishing() {
        // Arrange
        when(requestRepository.findById(requestId))
                .thenReturn(Optional.of(stored(MissedBusStatus.PENDING)))
                .thenReturn(Optional.of(stored(MissedBusStatus.APPROVED)));
        when(requestRepository.resolvePending(eq(requestId), eq(MissedBusStatus.CANCELLED), anyString(),
                any(Instant.class))).thenReturn(0);

        // Act
        MissedBusRequestResponse response = missedBusService.cancel(requestId, STUDENT);

        // Assert
        assertEquals(MissedBusStatus.APPROVED, response.getStatus());
        verifyNoInteractions(eventProducer, broadcaster);
    }

    @Test
    void testCancel_AlreadyExpired_ReturnsUnchanged() {
        when(requestRepository.findById(requestId)).thenReturn(Optional.of(stored(MissedBusStatus.EXPIRED)));

        MissedBusRequestResponse response = missedBusService.cancel(requestId, STUDENT);

        assertEquals(MissedBusStatus.EXPIRED, response.getStatus());
        verify(requestRepository, never()).resolvePending(any(), any(), any(), any());
    }

    @Test
    void testCancel_NotOwner_Throws() {
        when(requestRepository.findById(requestId)).thenReturn(Optional.of(stored(MissedBusStatus.PENDING)));

        assertThrows(NotOwnerException.class, () -> missedBusService.cancel(requestId, "stu-2"));
    }

    // ---- expire ----

    @Test
    void testExpire_ConcurrentSweeps_NotifyExactlyOnce() {
        // Arrange
        clock.advance(Duration.ofMinutes(16));
        when(requestRepository.expire(eq(requestId), eq(MissedBusMessages.REQUEST_EXPIRED), any(Instant.class)))
                .thenReturn(1)
                .thenReturn(0);
        MissedBusRequest expired = stored(MissedBusStatus.EXPIRED);
        expired.setResolutionMessage(MissedBusMessages.REQUEST_EXPIRED);
        when(requestRepository.findById(requestId)).thenReturn(Optional.of(expired));

        // Act
        boolean first = missedBusService.expire(requestId);
        boolean second = missedBusService.expire(requestId);

        // Assert
        assertTrue(first);
        assertFalse(second);
        verify(broadcaster, times(1)).publish(eq("student_stu-1"), eq("missed_bus_expired"), any());
        ArgumentCaptor<RiderNotification> notification = ArgumentCaptor.forClass(RiderNotification.class);
        verify(notificationDispatcher, times(1)).enqueue(notification.capture());
        assertEquals(MissedBusMessages.REQUEST_EXPIRED, notification.getValue().getBody());
    }

    // ---- pickup window ----

    @Test
    void testClosePickupWindow_SeatHeldPastWindow_ReturnsSeatOnce() {
        // Arrange
        clock.advance(Duration.ofMinutes(16));
        MissedBusRequest approved = stored(MissedBusStatus.APPROVED);
        approved.setCandidateBusId("BUS-9");
        when(requestRepository.releaseHeldSeat(requestId, clock.instant())).thenReturn(1).thenReturn(0);
        when(requestRepository.findById(requestId)).thenReturn(Optional.of(approved));

        // Act
        boolean first = missedBusService.closePickupWindow(requestId);
        boolean second = missedBusService.closePickupWindow(requestId);

        // Assert
        assertTrue(first);
        assertFalse(second);
        verify(candidateMatcher, times(1)).returnSeat("BUS-9");
        ArgumentCaptor<CoordinationEvent> event = ArgumentCaptor.forClass(CoordinationEvent.class);
        verify(eventProducer).publish(event.capture());
        assertEquals(CoordinationEvent.EventType.MISSED_BUS_PICKUP_CLOSED, event.getValue().getEventType());
    }

    @Test
    void testClosePickupWindow_SeatReturnFails_Propagates() {
        // Arrange
        MissedBusRequest approved = stored(MissedBusStatus.APPROVED);
        approved.setCandidateBusId("BUS-9");
        when(requestRepository.releaseHeldSeat(eq(requestId), any(Instant.class))).thenReturn(1);
        when(requestRepository.findById(requestId)).thenReturn(Optional.of(approved));
        doThrow(new DataAccessResourceFailureException("db down")).when(candidateMatcher).returnSeat("BUS-9");

        // Act & Assert
        assertThrows(DataAccessResourceFailureException.class, () -> missedBusService.closePickupWindow(requestId));
        verifyNoInteractions(eventProducer);
    }

    // ---- reads ----

    @Test
    void testGetActiveRequest_NoneActive_IsEmpty() {
        when(requestRepository.findActive(eq(STUDENT), any(Instant.class))).thenReturn(List.of());

        assertTrue(missedBusService.getActiveRequest(STUDENT).isEmpty());
    }

    @Test
    void testGetPickupsForBus_AssignedDriver_ListsApprovedRequests() {
        // Arrange
        when(busAssignmentService.requireAssignedDriver("BUS-9", "drv-9"))
                .thenReturn(Bus.builder().id("BUS-9").assignedDriverId("drv-9").capacity(40).build());
        MissedBusRequest approved = stored(MissedBusStatus.APPROVED);
        approved.setCandidateBusId("BUS-9");
        when(requestRepository.findByCandidateBusIdAndStatusAndExpiresAtAfterOrderByCreatedAtAsc(
                "BUS-9", MissedBusStatus.APPROVED, clock.instant())).thenReturn(List.of(approved));

        // Act
        List<MissedBusRequestResponse> pickups = missedBusService.getPickupsForBus("BUS-9", "drv-9");

        // Assert
        assertEquals(1, pickups.size());
        assertEquals("BUS-9", pickups.get(0).getCandidateBusId());
    }

    @Test
    void testRetryMatch_RequestNoLongerPending_DoesNothing() {
        when(requestRepository.findById(requestId)).thenReturn(Optional.of(stored(MissedBusStatus.CANCELLED)));

        missedBusService.retryMatch(requestId);

        verifyNoInteractions(candidateMatcher);
    }
}
