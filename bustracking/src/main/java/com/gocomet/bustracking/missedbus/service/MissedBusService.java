package com.gocomet.bustracking.missedbus.service;

import com.gocomet.bustracking.broadcast.RealtimeBroadcaster;
import com.gocomet.bustracking.broadcast.RealtimeChannels;
import com.gocomet.bustracking.broadcast.RealtimeEvents;
import com.gocomet.bustracking.bus.service.BusAssignmentService;
import com.gocomet.bustracking.common.config.MissedBusProperties;
import com.gocomet.bustracking.common.event.CoordinationEvent;
import com.gocomet.bustracking.common.event.CoordinationEvent.EventType;
import com.gocomet.bustracking.common.exception.NotOwnerException;
import com.gocomet.bustracking.common.exception.ResourceNotFoundException;
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
import com.gocomet.bustracking.missedbus.repository.MissedBusRequestRepository;
import com.gocomet.bustracking.notification.dto.RiderNotification;
import com.gocomet.bustracking.notification.service.NotificationDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Missed-bus pickup requests: pending → approved | rejected | expired | cancelled.
 *
 * Raise runs its checks in a fixed order and stops at the first that applies:
 * maintenance, idempotent replay, already-active, rate limit, create-and-match.
 * Store or cache failures inside raise are reported as maintenance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MissedBusService {

    private final MissedBusRequestRepository requestRepository;
    private final CandidateMatcher candidateMatcher;
    private final FeatureSwitchService featureSwitchService;
    private final RequestRateLimiter rateLimiter;
    private final BusAssignmentService busAssignmentService;
    private final RealtimeBroadcaster broadcaster;
    private final CoordinationEventProducer eventProducer;
    private final NotificationDispatcher notificationDispatcher;
    private final MissedBusProperties properties;
    private final Clock clock;

    public RaiseMissedBusResponse raise(String studentId, RaiseMissedBusRequest request) {
        if (featureSwitchService.isMissedBusInMaintenance()) {
            log.info("Missed-bus raise by {} refused: maintenance", studentId);
            return RaiseMissedBusResponse.maintenance();
        }

        try {
            Optional<MissedBusRequest> replay = requestRepository
                    .findByStudentIdAndOperationId(studentId, request.getOperationId());
            if (replay.isPresent()) {
                log.info("Replayed missed-bus operation {} for {}", request.getOperationId(), studentId);
                return RaiseMissedBusResponse.created(replay.get(), true);
            }

            Instant now = clock.instant();
            List<MissedBusRequest> active = requestRepository.findActive(studentId, now);
            if (!active.isEmpty()) {
                return RaiseMissedBusResponse.duplicate(active.get(0));
            }

            if (!rateLimiter.tryAcquire("missed-bus:" + studentId, properties.getRateLimitMax(),
                    properties.getRateLimitWindow())) {
                return RaiseMissedBusResponse.rateLimited();
            }

            MissedBusRequest created = MissedBusRequest.builder()
                    .operationId(request.getOperationId())
                    .studentId(studentId)
                    .routeId(request.getRouteId())
                    .stopId(request.getStopId())
                    .assignedBusId(request.getAssignedBusId())
                    .assignedTripId(request.getAssignedTripId())
                    .status(MissedBusStatus.PENDING)
                    .createdAt(now)
                    .expiresAt(now.plus(properties.getRequestTtl()))
                    .resolutionMessage(MissedBusMessages.SEARCHING)
                    .pendingKey(studentId)
                    .lastMatchAttemptAt(now)
                    .build();
            try {
                created = requestRepository.saveAndFlush(created);
            } catch (DataIntegrityViolationException e) {
                return resolveInsertConflict(studentId, request.getOperationId());
            }

            log.info("Missed-bus request {} created for {} at stop {}", created.getId(), studentId, created.getStopId());
            eventProducer.publish(CoordinationEvent.of(EventType.MISSED_BUS_REQUESTED, created.getId().toString(),
                    studentId, created.getAssignedBusId(), studentId, now, created.getStopId()));

            MissedBusRequest outcome = created;
            try {
                outcome = attemptMatch(created);
            } catch (DataAccessException e) {
                log.warn("Initial match for request {} failed, sweep will retry: {}", created.getId(), e.getMessage());
            }
            return RaiseMissedBusResponse.created(outcome, false);
        } catch (DataAccessException e) {
            log.error("Missed-bus raise for {} failed on infrastructure, reporting maintenance", studentId, e);
            return RaiseMissedBusResponse.maintenance();
        }
    }

    /**
     * Sweep hook: retry matching for a request still pending.
     */
    public void retryMatch(UUID requestId) {
        MissedBusRequest request = getRequest(requestId);
        if (request.getStatus() != MissedBusStatus.PENDING || !request.getExpiresAt().isAfter(clock.instant())) {
            return;
        }
        attemptMatch(request);
    }

    /**
     * Rider cancel. Only a pending request changes; any other request, including one
     * the matcher approved first, is returned unchanged.
     */
    public MissedBusRequestResponse cancel(UUID requestId, String studentId) {
        MissedBusRequest request = getRequest(requestId);
        if (!request.getStudentId().equals(studentId)) {
            throw new NotOwnerException("MissedBusRequest", requestId);
        }

        if (request.getStatus() == MissedBusStatus.PENDING) {
            Instant now = clock.instant();
            if (requestRepository.resolvePending(requestId, MissedBusStatus.CANCELLED,
                    MissedBusMessages.REQUEST_CANCELLED, now) == 1) {
                request.setStatus(MissedBusStatus.CANCELLED);
                request.setResolutionMessage(MissedBusMessages.REQUEST_CANCELLED);
                request.setResolvedAt(now);
                request.setPendingKey(null);
                log.info("Missed-bus request {} cancelled by {}", requestId, studentId);
                eventProducer.publish(CoordinationEvent.of(EventType.MISSED_BUS_CANCELLED, requestId.toString(),
                        studentId, request.getAssignedBusId(), studentId, now, null));
                return MissedBusRequestResponse.from(request);
            }
            request = getRequest(requestId);
        }

        log.debug("Cancel of missed-bus request {} ignored, already {}", requestId, request.getStatus());
        return MissedBusRequestResponse.from(request);
    }

    /**
     * Sweep transition. Returns true only for the call that actually expired the request.
     */
    public boolean expire(UUID requestId) {
        Instant now = clock.instant();
        if (requestRepository.expire(requestId, MissedBusMessages.REQUEST_EXPIRED, now) == 0) {
            return false;
        }
        MissedBusRequest request = getRequest(requestId);
        log.info("Missed-bus request {} expired", requestId);
        notifyStudent(request, RealtimeEvents.MISSED_BUS_EXPIRED, "Pickup request expired", now);
        eventProducer.publish(CoordinationEvent.of(EventType.MISSED_BUS_EXPIRED, requestId.toString(),
                request.getStudentId(), request.getAssignedBusId(), null, now, null));
        return true;
    }

    /**
     * Sweep transition for approved requests whose pickup window has closed: the seat
     * reserved on the candidate bus goes back. Returns true only for the call that
     * released it.
     */
    @Transactional
    public boolean closePickupWindow(UUID requestId) {
        Instant now = clock.instant();
        if (requestRepository.releaseHeldSeat(requestId, now) == 0) {
            return false;
        }
        MissedBusRequest request = getRequest(requestId);
        candidateMatcher.returnSeat(request.getCandidateBusId());
        log.info("Pickup window closed for request {}, seat on bus {} released", requestId,
                request.getCandidateBusId());
        eventProducer.publish(CoordinationEvent.of(EventType.MISSED_BUS_PICKUP_CLOSED, requestId.toString(),
                request.getStudentId(), request.getCandidateBusId(), null, now, null));
        return true;
    }

    public Optional<MissedBusRequestResponse> getActiveRequest(String studentId) {
        return requestRepository.findActive(studentId, clock.instant()).stream()
                .findFirst()
                .map(MissedBusRequestResponse::from);
    }

    public List<MissedBusRequestResponse> getPickupsForBus(String busId, String driverId) {
        busAssignmentService.requireAssignedDriver(busId, driverId);
        return requestRepository.findByCandidateBusIdAndStatusAndExpiresAtAfterOrderByCreatedAtAsc(
                        busId, MissedBusStatus.APPROVED, clock.instant()).stream()
                .map(MissedBusRequestResponse::from)
                .toList();
    }

    private MissedBusRequest attemptMatch(MissedBusRequest request) {
        Optional<MatchCandidate> match = candidateMatcher.findAndReserve(request);
        Instant now = clock.instant();

        if (match.isPresent()) {
            MatchCandidate candidate = match.get();
            String message = MissedBusMessages.requestAccepted(candidate.getBusId(), candidate.getStopName());
            int approved;
            try {
                approved = requestRepository.approve(request.getId(), candidate.getBusId(), candidate.getTripId(),
                        message, now);
            } catch (RuntimeException e) {
                candidateMatcher.releaseSeat(candidate.getBusId());
                throw e;
            }
            if (approved == 0) {
                // Cancelled or expired while we were matching
                candidateMatcher.releaseSeat(candidate.getBusId());
                return getRequest(request.getId());
            }
            request.setStatus(MissedBusStatus.APPROVED);
            request.setCandidateBusId(candidate.getBusId());
            request.setCandidateTripId(candidate.getTripId());
            request.setResolutionMessage(message);
            request.setResolvedAt(now);
            request.setPendingKey(null);
            request.setSeatHeld(true);

            log.info("Missed-bus request {} approved on bus {}", request.getId(), candidate.getBusId());
            notifyStudent(request, RealtimeEvents.MISSED_BUS_APPROVED, "Pickup arranged", now);
            broadcaster.publish(RealtimeChannels.driverWaitRequest(candidate.getBusId()),
                    RealtimeEvents.MISSED_BUS_PICKUP, resultEvent(request));
            eventProducer.publish(CoordinationEvent.of(EventType.MISSED_BUS_APPROVED, request.getId().toString(),
                    request.getStudentId(), candidate.getBusId(), null, now, candidate.getTripId()));
            return request;
        }

        if (properties.getNoCandidatePolicy() == NoCandidatePolicy.REJECT) {
            if (requestRepository.resolvePending(request.getId(), MissedBusStatus.REJECTED,
                    MissedBusMessages.NO_CANDIDATES, now) == 0) {
                return getRequest(request.getId());
            }
            request.setStatus(MissedBusStatus.REJECTED);
            request.setResolutionMessage(MissedBusMessages.NO_CANDIDATES);
            request.setResolvedAt(now);
            request.setPendingKey(null);

            log.info("Missed-bus request {} rejected: no candidate bus", request.getId());
            notifyStudent(request, RealtimeEvents.MISSED_BUS_REJECTED, "No bus available", now);
            eventProducer.publish(CoordinationEvent.of(EventType.MISSED_BUS_REJECTED, request.getId().toString(),
                    request.getStudentId(), request.getAssignedBusId(), null, now, null));
            return request;
        }

        log.debug("Missed-bus request {} stays pending until a candidate appears", request.getId());
        return request;
    }

    private RaiseMissedBusResponse resolveInsertConflict(String studentId, String operationId) {
        Optional<MissedBusRequest> replay = requestRepository.findByStudentIdAndOperationId(studentId, operationId);
        if (replay.isPresent()) {
            return RaiseMissedBusResponse.created(replay.get(), true);
        }
        List<MissedBusRequest> active = requestRepository.findActive(studentId, clock.instant());
        return RaiseMissedBusResponse.duplicate(active.isEmpty() ? null : active.get(0));
    }

    private void notifyStudent(MissedBusRequest request, String event, String title, Instant now) {
        broadcaster.publish(RealtimeChannels.student(request.getStudentId()), event, resultEvent(request));
        notificationDispatcher.enqueue(RiderNotification.builder()
                .recipientId(request.getStudentId())
                .type(event)
                .title(title)
                .body(request.getResolutionMessage())
                .data(Map.of("requestId", request.getId().toString(), "status", request.getStatus().name()))
                .createdAt(now)
                .build());
    }

    private MissedBusResultEvent resultEvent(MissedBusRequest request) {
        return MissedBusResultEvent.builder()
                .requestId(request.getId())
                .studentId(request.getStudentId())
                .status(request.getStatus())
                .candidateBusId(request.getCandidateBusId())
                .candidateTripId(request.getCandidateTripId())
                .stopId(request.getStopId())
                .message(request.getResolutionMessage())
                .build();
    }

    private MissedBusRequest getRequest(UUID requestId) {
        return requestRepository.findById(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("MissedBusRequest", "id", requestId));
    }
}
