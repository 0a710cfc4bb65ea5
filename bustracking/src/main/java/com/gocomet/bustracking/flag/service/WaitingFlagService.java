package com.gocomet.bustracking.flag.service;

import com.gocomet.bustracking.broadcast.RealtimeBroadcaster;
import com.gocomet.bustracking.broadcast.RealtimeChannels;
import com.gocomet.bustracking.broadcast.RealtimeEvents;
import com.gocomet.bustracking.bus.model.Bus;
import com.gocomet.bustracking.bus.service.BusAssignmentService;
import com.gocomet.bustracking.common.config.RealtimeProperties;
import com.gocomet.bustracking.common.event.CoordinationEvent;
import com.gocomet.bustracking.common.event.CoordinationEvent.EventType;
import com.gocomet.bustracking.common.exception.DuplicateRequestException;
import com.gocomet.bustracking.common.exception.InvalidStateTransitionException;
import com.gocomet.bustracking.common.exception.LocationUnavailableException;
import com.gocomet.bustracking.common.exception.NotOwnerException;
import com.gocomet.bustracking.common.exception.ResourceNotFoundException;
import com.gocomet.bustracking.common.exception.RouteMissingException;
import com.gocomet.bustracking.common.exception.ThrottledException;
import com.gocomet.bustracking.common.geo.GeoUtils;
import com.gocomet.bustracking.common.ratelimit.RequestRateLimiter;
import com.gocomet.bustracking.event.CoordinationEventProducer;
import com.gocomet.bustracking.flag.dto.FlagAcknowledgedEvent;
import com.gocomet.bustracking.flag.dto.FlagLocationUpdateResponse;
import com.gocomet.bustracking.flag.dto.FlagRemovedEvent;
import com.gocomet.bustracking.flag.dto.RaiseFlagRequest;
import com.gocomet.bustracking.flag.dto.WaitingFlagResponse;
import com.gocomet.bustracking.flag.model.FlagStatus;
import com.gocomet.bustracking.flag.model.WaitingFlag;
import com.gocomet.bustracking.flag.repository.WaitingFlagRepository;
import com.gocomet.bustracking.notification.dto.RiderNotification;
import com.gocomet.bustracking.notification.service.NotificationDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Waiting-flag lifecycle: raised → acknowledged → boarded, with cancel while active
 * and expiry by the sweep. Every status change is a conditional UPDATE, so when the
 * rider, the driver and the sweep race on one flag the first terminal transition
 * wins and the others see zero rows changed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WaitingFlagService {

    static final String REASON_BOARDED = "boarded";
    static final String REASON_CANCELLED = "cancelled";
    static final String REASON_EXPIRED = "expired";

    private final WaitingFlagRepository flagRepository;
    private final BusAssignmentService busAssignmentService;
    private final RequestRateLimiter rateLimiter;
    private final RealtimeBroadcaster broadcaster;
    private final CoordinationEventProducer eventProducer;
    private final NotificationDispatcher notificationDispatcher;
    private final RealtimeProperties properties;
    private final Clock clock;

    public WaitingFlagResponse raise(String studentId, String studentName, RaiseFlagRequest request) {
        if (request.getLatitude() == null || request.getLongitude() == null
                || !GeoUtils.isValidCoordinate(request.getLatitude(), request.getLongitude())) {
            throw new LocationUnavailableException("A current location is required to raise a waiting flag");
        }

        Bus bus = busAssignmentService.getBus(request.getBusId());
        String routeId = request.getRouteId() != null ? request.getRouteId() : bus.getRouteId();
        if (routeId == null) {
            throw new RouteMissingException(bus.getId());
        }

        flagRepository.findFirstByStudentIdAndBusIdAndStatusIn(studentId, bus.getId(), FlagStatus.ACTIVE)
                .ifPresent(existing -> {
                    throw new DuplicateRequestException("You already have an active waiting flag for this bus",
                            existing.getId().toString());
                });

        // Only attempts that could create a flag count against the limit
        RealtimeProperties.WaitingFlag config = properties.getWaitingFlag();
        if (!rateLimiter.tryAcquire("flag-raise:" + studentId, config.getRaiseLimit(), config.getRaiseWindow())) {
            throw new ThrottledException("Too many waiting flags raised. Please wait a moment.");
        }

        Instant now = clock.instant();
        WaitingFlag flag = WaitingFlag.builder()
                .studentId(studentId)
                .studentName(studentName)
                .busId(bus.getId())
                .routeId(routeId)
                .stopId(request.getStopId())
                .stopName(request.getStopName())
                .latitude(request.getLatitude())
                .longitude(request.getLongitude())
                .status(FlagStatus.RAISED)
                .createdAt(now)
                .expiresAt(now.plus(config.getTtl()))
                .locationUpdatedAt(now)
                .activeKey(WaitingFlag.activeKey(studentId, bus.getId()))
                .build();

        try {
            flag = flagRepository.saveAndFlush(flag);
        } catch (DataIntegrityViolationException e) {
            // Lost a race with a concurrent raise for the same (student, bus)
            String existingId = flagRepository
                    .findFirstByStudentIdAndBusIdAndStatusIn(studentId, bus.getId(), FlagStatus.ACTIVE)
                    .map(existing -> existing.getId().toString())
                    .orElse(null);
            throw new DuplicateRequestException("You already have an active waiting flag for this bus", existingId);
        }

        log.info("Waiting flag {} raised by {} for bus {} at {}", flag.getId(), studentId, bus.getId(),
                flag.getStopName());
        WaitingFlagResponse response = WaitingFlagResponse.from(flag);
        broadcaster.publish(RealtimeChannels.waitingFlags(bus.getId()), RealtimeEvents.WAITING_FLAG_CREATED, response);
        eventProducer.publish(CoordinationEvent.of(EventType.FLAG_RAISED, flag.getId().toString(), studentId,
                bus.getId(), studentId, now, flag.getStopName()));
        return response;
    }

    public FlagLocationUpdateResponse updateLocation(UUID flagId, String studentId, double lat, double lng) {
        if (!GeoUtils.isValidCoordinate(lat, lng)) {
            throw new LocationUnavailableException("Latitude/longitude out of range");
        }
        WaitingFlag flag = getFlag(flagId);
        requireOwner(flag, studentId);
        if (flag.getStatus().isTerminal()) {
            throw new InvalidStateTransitionException("WaitingFlag", flag.getStatus().name(), "location update");
        }

        double moved = GeoUtils.distanceMeters(flag.getLatitude(), flag.getLongitude(), lat, lng);
        if (moved < properties.getWaitingFlag().getUpdateDistanceMeters()) {
            log.debug("Suppressed flag {} update: moved {} m", flagId, Math.round(moved));
            return new FlagLocationUpdateResponse(false, moved, WaitingFlagResponse.from(flag));
        }

        Instant now = clock.instant();
        if (flagRepository.updateLocation(flagId, lat, lng, FlagStatus.ACTIVE, now) == 0) {
            WaitingFlag current = getFlag(flagId);
            throw new InvalidStateTransitionException("WaitingFlag", current.getStatus().name(), "location update");
        }
        flag.setLatitude(lat);
        flag.setLongitude(lng);
        flag.setLocationUpdatedAt(now);

        WaitingFlagResponse response = WaitingFlagResponse.from(flag);
        broadcaster.publish(RealtimeChannels.waitingFlags(flag.getBusId()), RealtimeEvents.WAITING_FLAG_UPDATED,
                response);
        return new FlagLocationUpdateResponse(true, moved, response);
    }

    public WaitingFlagResponse acknowledge(UUID flagId, String driverId) {
        WaitingFlag flag = getFlag(flagId);
        busAssignmentService.requireAssignedDriver(flag.getBusId(), driverId);

        Instant now = clock.instant();
        if (flagRepository.acknowledge(flagId, driverId, now) == 0) {
            WaitingFlag current = getFlag(flagId);
            throw new InvalidStateTransitionException("WaitingFlag", current.getStatus().name(),
                    FlagStatus.ACKNOWLEDGED.name());
        }
        flag.setStatus(FlagStatus.ACKNOWLEDGED);
        flag.setAcknowledgedByDriverId(driverId);
        flag.setAcknowledgedAt(now);

        log.info("Waiting flag {} acknowledged by driver {}", flagId, driverId);
        broadcaster.publish(RealtimeChannels.student(flag.getStudentId()), RealtimeEvents.FLAG_ACKNOWLEDGED,
                new FlagAcknowledgedEvent(flagId, driverId, flag.getBusId(), now));
        eventProducer.publish(CoordinationEvent.of(EventType.FLAG_ACKNOWLEDGED, flagId.toString(),
                flag.getStudentId(), flag.getBusId(), driverId, now, null));
        notificationDispatcher.enqueue(RiderNotification.builder()
                .recipientId(flag.getStudentId())
                .type(RealtimeEvents.FLAG_ACKNOWLEDGED)
                .title("Driver has seen you")
                .body("Bus " + flag.getBusId() + " acknowledged your waiting flag.")
                .data(Map.of("flagId", flagId.toString(), "busId", flag.getBusId()))
                .createdAt(now)
                .build());
        return WaitingFlagResponse.from(flag);
    }

    /**
     * Driver confirms the rider got on. The flag must belong to the given rider and bus.
     */
    public WaitingFlagResponse markBoarded(UUID flagId, String studentId, String busId, String driverId) {
        WaitingFlag flag = getFlag(flagId);
        if (!flag.getStudentId().equals(studentId) || !flag.getBusId().equals(busId)) {
            throw new ResourceNotFoundException("WaitingFlag", "id", flagId);
        }
        busAssignmentService.requireAssignedDriver(busId, driverId);

        Instant now = clock.instant();
        if (flagRepository.close(flagId, FlagStatus.ACTIVE, FlagStatus.BOARDED, now) == 0) {
            WaitingFlag current = getFlag(flagId);
            throw new InvalidStateTransitionException("WaitingFlag", current.getStatus().name(),
                    FlagStatus.BOARDED.name());
        }
        flag.setStatus(FlagStatus.BOARDED);
        flag.setActiveKey(null);
        flag.setClosedAt(now);

        log.info("Waiting flag {} boarded on bus {}", flagId, busId);
        publishRemoved(flag, REASON_BOARDED);
        eventProducer.publish(CoordinationEvent.of(EventType.FLAG_BOARDED, flagId.toString(), studentId,
                busId, driverId, now, null));
        return WaitingFlagResponse.from(flag);
    }

    /**
     * Rider cancel. A flag that already reached a terminal state is returned unchanged.
     */
    public WaitingFlagResponse cancel(UUID flagId, String studentId) {
        WaitingFlag flag = getFlag(flagId);
        requireOwner(flag, studentId);
        if (flag.getStatus().isTerminal()) {
            log.debug("Cancel of flag {} ignored, already {}", flagId, flag.getStatus());
            return WaitingFlagResponse.from(flag);
        }

        Instant now = clock.instant();
        if (flagRepository.close(flagId, FlagStatus.ACTIVE, FlagStatus.CANCELLED, now) == 0) {
            WaitingFlag current = getFlag(flagId);
            log.debug("Cancel of flag {} lost the race, now {}", flagId, current.getStatus());
            return WaitingFlagResponse.from(current);
        }
        flag.setStatus(FlagStatus.CANCELLED);
        flag.setActiveKey(null);
        flag.setClosedAt(now);

        log.info("Waiting flag {} cancelled by {}", flagId, studentId);
        publishRemoved(flag, REASON_CANCELLED);
        eventProducer.publish(CoordinationEvent.of(EventType.FLAG_CANCELLED, flagId.toString(), studentId,
                flag.getBusId(), studentId, now, null));
        return WaitingFlagResponse.from(flag);
    }

    /**
     * Sweep transition. Returns true only for the call that actually expired the flag,
     * so the rider and driver are told once.
     */
    public boolean expire(UUID flagId) {
        Instant now = clock.instant();
        if (flagRepository.expire(flagId, FlagStatus.ACTIVE, now) == 0) {
            return false;
        }
        WaitingFlag flag = getFlag(flagId);
        log.info("Waiting flag {} expired", flagId);

        publishRemoved(flag, REASON_EXPIRED);
        broadcaster.publish(RealtimeChannels.student(flag.getStudentId()), RealtimeEvents.FLAG_EXPIRED,
                new FlagRemovedEvent(flagId, flag.getStudentId(), flag.getBusId(), REASON_EXPIRED));
        eventProducer.publish(CoordinationEvent.of(EventType.FLAG_EXPIRED, flagId.toString(),
                flag.getStudentId(), flag.getBusId(), null, now, null));
        notificationDispatcher.enqueue(RiderNotification.builder()
                .recipientId(flag.getStudentId())
                .type(RealtimeEvents.FLAG_EXPIRED)
                .title("Waiting flag expired")
                .body("Your waiting flag for bus " + flag.getBusId() + " has expired.")
                .data(Map.of("flagId", flagId.toString(), "busId", flag.getBusId()))
                .createdAt(now)
                .build());
        return true;
    }

    public List<WaitingFlagResponse> getActiveFlagsForBus(String busId, String driverId) {
        busAssignmentService.requireAssignedDriver(busId, driverId);
        return flagRepository.findByBusIdAndStatusInOrderByCreatedAtAsc(busId, FlagStatus.ACTIVE).stream()
                .map(WaitingFlagResponse::from)
                .toList();
    }

    private WaitingFlag getFlag(UUID flagId) {
        return flagRepository.findById(flagId)
                .orElseThrow(() -> new ResourceNotFoundException("WaitingFlag", "id", flagId));
    }

    private void requireOwner(WaitingFlag flag, String studentId) {
        if (!flag.getStudentId().equals(studentId)) {
            throw new NotOwnerException("WaitingFlag", flag.getId());
        }
    }

    private void publishRemoved(WaitingFlag flag, String reason) {
        broadcaster.publish(RealtimeChannels.waitingFlags(flag.getBusId()), RealtimeEvents.WAITING_FLAG_REMOVED,
                new FlagRemovedEvent(flag.getId(), flag.getStudentId(), flag.getBusId(), reason));
    }
}
