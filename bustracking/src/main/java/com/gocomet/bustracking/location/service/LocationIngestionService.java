package com.gocomet.bustracking.location.service;

import com.gocomet.bustracking.broadcast.RealtimeBroadcaster;
import com.gocomet.bustracking.broadcast.RealtimeChannels;
import com.gocomet.bustracking.broadcast.RealtimeEvents;
import com.gocomet.bustracking.bus.model.Bus;
import com.gocomet.bustracking.bus.service.BusAssignmentService;
import com.gocomet.bustracking.bus.service.BusGeoIndexService;
import com.gocomet.bustracking.common.config.RealtimeProperties;
import com.gocomet.bustracking.common.exception.LocationRejectedException;
import com.gocomet.bustracking.common.exception.ResourceNotFoundException;
import com.gocomet.bustracking.common.exception.RouteMissingException;
import com.gocomet.bustracking.common.exception.ThrottledException;
import com.gocomet.bustracking.common.geo.GeoUtils;
import com.gocomet.bustracking.location.dto.LocationAck;
import com.gocomet.bustracking.location.dto.LocationReportRequest;
import com.gocomet.bustracking.location.dto.LocationUpdateEvent;
import com.gocomet.bustracking.location.guard.AntiSpoofGuard;
import com.gocomet.bustracking.location.guard.GuardResult;
import com.gocomet.bustracking.location.model.BusLocation;
import com.gocomet.bustracking.location.model.BusLocationHistory;
import com.gocomet.bustracking.location.repository.BusLocationHistoryRepository;
import com.gocomet.bustracking.location.repository.BusLocationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Driver position intake.
 * 1. Validate coordinates, accuracy, device speed and heading
 * 2. Check the driver is assigned to the bus and the bus has a route
 * 3. Run the anti-spoof guard
 * 4. Upsert the current position (failure propagates)
 * 5. Append history and refresh the live index (best-effort)
 * 6. Publish location_update on the route channel (best-effort)
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocationIngestionService {

    private final BusAssignmentService busAssignmentService;
    private final AntiSpoofGuard antiSpoofGuard;
    private final BusLocationRepository busLocationRepository;
    private final BusLocationHistoryRepository historyRepository;
    private final BusGeoIndexService geoIndexService;
    private final RealtimeBroadcaster broadcaster;
    private final RealtimeProperties properties;
    private final Clock clock;

    public LocationAck reportLocation(String driverId, String busId, LocationReportRequest request) {
        validate(request);

        Bus bus = busAssignmentService.requireAssignedDriver(busId, driverId);
        if (bus.getRouteId() == null || bus.getRouteId().isBlank()) {
            throw new RouteMissingException(busId);
        }
        String routeId = bus.getRouteId();
        if (request.getRouteId() != null && !request.getRouteId().equals(routeId)) {
            log.warn("Driver {} reported route {} for bus {} but the bus is on route {}",
                    driverId, request.getRouteId(), busId, routeId);
        }

        Instant capturedAt = clock.instant();
        GuardResult verdict = antiSpoofGuard.validate(busId, request.getLatitude(), request.getLongitude(),
                capturedAt.toEpochMilli());
        if (verdict.isThrottled()) {
            throw new ThrottledException("Location updates for bus " + busId + " are arriving too fast");
        }
        if (!verdict.isCommitted()) {
            throw new LocationRejectedException(String.format(
                    "Implied speed %.0f km/h is not plausible", verdict.getImpliedSpeedKmh()));
        }

        BusLocation current = BusLocation.builder()
                .busId(busId)
                .driverId(driverId)
                .routeId(routeId)
                .latitude(request.getLatitude())
                .longitude(request.getLongitude())
                .speedMetersPerSecond(request.getSpeedMetersPerSecond())
                .headingDegrees(request.getHeadingDegrees())
                .accuracyMeters(request.getAccuracyMeters())
                .capturedAt(capturedAt)
                .build();
        busLocationRepository.save(current);

        appendHistory(current);
        refreshGeoIndex(current);

        broadcaster.publish(RealtimeChannels.route(routeId), RealtimeEvents.LOCATION_UPDATE,
                LocationUpdateEvent.from(current));

        log.debug("Accepted location for bus {} on route {}: ({}, {})",
                busId, routeId, current.getLatitude(), current.getLongitude());
        return LocationAck.from(current, verdict.isOverspeed());
    }

    public LocationAck getCurrentLocation(String busId) {
        BusLocation current = busLocationRepository.findById(busId)
                .orElseThrow(() -> new ResourceNotFoundException("BusLocation", "busId", busId));
        return LocationAck.from(current, false);
    }

    private void validate(LocationReportRequest request) {
        if (request.getLatitude() == null || request.getLongitude() == null
                || !GeoUtils.isValidCoordinate(request.getLatitude(), request.getLongitude())) {
            throw new LocationRejectedException("Latitude/longitude missing or out of range");
        }
        if (request.getAccuracyMeters() != null
                && (!Double.isFinite(request.getAccuracyMeters()) || request.getAccuracyMeters() < 0)) {
            throw new LocationRejectedException("Accuracy must be a non-negative number");
        }
        Double speed = request.getSpeedMetersPerSecond();
        if (speed != null) {
            if (!Double.isFinite(speed) || speed < 0) {
                throw new LocationRejectedException("Speed must be a non-negative number");
            }
            double speedKmh = speed * 3.6;
            if (speedKmh > properties.getAntiSpoof().getMaxSpeedKmh()) {
                throw new LocationRejectedException(String.format(
                        "Reported speed %.0f km/h is not plausible", speedKmh));
            }
        }
        Double heading = request.getHeadingDegrees();
        if (heading != null && (!Double.isFinite(heading) || heading < 0 || heading >= 360)) {
            throw new LocationRejectedException("Heading must be in [0, 360) degrees");
        }
    }

    private void appendHistory(BusLocation current) {
        try {
            historyRepository.save(BusLocationHistory.from(current));
        } catch (RuntimeException e) {
            log.warn("History write failed for bus {}: {}", current.getBusId(), e.getMessage());
        }
    }

    private void refreshGeoIndex(BusLocation current) {
        try {
            geoIndexService.updateBusLocation(current.getBusId(), current.getRouteId(),
                    current.getLatitude(), current.getLongitude());
        } catch (RuntimeException e) {
            log.warn("Live index update failed for bus {}: {}", current.getBusId(), e.getMessage());
        }
    }
}
