package com.gocomet.bustracking.missedbus.service;

import com.gocomet.bustracking.bus.model.Bus;
import com.gocomet.bustracking.bus.model.BusStatus;
import com.gocomet.bustracking.bus.model.RouteStop;
import com.gocomet.bustracking.bus.repository.BusRepository;
import com.gocomet.bustracking.bus.repository.RouteRepository;
import com.gocomet.bustracking.bus.service.BusGeoIndexService;
import com.gocomet.bustracking.common.config.MissedBusProperties;
import com.gocomet.bustracking.common.geo.GeoUtils;
import com.gocomet.bustracking.location.model.BusLocation;
import com.gocomet.bustracking.location.repository.BusLocationRepository;
import com.gocomet.bustracking.missedbus.model.MissedBusRequest;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Finds an alternate bus for a missed-bus request and reserves a seat on it.
 *
 * 1. Buses on the request's route that are ACTIVE/ENROUTE, not the missed bus,
 *    with spare capacity and a recent position, nearest to the stop first
 * 2. If none, live buses near the stop from the GEO index
 * 3. Reserve a seat on the first candidate that still has one
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CandidateMatcher {

    static final List<BusStatus> ELIGIBLE_STATUSES = List.of(BusStatus.ACTIVE, BusStatus.ENROUTE);

    private final BusRepository busRepository;
    private final RouteRepository routeRepository;
    private final BusLocationRepository busLocationRepository;
    private final BusGeoIndexService geoIndexService;
    private final MissedBusProperties properties;
    private final Clock clock;

    public Optional<MatchCandidate> findAndReserve(MissedBusRequest request) {
        Optional<RouteStop> stop = routeRepository.findById(request.getRouteId())
                .flatMap(route -> route.findStop(request.getStopId()));
        String stopName = stop.map(RouteStop::getName).orElse(request.getStopId());

        List<RankedBus> candidates = sameRouteCandidates(request, stop.orElse(null));
        if (candidates.isEmpty() && stop.isPresent() && stop.get().hasLocation()) {
            candidates = nearbyCandidates(request, stop.get());
        }
        if (candidates.isEmpty()) {
            log.info("No candidate buses for missed-bus request {} on route {}", request.getId(), request.getRouteId());
            return Optional.empty();
        }

        for (RankedBus candidate : candidates) {
            Bus bus = candidate.getBus();
            if (busRepository.reserveSeat(bus.getId()) == 1) {
                log.info("Reserved a seat on bus {} for request {}", bus.getId(), request.getId());
                return Optional.of(new MatchCandidate(bus.getId(), bus.getActiveTripId(), stopName,
                        candidate.getDistanceMeters()));
            }
            log.debug("Bus {} filled up before a seat could be reserved", bus.getId());
        }
        return Optional.empty();
    }

    /**
     * Gives back a seat reserved by {@link #findAndReserve} when the request could
     * not be approved after all.
     */
    public void releaseSeat(String busId) {
        try {
            returnSeat(busId);
        } catch (RuntimeException e) {
            log.error("Failed to release reserved seat on bus {}", busId, e);
        }
    }

    /**
     * Gives back one reserved seat. Store failures propagate to the caller's transaction.
     */
    public void returnSeat(String busId) {
        if (busRepository.releaseSeat(busId) == 0) {
            log.warn("Bus {} had no reserved seat to release", busId);
        }
    }

    private List<RankedBus> sameRouteCandidates(MissedBusRequest request, RouteStop stop) {
        List<Bus> buses = busRepository.findByRouteIdAndStatusIn(request.getRouteId(), ELIGIBLE_STATUSES).stream()
                .filter(bus -> isEligible(bus, request))
                .toList();
        if (buses.isEmpty()) {
            return List.of();
        }

        Instant freshSince = clock.instant().minus(properties.getLocationStaleness());
        Map<String, BusLocation> positions = busLocationRepository
                .findByBusIdInAndCapturedAtAfter(buses.stream().map(Bus::getId).toList(), freshSince)
                .stream()
                .collect(Collectors.toMap(BusLocation::getBusId, Function.identity()));

        List<RankedBus> ranked = new ArrayList<>();
        for (Bus bus : buses) {
            BusLocation position = positions.get(bus.getId());
            if (position == null) {
                log.debug("Skipping bus {}: no position in the last {}", bus.getId(), properties.getLocationStaleness());
                continue;
            }
            Double distance = stop != null && stop.hasLocation()
                    ? GeoUtils.distanceMeters(position.getLatitude(), position.getLongitude(),
                    stop.getLatitude(), stop.getLongitude())
                    : null;
            ranked.add(new RankedBus(bus, distance));
        }
        ranked.sort(Comparator.comparing(RankedBus::getDistanceMeters,
                Comparator.nullsLast(Comparator.<Double>naturalOrder())));
        return ranked;
    }

    private List<RankedBus> nearbyCandidates(MissedBusRequest request, RouteStop stop) {
        List<String> nearbyIds;
        try {
            nearbyIds = geoIndexService.findNearbyBuses(stop.getLatitude(), stop.getLongitude(),
                    properties.getNearbyRadiusKm());
        } catch (RuntimeException e) {
            log.warn("Nearby bus lookup failed for request {}: {}", request.getId(), e.getMessage());
            return List.of();
        }
        if (nearbyIds.isEmpty()) {
            return List.of();
        }

        Map<String, Bus> buses = busRepository.findByIdInAndStatusIn(nearbyIds, ELIGIBLE_STATUSES).stream()
                .collect(Collectors.toMap(Bus::getId, Function.identity()));
        List<RankedBus> ranked = new ArrayList<>();
        // nearbyIds is already nearest-first
        for (String busId : nearbyIds) {
            Bus bus = buses.get(busId);
            if (bus != null && isEligible(bus, request)) {
                ranked.add(new RankedBus(bus, null));
            }
        }
        return ranked;
    }

    private boolean isEligible(Bus bus, MissedBusRequest request) {
        return !bus.getId().equals(request.getAssignedBusId()) && bus.hasSpareCapacity();
    }

    @Getter
    @AllArgsConstructor
    private static class RankedBus {
        private final Bus bus;
        private final Double distanceMeters;
    }
}
