package com.gocomet.bustracking.location.dto;

import com.gocomet.bustracking.location.model.BusLocation;
import lombok.*;

import java.time.Instant;

/**
 * Payload of {@code location_update} on {@code route_<routeId>}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LocationUpdateEvent {

    private String busId;
    private String routeId;
    private String driverId;
    private double lat;
    private double lng;
    private Double speed;
    private Double heading;
    private Instant capturedAt;

    public static LocationUpdateEvent from(BusLocation location) {
        return LocationUpdateEvent.builder()
                .busId(location.getBusId())
                .routeId(location.getRouteId())
                .driverId(location.getDriverId())
                .lat(location.getLatitude())
                .lng(location.getLongitude())
                .speed(location.getSpeedMetersPerSecond())
                .heading(location.getHeadingDegrees())
                .capturedAt(location.getCapturedAt())
                .build();
    }
}
