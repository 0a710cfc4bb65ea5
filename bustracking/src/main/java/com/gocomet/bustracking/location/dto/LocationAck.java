package com.gocomet.bustracking.location.dto;

import com.gocomet.bustracking.location.model.BusLocation;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LocationAck {

    private String busId;
    private String routeId;
    private String driverId;
    private Double latitude;
    private Double longitude;
    private Double speedMetersPerSecond;
    private Double headingDegrees;
    private Double accuracyMeters;
    private Instant capturedAt;
    private boolean overspeedWarning;

    public static LocationAck from(BusLocation location, boolean overspeedWarning) {
        return LocationAck.builder()
                .busId(location.getBusId())
                .routeId(location.getRouteId())
                .driverId(location.getDriverId())
                .latitude(location.getLatitude())
                .longitude(location.getLongitude())
                .speedMetersPerSecond(location.getSpeedMetersPerSecond())
                .headingDegrees(location.getHeadingDegrees())
                .accuracyMeters(location.getAccuracyMeters())
                .capturedAt(location.getCapturedAt())
                .overspeedWarning(overspeedWarning)
                .build();
    }
}
