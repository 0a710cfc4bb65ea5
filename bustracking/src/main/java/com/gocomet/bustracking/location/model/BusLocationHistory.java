package com.gocomet.bustracking.location.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "bus_location_history", indexes = {
        @Index(name = "idx_bus_location_history_bus_time", columnList = "bus_id, captured_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BusLocationHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "bus_id", nullable = false)
    private String busId;

    @Column(name = "driver_id", nullable = false)
    private String driverId;

    @Column(name = "route_id", nullable = false)
    private String routeId;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    @Column(name = "speed_mps")
    private Double speedMetersPerSecond;

    @Column(name = "heading_deg")
    private Double headingDegrees;

    @Column(name = "accuracy_m")
    private Double accuracyMeters;

    @Column(name = "captured_at", nullable = false)
    private Instant capturedAt;

    public static BusLocationHistory from(BusLocation current) {
        return BusLocationHistory.builder()
                .busId(current.getBusId())
                .driverId(current.getDriverId())
                .routeId(current.getRouteId())
                .latitude(current.getLatitude())
                .longitude(current.getLongitude())
                .speedMetersPerSecond(current.getSpeedMetersPerSecond())
                .headingDegrees(current.getHeadingDegrees())
                .accuracyMeters(current.getAccuracyMeters())
                .capturedAt(current.getCapturedAt())
                .build();
    }
}
