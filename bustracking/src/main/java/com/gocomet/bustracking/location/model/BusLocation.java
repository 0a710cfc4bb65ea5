package com.gocomet.bustracking.location.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Current position of a bus, one row per bus, overwritten on every accepted sample.
 */
@Entity
@Table(name = "bus_locations", indexes = {
        @Index(name = "idx_bus_locations_route", columnList = "route_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BusLocation {

    @Id
    @Column(name = "bus_id")
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
}
