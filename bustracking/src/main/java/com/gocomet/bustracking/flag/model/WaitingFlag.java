package com.gocomet.bustracking.flag.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A rider's signal that they are at a stop waiting for a bus.
 *
 * {@code activeKey} is {@code studentId:busId} while the flag is raised or acknowledged
 * and null once terminal; its unique index is what keeps one active flag per pair
 * across concurrent raises.
 */
@Entity
@Table(name = "waiting_flags", indexes = {
        @Index(name = "idx_waiting_flags_active_key", columnList = "active_key", unique = true),
        @Index(name = "idx_waiting_flags_bus_status", columnList = "bus_id, status"),
        @Index(name = "idx_waiting_flags_status_expires", columnList = "status, expires_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WaitingFlag {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "student_id", nullable = false)
    private String studentId;

    @Column(name = "student_name")
    private String studentName;

    @Column(name = "bus_id", nullable = false)
    private String busId;

    @Column(name = "route_id", nullable = false)
    private String routeId;

    @Column(name = "stop_id")
    private String stopId;

    @Column(name = "stop_name")
    private String stopName;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private FlagStatus status = FlagStatus.RAISED;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "acknowledged_by_driver_id")
    private String acknowledgedByDriverId;

    @Column(name = "acknowledged_at")
    private Instant acknowledgedAt;

    @Column(name = "location_updated_at")
    private Instant locationUpdatedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "active_key")
    private String activeKey;

    public static String activeKey(String studentId, String busId) {
        return studentId + ":" + busId;
    }
}
