package com.gocomet.bustracking.missedbus.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A rider's request for an alternate bus.
 *
 * Uniqueness is enforced by the database: (student_id, operation_id) makes raise
 * idempotent, and {@code pendingKey} (the student id while pending, null afterwards)
 * allows at most one pending request per rider.
 *
 * An approved request holds one seat on its candidate bus while {@code seatHeld} is
 * true; the sweep gives the seat back once the pickup window has closed.
 */
@Entity
@Table(name = "missed_bus_requests",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_missed_bus_student_operation", columnNames = {"student_id", "operation_id"}),
                @UniqueConstraint(name = "uk_missed_bus_pending_key", columnNames = {"pending_key"})
        },
        indexes = {
                @Index(name = "idx_missed_bus_student_status", columnList = "student_id, status"),
                @Index(name = "idx_missed_bus_status_expires", columnList = "status, expires_at"),
                @Index(name = "idx_missed_bus_candidate_bus", columnList = "candidate_bus_id, status"),
                @Index(name = "idx_missed_bus_status_match_attempt", columnList = "status, last_match_attempt_at")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MissedBusRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "operation_id", nullable = false)
    private String operationId;

    @Column(name = "student_id", nullable = false)
    private String studentId;

    @Column(name = "route_id", nullable = false)
    private String routeId;

    @Column(name = "stop_id", nullable = false)
    private String stopId;

    @Column(name = "assigned_trip_id")
    private String assignedTripId;

    @Column(name = "assigned_bus_id")
    private String assignedBusId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private MissedBusStatus status = MissedBusStatus.PENDING;

    @Column(name = "candidate_bus_id")
    private String candidateBusId;

    @Column(name = "candidate_trip_id")
    private String candidateTripId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolution_message", length = 500)
    private String resolutionMessage;

    @Column(name = "pending_key")
    private String pendingKey;

    @Column(name = "last_match_attempt_at")
    private Instant lastMatchAttemptAt;

    @Column(name = "seat_held", nullable = false)
    @Builder.Default
    private boolean seatHeld = false;
}
