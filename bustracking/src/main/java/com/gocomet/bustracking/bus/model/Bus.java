package com.gocomet.bustracking.bus.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(name = "buses", indexes = {
        @Index(name = "idx_buses_route_status", columnList = "route_id, status"),
        @Index(name = "idx_buses_driver", columnList = "assigned_driver_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Bus {

    @Id
    private String id;

    @Column(name = "route_id")
    private String routeId;

    @Column(name = "assigned_driver_id")
    private String assignedDriverId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private BusStatus status = BusStatus.IDLE;

    @Column(nullable = false)
    private int capacity;

    @Column(nullable = false)
    @Builder.Default
    private int occupancy = 0;

    @Column(name = "active_trip_id")
    private String activeTripId;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean hasSpareCapacity() {
        return occupancy < capacity;
    }
}
