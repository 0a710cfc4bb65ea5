package com.gocomet.bustracking.bus.model;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Entity
@Table(name = "routes")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Route {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "route_stops", joinColumns = @JoinColumn(name = "route_id"))
    @OrderBy("sequence ASC")
    @Builder.Default
    private List<RouteStop> stops = new ArrayList<>();

    public Optional<RouteStop> findStop(String stopId) {
        return stops.stream()
                .filter(stop -> stop.getStopId().equals(stopId))
                .findFirst();
    }
}
