package com.gocomet.bustracking.bus.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RouteStop {

    @Column(name = "stop_id", nullable = false)
    private String stopId;

    @Column(name = "stop_name", nullable = false)
    private String name;

    @Column(name = "lat")
    private Double latitude;

    @Column(name = "lng")
    private Double longitude;

    @Column(name = "sequence")
    private int sequence;

    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }
}
