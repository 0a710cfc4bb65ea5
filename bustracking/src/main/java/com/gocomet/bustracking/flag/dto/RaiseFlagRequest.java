package com.gocomet.bustracking.flag.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RaiseFlagRequest {

    @NotBlank(message = "Bus ID is required")
    private String busId;

    /** Defaults to the bus's route when omitted. */
    private String routeId;

    private String stopId;

    private String stopName;

    // Nullable: a rider without a location fix gets LOCATION_UNAVAILABLE
    private Double latitude;

    private Double longitude;
}
