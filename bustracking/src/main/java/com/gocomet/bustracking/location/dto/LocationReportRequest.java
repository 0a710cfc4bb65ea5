package com.gocomet.bustracking.location.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LocationReportRequest {

    @NotNull(message = "Latitude is required")
    private Double latitude;

    @NotNull(message = "Longitude is required")
    private Double longitude;

    private Double speedMetersPerSecond;

    private Double headingDegrees;

    private Double accuracyMeters;

    /** Route the driver believes it is on; the bus record wins on mismatch. */
    private String routeId;
}
