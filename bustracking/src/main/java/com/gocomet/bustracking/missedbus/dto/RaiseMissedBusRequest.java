package com.gocomet.bustracking.missedbus.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RaiseMissedBusRequest {

    /** Client-generated idempotency key, reused on retries. */
    @NotBlank(message = "Operation ID is required")
    private String operationId;

    @NotBlank(message = "Route ID is required")
    private String routeId;

    @NotBlank(message = "Stop ID is required")
    private String stopId;

    private String assignedTripId;

    private String assignedBusId;
}
