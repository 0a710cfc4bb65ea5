package com.gocomet.bustracking.missedbus.dto;

import com.gocomet.bustracking.missedbus.model.MissedBusRequest;
import com.gocomet.bustracking.missedbus.model.MissedBusStatus;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MissedBusRequestResponse {

    private UUID id;
    private String studentId;
    private String routeId;
    private String stopId;
    private MissedBusStatus status;
    private String candidateBusId;
    private String candidateTripId;
    private Instant createdAt;
    private Instant expiresAt;
    private String message;

    public static MissedBusRequestResponse from(MissedBusRequest request) {
        return MissedBusRequestResponse.builder()
                .id(request.getId())
                .studentId(request.getStudentId())
                .routeId(request.getRouteId())
                .stopId(request.getStopId())
                .status(request.getStatus())
                .candidateBusId(request.getCandidateBusId())
                .candidateTripId(request.getCandidateTripId())
                .createdAt(request.getCreatedAt())
                .expiresAt(request.getExpiresAt())
                .message(request.getResolutionMessage())
                .build();
    }
}
