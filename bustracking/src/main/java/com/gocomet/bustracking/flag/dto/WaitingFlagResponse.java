package com.gocomet.bustracking.flag.dto;

import com.gocomet.bustracking.flag.model.FlagStatus;
import com.gocomet.bustracking.flag.model.WaitingFlag;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WaitingFlagResponse {

    private UUID id;
    private String studentId;
    private String studentName;
    private String busId;
    private String routeId;
    private String stopId;
    private String stopName;
    private Double latitude;
    private Double longitude;
    private FlagStatus status;
    private Instant createdAt;
    private Instant expiresAt;
    private String acknowledgedByDriverId;

    public static WaitingFlagResponse from(WaitingFlag flag) {
        return WaitingFlagResponse.builder()
                .id(flag.getId())
                .studentId(flag.getStudentId())
                .studentName(flag.getStudentName())
                .busId(flag.getBusId())
                .routeId(flag.getRouteId())
                .stopId(flag.getStopId())
                .stopName(flag.getStopName())
                .latitude(flag.getLatitude())
                .longitude(flag.getLongitude())
                .status(flag.getStatus())
                .createdAt(flag.getCreatedAt())
                .expiresAt(flag.getExpiresAt())
                .acknowledgedByDriverId(flag.getAcknowledgedByDriverId())
                .build();
    }
}
