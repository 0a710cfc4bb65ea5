package com.gocomet.bustracking.missedbus.dto;

import com.gocomet.bustracking.missedbus.model.MissedBusStatus;
import lombok.*;

import java.util.UUID;

/**
 * Payload of the missed_bus_* events on the rider and driver channels.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MissedBusResultEvent {

    private UUID requestId;
    private String studentId;
    private MissedBusStatus status;
    private String candidateBusId;
    private String candidateTripId;
    private String stopId;
    private String message;
}
