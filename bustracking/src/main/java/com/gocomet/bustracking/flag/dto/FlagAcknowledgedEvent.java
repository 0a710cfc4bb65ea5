package com.gocomet.bustracking.flag.dto;

import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FlagAcknowledgedEvent {

    private UUID flagId;
    private String driverId;
    private String busId;
    private Instant timestamp;
}
