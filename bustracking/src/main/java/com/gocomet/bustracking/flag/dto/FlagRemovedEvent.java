package com.gocomet.bustracking.flag.dto;

import lombok.*;

import java.util.UUID;

/**
 * Payload of {@code waiting_flag_removed}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FlagRemovedEvent {

    private UUID flagId;
    private String studentId;
    private String busId;
    private String reason;
}
