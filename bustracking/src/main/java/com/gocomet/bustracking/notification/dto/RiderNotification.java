package com.gocomet.bustracking.notification.dto;

import lombok.*;

import java.time.Instant;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RiderNotification {

    private String recipientId;
    private String type;
    private String title;
    private String body;
    private Map<String, String> data;
    private Instant createdAt;
}
