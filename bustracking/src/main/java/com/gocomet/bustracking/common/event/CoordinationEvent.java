package com.gocomet.bustracking.common.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A state change of a waiting flag or a missed-bus request.
 *
 * Published to the "coordination-events" Kafka topic, keyed by entityId so all
 * transitions of one flag or request stay in order within a partition.
 *
 * Flag flow:    FLAG_RAISED → FLAG_ACKNOWLEDGED → FLAG_BOARDED
 *               (while active) → FLAG_CANCELLED | FLAG_EXPIRED
 * Request flow: MISSED_BUS_REQUESTED → MISSED_BUS_APPROVED | MISSED_BUS_REJECTED
 *               | MISSED_BUS_EXPIRED | MISSED_BUS_CANCELLED
 *               (approved, window closed) → MISSED_BUS_PICKUP_CLOSED
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoordinationEvent {

    private String eventId;
    private String entityId;
    private String studentId;
    private String busId;
    private String actorId; // driver for acknowledge/board, otherwise the rider or null for the sweep
    private EventType eventType;
    private Instant timestamp;
    private String metadata;

    public enum EventType {
        FLAG_RAISED,
        FLAG_ACKNOWLEDGED,
        FLAG_BOARDED,
        FLAG_CANCELLED,
        FLAG_EXPIRED,
        MISSED_BUS_REQUESTED,
        MISSED_BUS_APPROVED,
        MISSED_BUS_REJECTED,
        MISSED_BUS_EXPIRED,
        MISSED_BUS_CANCELLED,
        MISSED_BUS_PICKUP_CLOSED
    }

    public static CoordinationEvent of(EventType type, String entityId, String studentId,
                                       String busId, String actorId, Instant timestamp, String metadata) {
        return CoordinationEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .entityId(entityId)
                .studentId(studentId)
                .busId(busId)
                .actorId(actorId)
                .eventType(type)
                .timestamp(timestamp)
                .metadata(metadata)
                .build();
    }
}
