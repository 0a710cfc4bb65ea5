package com.gocomet.bustracking.event;

import com.gocomet.bustracking.common.event.CoordinationEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

/**
 * Audit trail of coordination transitions.
 *
 * Consumer group "coordination-audit" is independent of any other consumer, so it
 * sees every event. Events of one entity share a key and arrive in order.
 */
@Service
@Slf4j
public class CoordinationEventConsumer {

    @KafkaListener(topics = "${app.kafka.topics.coordination-events}", groupId = "coordination-audit")
    public void consume(
            @Payload CoordinationEvent event,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset) {

        log.info("📥 CoordinationEvent [{}]: entityId={}, studentId={}, busId={}, actorId={} | partition={}, offset={}",
                event.getEventType(),
                event.getEntityId(),
                event.getStudentId(),
                event.getBusId(),
                event.getActorId(),
                partition,
                offset);

        switch (event.getEventType()) {
            case FLAG_EXPIRED, MISSED_BUS_EXPIRED -> log.info("   ↳ {} expired by sweep", event.getEntityId());
            case MISSED_BUS_APPROVED -> log.info("   ↳ Request {} matched to bus {}",
                    event.getEntityId(), event.getBusId());
            case MISSED_BUS_REJECTED -> log.warn("   ↳ No candidate bus for request {}", event.getEntityId());
            default -> log.debug("   ↳ Event type {} received", event.getEventType());
        }
    }
}
