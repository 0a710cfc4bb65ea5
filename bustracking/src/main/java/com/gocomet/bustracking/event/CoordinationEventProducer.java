package com.gocomet.bustracking.event;

import com.gocomet.bustracking.common.event.CoordinationEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Publishes flag and missed-bus transitions to the "coordination-events" topic.
 * Sending is asynchronous; a failed send is logged and never surfaces to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CoordinationEventProducer {

    private final KafkaTemplate<String, CoordinationEvent> kafkaTemplate;

    @Value("${app.kafka.topics.coordination-events}")
    private String topic;

    public void publish(CoordinationEvent event) {
        try {
            kafkaTemplate.send(topic, event.getEntityId(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("❌ Failed to publish CoordinationEvent [{}] for {}",
                                    event.getEventType(), event.getEntityId(), ex);
                        } else {
                            log.info("📤 Published CoordinationEvent [{}] for {} → partition {}, offset {}",
                                    event.getEventType(),
                                    event.getEntityId(),
                                    result.getRecordMetadata().partition(),
                                    result.getRecordMetadata().offset());
                        }
                    });
        } catch (RuntimeException e) {
            log.error("❌ Could not enqueue CoordinationEvent [{}] for {}",
                    event.getEventType(), event.getEntityId(), e);
        }
    }
}
