package com.gocomet.bustracking.notification.service;

import com.gocomet.bustracking.notification.dto.RiderNotification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Enqueues notifications on the "rider-notifications" topic, keyed by recipient so
 * one person's messages are delivered in order. Content rendering and push fan-out
 * happen downstream.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KafkaNotificationDispatcher implements NotificationDispatcher {

    private final KafkaTemplate<String, RiderNotification> kafkaTemplate;

    @Value("${app.kafka.topics.rider-notifications}")
    private String topic;

    @Override
    public void enqueue(RiderNotification notification) {
        try {
            kafkaTemplate.send(topic, notification.getRecipientId(), notification)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Failed to enqueue {} notification for {}: {}",
                                    notification.getType(), notification.getRecipientId(), ex.getMessage());
                        } else {
                            log.debug("Enqueued {} notification for {}",
                                    notification.getType(), notification.getRecipientId());
                        }
                    });
        } catch (RuntimeException e) {
            log.warn("Failed to enqueue {} notification for {}: {}",
                    notification.getType(), notification.getRecipientId(), e.getMessage());
        }
    }
}
