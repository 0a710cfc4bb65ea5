package com.gocomet.bustracking.broadcast;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * STOMP-backed broadcaster. Channel {@code X} is sent to {@code /topic/X} with an
 * envelope {@code {event, payload, sentAt}}; clients filter on {@code event}.
 * In-process subscribers registered through {@link #subscribe} receive the raw payload.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StompRealtimeBroadcaster implements RealtimeBroadcaster {

    private static final String TOPIC_PREFIX = "/topic/";

    private final SimpMessagingTemplate messagingTemplate;
    private final Clock clock;

    private final Map<String, List<Consumer<Object>>> handlers = new ConcurrentHashMap<>();

    @Override
    public void publish(String channel, String event, Object payload) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("event", event);
        message.put("payload", payload);
        message.put("sentAt", clock.instant().toString());

        try {
            messagingTemplate.convertAndSend(TOPIC_PREFIX + channel, (Object) message);
            log.debug("Published {} on {}", event, channel);
        } catch (RuntimeException e) {
            log.warn("Failed to publish {} on {}: {}", event, channel, e.getMessage());
        }

        List<Consumer<Object>> local = handlers.get(key(channel, event));
        if (local == null) {
            return;
        }
        for (Consumer<Object> handler : local) {
            try {
                handler.accept(payload);
            } catch (RuntimeException e) {
                log.warn("Subscriber for {} on {} failed: {}", event, channel, e.getMessage());
            }
        }
    }

    @Override
    public Subscription subscribe(String channel, String event, Consumer<Object> handler) {
        String key = key(channel, event);
        handlers.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(handler);
        return () -> {
            List<Consumer<Object>> local = handlers.get(key);
            if (local != null) {
                local.remove(handler);
            }
        };
    }

    private static String key(String channel, String event) {
        return channel + "|" + event;
    }
}
