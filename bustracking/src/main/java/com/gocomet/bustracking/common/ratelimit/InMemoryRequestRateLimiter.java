package com.gocomet.bustracking.common.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Single-instance limiter. Windows live in this JVM only, so limits are per instance
 * when more than one server runs.
 */
@Component
@ConditionalOnProperty(name = "app.realtime.state-store", havingValue = "memory")
@Slf4j
public class InMemoryRequestRateLimiter implements RequestRateLimiter {

    private final Cache<String, Deque<Long>> hits;
    private final Clock clock;

    public InMemoryRequestRateLimiter(Clock clock) {
        this.clock = clock;
        this.hits = Caffeine.newBuilder()
                .expireAfterAccess(Duration.ofDays(1))
                .maximumSize(100_000)
                .build();
    }

    @Override
    public boolean tryAcquire(String key, int limit, Duration window) {
        long now = clock.millis();
        long cutoff = now - window.toMillis();
        boolean[] granted = new boolean[1];

        // compute() holds the per-key lock for the whole read-modify-write
        hits.asMap().compute(key, (k, timestamps) -> {
            Deque<Long> entries = timestamps != null ? timestamps : new ArrayDeque<>();
            while (!entries.isEmpty() && entries.peekFirst() <= cutoff) {
                entries.pollFirst();
            }
            if (entries.size() < limit) {
                entries.addLast(now);
                granted[0] = true;
            }
            return entries;
        });

        if (!granted[0]) {
            log.info("Rate limit reached for {} ({} per {})", key, limit, window);
        }
        return granted[0];
    }
}
