package com.gocomet.bustracking.common.ratelimit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Sliding-window limiter on a Redis sorted set, one ZSET per key. The Lua script
 * trims, counts and adds in one round trip so concurrent instances share the window.
 */
@Component
@ConditionalOnProperty(name = "app.realtime.state-store", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RedisRequestRateLimiter implements RequestRateLimiter {

    private static final String KEY_PREFIX = "ratelimit:";

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> slidingWindowScript;
    private final Clock clock;

    @Override
    public boolean tryAcquire(String key, int limit, Duration window) {
        long now = clock.millis();
        String member = now + ":" + UUID.randomUUID();
        Long allowed = redisTemplate.execute(slidingWindowScript,
                List.of(KEY_PREFIX + key),
                String.valueOf(now),
                String.valueOf(window.toMillis()),
                String.valueOf(limit),
                member);
        boolean granted = allowed != null && allowed == 1L;
        if (!granted) {
            log.info("Rate limit reached for {} ({} per {})", key, limit, window);
        }
        return granted;
    }
}
