package com.gocomet.bustracking.location.guard;

import com.gocomet.bustracking.common.config.RealtimeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shared guard state for multi-instance deployments. Each bus is a hash
 * {@code bus:guard:<busId>} with fields lat, lng, ts; the timestamp acts as the
 * version checked by the compare-and-set script.
 */
@Component
@ConditionalOnProperty(name = "app.realtime.state-store", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RedisBusPositionStateStore implements BusPositionStateStore {

    private static final String KEY_PREFIX = "bus:guard:";

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> positionCompareAndSetScript;
    private final RealtimeProperties properties;

    @Override
    public Optional<BusPositionState> get(String busId) {
        Map<Object, Object> fields = redisTemplate.opsForHash().entries(KEY_PREFIX + busId);
        if (fields == null || !fields.containsKey("ts")) {
            return Optional.empty();
        }
        return Optional.of(new BusPositionState(
                Double.parseDouble((String) fields.get("lat")),
                Double.parseDouble((String) fields.get("lng")),
                Long.parseLong((String) fields.get("ts"))));
    }

    @Override
    public boolean compareAndSet(String busId, BusPositionState expected, BusPositionState next) {
        String expectedTs = expected == null ? "" : String.valueOf(expected.getTimestampMillis());
        Long written = redisTemplate.execute(positionCompareAndSetScript,
                List.of(KEY_PREFIX + busId),
                expectedTs,
                String.valueOf(next.getLatitude()),
                String.valueOf(next.getLongitude()),
                String.valueOf(next.getTimestampMillis()),
                String.valueOf(properties.getAntiSpoof().getStateTtl().toMillis()));
        boolean swapped = written != null && written == 1L;
        if (!swapped) {
            log.debug("Guard state for bus {} changed concurrently", busId);
        }
        return swapped;
    }
}
