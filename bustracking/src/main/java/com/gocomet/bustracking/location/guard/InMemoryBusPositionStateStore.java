package com.gocomet.bustracking.location.guard;

import com.gocomet.bustracking.common.config.RealtimeProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Process-local guard state. Only correct for a single server instance: a second
 * instance keeps its own map and will accept samples the first one would throttle.
 */
@Component
@ConditionalOnProperty(name = "app.realtime.state-store", havingValue = "memory")
public class InMemoryBusPositionStateStore implements BusPositionStateStore {

    private final Cache<String, BusPositionState> states;

    public InMemoryBusPositionStateStore(RealtimeProperties properties) {
        this.states = Caffeine.newBuilder()
                .expireAfterWrite(properties.getAntiSpoof().getStateTtl())
                .maximumSize(10_000)
                .build();
    }

    @Override
    public Optional<BusPositionState> get(String busId) {
        return Optional.ofNullable(states.getIfPresent(busId));
    }

    @Override
    public boolean compareAndSet(String busId, BusPositionState expected, BusPositionState next) {
        boolean[] swapped = new boolean[1];
        states.asMap().compute(busId, (key, current) -> {
            if (Objects.equals(current, expected)) {
                swapped[0] = true;
                return next;
            }
            return current;
        });
        return swapped[0];
    }
}
