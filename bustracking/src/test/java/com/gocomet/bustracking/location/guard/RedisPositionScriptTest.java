package com.gocomet.bustracking.location.guard;

import com.gocomet.bustracking.common.config.RealtimeProperties;
import com.gocomet.bustracking.common.config.RedisConfig;
import com.gocomet.bustracking.support.RedisContainerTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RedisPositionScriptTest extends RedisContainerTest {

    private RealtimeProperties properties;
    private RedisBusPositionStateStore store;
    private String busId;

    @BeforeEach
    void setUp() {
        properties = new RealtimeProperties();
        store = new RedisBusPositionStateStore(redisTemplate, new RedisConfig().positionCompareAndSetScript(),
                properties);
        busId = "BUS-" + UUID.randomUUID();
    }

    @Test
    void testCompareAndSet_FirstWriteOnlyWhenNoStateExists() {
        BusPositionState first = new BusPositionState(12.9716, 77.5946, 1_000L);

        assertTrue(store.compareAndSet(busId, null, first));
        assertFalse(store.compareAndSet(busId, null, new BusPositionState(12.98, 77.60, 2_000L)));
        assertEquals(Optional.of(first), store.get(busId));
    }

    @Test
    void testCompareAndSet_StaleExpectation_IsRefused() {
        // Arrange
        BusPositionState first = new BusPositionState(12.9716, 77.5946, 1_000L);
        BusPositionState second = new BusPositionState(12.9720, 77.5950, 5_000L);
        store.compareAndSet(busId, null, first);
        store.compareAndSet(busId, first, second);

        // Act
        boolean swapped = store.compareAndSet(busId, first, new BusPositionState(12.99, 77.61, 9_000L));

        // Assert
        assertFalse(swapped);
        assertEquals(Optional.of(second), store.get(busId));
    }

    @Test
    void testCompareAndSet_SetsStateTtl() {
        store.compareAndSet(busId, null, new BusPositionState(12.9716, 77.5946, 1_000L));

        Long ttlSeconds = redisTemplate.getExpire("bus:guard:" + busId, TimeUnit.SECONDS);

        assertNotNull(ttlSeconds);
        assertTrue(ttlSeconds > 0 && ttlSeconds <= properties.getAntiSpoof().getStateTtl().toSeconds());
    }

    @Test
    void testGuard_ConcurrentSamplesOffSamePredecessor_ExactlyOneAccepted() throws Exception {
        // Arrange
        AntiSpoofGuard guard = new AntiSpoofGuard(store, properties);
        guard.validate(busId, 12.9716, 77.5946, 0L);
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<GuardResult>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            long observedAt = 10_000L + i;
            results.add(pool.submit(() -> {
                start.await();
                return guard.validate(busId, 12.9720, 77.5950, observedAt);
            }));
        }

        // Act
        start.countDown();
        int accepted = 0;
        for (Future<GuardResult> result : results) {
            if (result.get(10, TimeUnit.SECONDS).isCommitted()) {
                accepted++;
            }
        }
        pool.shutdown();

        // Assert
        assertEquals(1, accepted);
    }
}
