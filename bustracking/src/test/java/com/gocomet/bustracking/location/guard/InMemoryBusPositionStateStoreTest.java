package com.gocomet.bustracking.location.guard;

import com.gocomet.bustracking.common.config.RealtimeProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryBusPositionStateStoreTest {

    private final InMemoryBusPositionStateStore store = new InMemoryBusPositionStateStore(new RealtimeProperties());

    @Test
    void testCompareAndSet_FromEmpty_WritesOnlyWhenExpectingNothing() {
        BusPositionState first = new BusPositionState(1.0, 2.0, 1000);

        assertFalse(store.compareAndSet("B1", new BusPositionState(0, 0, 0), first));
        assertTrue(store.get("B1").isEmpty());

        assertTrue(store.compareAndSet("B1", null, first));
        assertEquals(first, store.get("B1").orElseThrow());
    }

    @Test
    void testCompareAndSet_StaleExpectation_IsRefused() {
        BusPositionState first = new BusPositionState(1.0, 2.0, 1000);
        BusPositionState second = new BusPositionState(1.1, 2.0, 5000);
        store.compareAndSet("B1", null, first);
        store.compareAndSet("B1", first, second);

        assertFalse(store.compareAndSet("B1", first, new BusPositionState(9, 9, 9000)));
        assertEquals(second, store.get("B1").orElseThrow());
    }

    @Test
    void testCompareAndSet_KeysAreIndependent() {
        assertTrue(store.compareAndSet("B1", null, new BusPositionState(1, 1, 1)));
        assertTrue(store.compareAndSet("B2", null, new BusPositionState(2, 2, 2)));
        assertEquals(2, store.get("B2").orElseThrow().getTimestampMillis());
    }
}
