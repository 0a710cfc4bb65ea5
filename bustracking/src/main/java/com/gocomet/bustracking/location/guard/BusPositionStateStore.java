package com.gocomet.bustracking.location.guard;

import java.util.Optional;

/**
 * Keyed store of the last accepted fix per bus, with atomic compare-and-set.
 */
public interface BusPositionStateStore {

    Optional<BusPositionState> get(String busId);

    /**
     * Writes {@code next} only if the stored state still equals {@code expected}
     * ({@code null} meaning "no state yet").
     *
     * @return true if the write happened
     */
    boolean compareAndSet(String busId, BusPositionState expected, BusPositionState next);
}
