package com.gocomet.bustracking.location.guard;

import com.gocomet.bustracking.common.config.RealtimeProperties;
import com.gocomet.bustracking.common.geo.GeoUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Rejects physically implausible position jumps and samples that arrive too fast.
 *
 * Evaluation against the last accepted fix for the bus:
 * 1. elapsed below the minimum interval (including out-of-order samples) → THROTTLED, nothing stored
 * 2. implied speed above the maximum → OVERSPEED, stored only under the WARN policy
 * 3. otherwise ACCEPTED and stored
 *
 * The write is a compare-and-set against the fix that was evaluated, so two
 * concurrent samples for one bus cannot both be accepted off the same predecessor.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AntiSpoofGuard {

    static final int MAX_ATTEMPTS = 3;

    private final BusPositionStateStore stateStore;
    private final RealtimeProperties properties;

    public GuardResult validate(String busId, double latitude, double longitude, long observedAtMillis) {
        RealtimeProperties.AntiSpoof config = properties.getAntiSpoof();
        long minIntervalMs = config.getMinInterval().toMillis();
        BusPositionState next = new BusPositionState(latitude, longitude, observedAtMillis);

        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            Optional<BusPositionState> prior = stateStore.get(busId);
            GuardResult result = GuardResult.accepted(0.0);

            if (prior.isPresent()) {
                BusPositionState last = prior.get();
                long elapsed = observedAtMillis - last.getTimestampMillis();
                if (elapsed < minIntervalMs) {
                    log.debug("Throttled bus {}: {} ms since last accepted sample", busId, elapsed);
                    return GuardResult.throttled();
                }

                double speedKmh = GeoUtils.impliedSpeedKmh(last.getLatitude(), last.getLongitude(),
                        latitude, longitude, elapsed);
                if (speedKmh > config.getMaxSpeedKmh()) {
                    if (config.getOverspeedPolicy() == OverspeedPolicy.REJECT) {
                        log.warn("Rejected sample for bus {}: implied speed {} km/h exceeds {}",
                                busId, Math.round(speedKmh), config.getMaxSpeedKmh());
                        return GuardResult.overspeedRejected(speedKmh);
                    }
                    log.warn("Overspeed sample for bus {} accepted under WARN policy: {} km/h",
                            busId, Math.round(speedKmh));
                    result = GuardResult.overspeedWarned(speedKmh);
                } else {
                    result = GuardResult.accepted(speedKmh);
                }
            }

            if (stateStore.compareAndSet(busId, prior.orElse(null), next)) {
                return result;
            }
        }

        // Lost every race: another sample for this bus was accepted in between.
        log.debug("Bus {} guard state contended, treating sample as throttled", busId);
        return GuardResult.throttled();
    }
}
