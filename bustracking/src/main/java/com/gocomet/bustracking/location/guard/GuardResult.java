package com.gocomet.bustracking.location.guard;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one guard evaluation. {@code committed} is true when the sample became
 * the bus's last accepted fix, which is also the case for an overspeed sample
 * under {@link OverspeedPolicy#WARN}.
 */
@Getter
@AllArgsConstructor
@ToString
public class GuardResult {

    private final GuardVerdict verdict;
    private final double impliedSpeedKmh;
    private final boolean committed;

    public static GuardResult accepted(double impliedSpeedKmh) {
        return new GuardResult(GuardVerdict.ACCEPTED, impliedSpeedKmh, true);
    }

    public static GuardResult overspeedRejected(double impliedSpeedKmh) {
        return new GuardResult(GuardVerdict.OVERSPEED, impliedSpeedKmh, false);
    }

    public static GuardResult overspeedWarned(double impliedSpeedKmh) {
        return new GuardResult(GuardVerdict.OVERSPEED, impliedSpeedKmh, true);
    }

    public static GuardResult throttled() {
        return new GuardResult(GuardVerdict.THROTTLED, 0.0, false);
    }

    public boolean isThrottled() {
        return verdict == GuardVerdict.THROTTLED;
    }

    public boolean isOverspeed() {
        return verdict == GuardVerdict.OVERSPEED;
    }
}
