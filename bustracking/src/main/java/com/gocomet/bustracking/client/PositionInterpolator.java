package com.gocomet.bustracking.client;

import com.gocomet.bustracking.common.geo.GeoPoint;

import java.util.Optional;

/**
 * Smooths discrete bus positions into continuous marker motion.
 *
 * A new sample does not snap the marker: it becomes the target and the displayed
 * position eases toward it over the window with {@code 1 - (1 - p)^2}. A sample
 * arriving mid-animation restarts from wherever the marker currently is. The first
 * sample, and any jump longer than the teleport threshold, snap immediately.
 */
public class PositionInterpolator {

    private final long windowMillis;
    private final double teleportMeters;

    private GeoPoint start;
    private GeoPoint target;
    private GeoPoint displayed;
    private long startedAtMillis;
    private boolean animating;

    public PositionInterpolator(long windowMillis, double teleportMeters) {
        if (windowMillis <= 0) {
            throw new IllegalArgumentException("Interpolation window must be positive");
        }
        this.windowMillis = windowMillis;
        this.teleportMeters = teleportMeters;
    }

    public synchronized void onSample(GeoPoint sample, long nowMillis) {
        if (displayed == null) {
            snapTo(sample);
            return;
        }

        GeoPoint from = frame(nowMillis);
        if (from.distanceMetersTo(sample) > teleportMeters) {
            snapTo(sample);
            return;
        }
        start = from;
        target = sample;
        startedAtMillis = nowMillis;
        animating = true;
    }

    /**
     * Position to draw at {@code nowMillis}. Holds the last target once the window has elapsed.
     */
    public synchronized GeoPoint frame(long nowMillis) {
        if (!animating) {
            return displayed;
        }
        double progress = Math.min(1.0, Math.max(0.0, (nowMillis - startedAtMillis) / (double) windowMillis));
        if (progress >= 1.0) {
            displayed = target;
            animating = false;
            return displayed;
        }
        double eased = easeOut(progress);
        displayed = GeoPoint.of(
                start.getLatitude() + (target.getLatitude() - start.getLatitude()) * eased,
                start.getLongitude() + (target.getLongitude() - start.getLongitude()) * eased);
        return displayed;
    }

    public synchronized boolean isAnimating() {
        return animating;
    }

    public synchronized Optional<GeoPoint> current() {
        return Optional.ofNullable(displayed);
    }

    static double easeOut(double progress) {
        return 1 - (1 - progress) * (1 - progress);
    }

    private void snapTo(GeoPoint point) {
        start = point;
        target = point;
        displayed = point;
        animating = false;
    }
}
