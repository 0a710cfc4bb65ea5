package com.gocomet.bustracking.client;

import com.gocomet.bustracking.common.geo.GeoPoint;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Per-frame driver for a {@link PositionInterpolator}. Frames are rendered only while
 * an animation is in flight; between samples the marker stays where it is.
 */
@Slf4j
public class InterpolationLoop implements AutoCloseable {

    private final PositionInterpolator interpolator;
    private final Consumer<GeoPoint> renderer;
    private final Clock clock;
    private final long frameMillis;
    private final ScheduledExecutorService scheduler;

    private ScheduledFuture<?> ticker;

    public InterpolationLoop(PositionInterpolator interpolator, Consumer<GeoPoint> renderer, Clock clock, int fps) {
        this(interpolator, renderer, clock, fps, Executors.newSingleThreadScheduledExecutor());
    }

    InterpolationLoop(PositionInterpolator interpolator, Consumer<GeoPoint> renderer, Clock clock, int fps,
                      ScheduledExecutorService scheduler) {
        if (fps <= 0) {
            throw new IllegalArgumentException("fps must be positive");
        }
        this.interpolator = interpolator;
        this.renderer = renderer;
        this.clock = clock;
        this.frameMillis = Math.max(1, 1000 / fps);
        this.scheduler = scheduler;
    }

    public synchronized void start() {
        if (ticker == null) {
            ticker = scheduler.scheduleAtFixedRate(this::tick, 0, frameMillis, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Feeds a received sample and draws the first frame right away.
     */
    public void onSample(GeoPoint sample) {
        long now = clock.millis();
        interpolator.onSample(sample, now);
        renderer.accept(interpolator.frame(now));
    }

    void tick() {
        if (!interpolator.isAnimating()) {
            return;
        }
        try {
            renderer.accept(interpolator.frame(clock.millis()));
        } catch (RuntimeException e) {
            // a throwing task would cancel the fixed-rate schedule
            log.warn("Marker render failed: {}", e.getMessage());
        }
    }

    @Override
    public synchronized void close() {
        if (ticker != null) {
            ticker.cancel(false);
            ticker = null;
        }
        scheduler.shutdown();
    }
}
