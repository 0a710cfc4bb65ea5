package com.gocomet.bustracking.client;

import com.gocomet.bustracking.broadcast.RealtimeBroadcaster;
import com.gocomet.bustracking.broadcast.RealtimeChannels;
import com.gocomet.bustracking.broadcast.RealtimeEvents;
import com.gocomet.bustracking.common.exception.InvalidStateTransitionException;
import com.gocomet.bustracking.common.geo.GeoPoint;
import com.gocomet.bustracking.flag.dto.FlagAcknowledgedEvent;
import com.gocomet.bustracking.flag.dto.FlagRemovedEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Rider-side cadence for a raised flag: sends the device location every interval
 * plus a random jitter in [0, jitter), so many riders do not report in lockstep.
 * Stops when the driver acknowledges, the flag expires, or the server refuses the
 * update because the flag is no longer active.
 */
@Slf4j
public class WaitingFlagLocationReporter implements AutoCloseable {

    private final UUID flagId;
    private final String studentId;
    private final Supplier<Optional<GeoPoint>> locationSource;
    private final FlagLocationSender sender;
    private final RealtimeBroadcaster broadcaster;
    private final ScheduledExecutorService scheduler;
    private final long intervalMillis;
    private final long jitterMillis;
    private final Random random;

    private final List<RealtimeBroadcaster.Subscription> subscriptions = new ArrayList<>();
    private ScheduledFuture<?> next;
    private volatile boolean stopped;

    public WaitingFlagLocationReporter(UUID flagId, String studentId, Supplier<Optional<GeoPoint>> locationSource,
                                       FlagLocationSender sender, RealtimeBroadcaster broadcaster,
                                       ScheduledExecutorService scheduler, Duration interval, Duration jitter,
                                       Random random) {
        this.flagId = flagId;
        this.studentId = studentId;
        this.locationSource = locationSource;
        this.sender = sender;
        this.broadcaster = broadcaster;
        this.scheduler = scheduler;
        this.intervalMillis = interval.toMillis();
        this.jitterMillis = jitter.toMillis();
        this.random = random;
    }

    public synchronized void start() {
        String channel = RealtimeChannels.student(studentId);
        subscriptions.add(broadcaster.subscribe(channel, RealtimeEvents.FLAG_ACKNOWLEDGED, this::onTerminalSignal));
        subscriptions.add(broadcaster.subscribe(channel, RealtimeEvents.FLAG_EXPIRED, this::onTerminalSignal));
        scheduleNext();
        log.debug("Started location reporting for flag {}", flagId);
    }

    public boolean isStopped() {
        return stopped;
    }

    long nextDelayMillis() {
        long extra = jitterMillis > 0 ? (long) (random.nextDouble() * jitterMillis) : 0;
        return intervalMillis + extra;
    }

    void tick() {
        if (stopped) {
            return;
        }
        try {
            Optional<GeoPoint> location = locationSource.get();
            if (location.isPresent()) {
                sender.send(flagId, location.get());
            } else {
                log.debug("No location fix for flag {}, skipping this round", flagId);
            }
        } catch (InvalidStateTransitionException e) {
            log.info("Flag {} is no longer active, stopping updates", flagId);
            close();
            return;
        } catch (RuntimeException e) {
            log.warn("Location update for flag {} failed: {}", flagId, e.getMessage());
        }
        scheduleNext();
    }

    @Override
    public synchronized void close() {
        if (stopped) {
            return;
        }
        stopped = true;
        if (next != null) {
            next.cancel(false);
        }
        subscriptions.forEach(RealtimeBroadcaster.Subscription::unsubscribe);
        subscriptions.clear();
        log.debug("Stopped location reporting for flag {}", flagId);
    }

    private synchronized void scheduleNext() {
        if (!stopped) {
            next = scheduler.schedule(this::tick, nextDelayMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void onTerminalSignal(Object payload) {
        if (concernsThisFlag(payload)) {
            close();
        }
    }

    private boolean concernsThisFlag(Object payload) {
        if (payload instanceof FlagAcknowledgedEvent) {
            return flagId.equals(((FlagAcknowledgedEvent) payload).getFlagId());
        }
        if (payload instanceof FlagRemovedEvent) {
            return flagId.equals(((FlagRemovedEvent) payload).getFlagId());
        }
        if (payload instanceof Map) {
            Object id = ((Map<?, ?>) payload).get("flagId");
            return id == null || flagId.toString().equals(id.toString());
        }
        // Unknown shape on this rider's own channel: stop rather than keep reporting
        return true;
    }
}
