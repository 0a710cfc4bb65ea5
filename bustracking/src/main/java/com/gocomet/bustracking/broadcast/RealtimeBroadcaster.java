package com.gocomet.bustracking.broadcast;

import java.util.function.Consumer;

/**
 * Publish/subscribe over named channels. Channels follow {@link RealtimeChannels};
 * event names follow {@link RealtimeEvents}.
 *
 * Delivery is best-effort: implementations log publish failures and never throw
 * into the caller, so a broadcast outage cannot fail a state change that already
 * committed.
 */
public interface RealtimeBroadcaster {

    void publish(String channel, String event, Object payload);

    Subscription subscribe(String channel, String event, Consumer<Object> handler);

    @FunctionalInterface
    interface Subscription {
        void unsubscribe();
    }
}
