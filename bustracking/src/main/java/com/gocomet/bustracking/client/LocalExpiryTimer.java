package com.gocomet.bustracking.client;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Optimistic countdown for a flag or request. Shows "expired" the moment the
 * deadline passes without waiting for the server; server state always overrides it.
 */
public class LocalExpiryTimer {

    private final Clock clock;
    private volatile Instant expiresAt;
    private volatile boolean serverTerminal;

    public LocalExpiryTimer(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public boolean isExpired() {
        return serverTerminal || !clock.instant().isBefore(expiresAt);
    }

    public Duration remaining() {
        if (serverTerminal) {
            return Duration.ZERO;
        }
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * Adopts the server's view. Once the server reports a terminal state the timer stays expired.
     */
    public void applyServerState(boolean active, Instant serverExpiresAt) {
        if (serverExpiresAt != null) {
            this.expiresAt = serverExpiresAt;
        }
        if (!active) {
            this.serverTerminal = true;
        }
    }
}
