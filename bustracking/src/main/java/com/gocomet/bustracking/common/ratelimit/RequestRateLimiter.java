package com.gocomet.bustracking.common.ratelimit;

import java.time.Duration;

/**
 * Rolling-window counter keyed by caller. A hit is recorded only when it is allowed,
 * so rejected attempts do not extend the caller's lockout.
 */
public interface RequestRateLimiter {

    /**
     * @return true if the hit fits inside {@code limit} hits per {@code window} and was recorded
     */
    boolean tryAcquire(String key, int limit, Duration window);
}
