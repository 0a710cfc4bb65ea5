package com.gocomet.bustracking.missedbus.model;

/**
 * What happens to a new request when no candidate bus is found straight away.
 */
public enum NoCandidatePolicy {
    /** Stay pending; the sweep retries matching until the request expires. */
    KEEP_PENDING,
    /** Reject immediately and tell the rider. */
    REJECT
}
