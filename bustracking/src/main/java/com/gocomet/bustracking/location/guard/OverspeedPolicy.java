package com.gocomet.bustracking.location.guard;

/**
 * What to do with a sample whose implied speed exceeds the configured maximum.
 */
public enum OverspeedPolicy {
    /** Drop the sample; stored state stays on the previous fix. */
    REJECT,
    /** Log a warning and accept the sample anyway. */
    WARN
}
