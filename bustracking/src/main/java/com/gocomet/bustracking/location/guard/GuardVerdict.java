package com.gocomet.bustracking.location.guard;

public enum GuardVerdict {
    ACCEPTED,
    OVERSPEED,
    THROTTLED
}
