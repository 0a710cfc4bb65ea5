package com.gocomet.bustracking.missedbus.model;

public enum MissedBusStatus {
    PENDING,
    APPROVED,
    REJECTED,
    EXPIRED,
    CANCELLED
}
