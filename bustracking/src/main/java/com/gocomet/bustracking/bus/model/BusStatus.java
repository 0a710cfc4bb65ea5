package com.gocomet.bustracking.bus.model;

public enum BusStatus {
    IDLE,
    ACTIVE,
    ENROUTE,
    MAINTENANCE,
    OFFLINE
}
