package com.gocomet.bustracking.missedbus.model;

public enum RaiseStage {
    MAINTENANCE,
    RATE_LIMITED,
    DUPLICATE,
    CREATED
}
