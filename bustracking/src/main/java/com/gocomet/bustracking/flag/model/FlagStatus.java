package com.gocomet.bustracking.flag.model;

import java.util.List;

public enum FlagStatus {
    RAISED,
    ACKNOWLEDGED,
    BOARDED,
    CANCELLED,
    EXPIRED;

    public static final List<FlagStatus> ACTIVE = List.of(RAISED, ACKNOWLEDGED);

    public boolean isActive() {
        return this == RAISED || this == ACKNOWLEDGED;
    }

    public boolean isTerminal() {
        return !isActive();
    }
}
