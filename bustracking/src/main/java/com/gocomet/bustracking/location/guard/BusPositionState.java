package com.gocomet.bustracking.location.guard;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Last accepted fix for a bus: the tuple the guard compares new samples against.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class BusPositionState {

    private final double latitude;
    private final double longitude;
    private final long timestampMillis;
}
