package com.gocomet.bustracking.missedbus.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A bus with a seat already reserved for the request.
 */
@Getter
@AllArgsConstructor
@ToString
public class MatchCandidate {

    private final String busId;
    private final String tripId;
    private final String stopName;
    private final Double distanceMeters;
}
