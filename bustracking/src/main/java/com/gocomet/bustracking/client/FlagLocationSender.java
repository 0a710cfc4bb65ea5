package com.gocomet.bustracking.client;

import com.gocomet.bustracking.common.geo.GeoPoint;

import java.util.UUID;

@FunctionalInterface
public interface FlagLocationSender {

    void send(UUID flagId, GeoPoint location);
}
