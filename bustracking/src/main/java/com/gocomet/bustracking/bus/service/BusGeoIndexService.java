package com.gocomet.bustracking.bus.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.geo.*;
import org.springframework.data.redis.connection.RedisGeoCommands;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Redis GEO index of buses that reported recently. A bus drops out of nearby
 * searches once its liveness key expires, even if its GEO member is still present.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BusGeoIndexService {

    private final StringRedisTemplate redisTemplate;

    private static final String BUS_LOCATIONS_KEY = "bus:locations";
    private static final String BUS_LIVE_PREFIX = "bus:live:";
    private static final int LIVENESS_TTL_SECONDS = 60;
    private static final int MAX_RESULTS = 20;

    public void updateBusLocation(String busId, String routeId, double lat, double lng) {
        // Redis GEO uses (longitude, latitude) order
        redisTemplate.opsForGeo().add(BUS_LOCATIONS_KEY, new Point(lng, lat), busId);
        redisTemplate.opsForValue().set(BUS_LIVE_PREFIX + busId, routeId, LIVENESS_TTL_SECONDS, TimeUnit.SECONDS);
        log.debug("Indexed bus {} at ({}, {})", busId, lat, lng);
    }

    /**
     * Live buses within the radius, nearest first.
     */
    public List<String> findNearbyBuses(double lat, double lng, double radiusKm) {
        GeoResults<RedisGeoCommands.GeoLocation<String>> results = redisTemplate.opsForGeo()
                .radius(BUS_LOCATIONS_KEY,
                        new Circle(new Point(lng, lat), new Distance(radiusKm, Metrics.KILOMETERS)),
                        RedisGeoCommands.GeoRadiusCommandArgs.newGeoRadiusArgs()
                                .sortAscending()
                                .limit(MAX_RESULTS));

        if (results == null) {
            return new ArrayList<>();
        }

        List<String> nearby = new ArrayList<>();
        for (GeoResult<RedisGeoCommands.GeoLocation<String>> result : results) {
            String busId = result.getContent().getName();
            if (Boolean.TRUE.equals(redisTemplate.hasKey(BUS_LIVE_PREFIX + busId))) {
                nearby.add(busId);
            }
        }
        log.debug("Found {} live buses within {} km of ({}, {})", nearby.size(), radiusKm, lat, lng);
        return nearby;
    }
}
