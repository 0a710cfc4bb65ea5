package com.gocomet.bustracking.feature;

import com.gocomet.bustracking.common.config.MissedBusProperties;
import com.gocomet.bustracking.common.config.RealtimeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Kill switch for the missed-bus flow. Maintenance applies when the feature is
 * disabled in configuration, when operators set the runtime override key, or when
 * the override cannot be read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeatureSwitchService {

    static final String MISSED_BUS_MAINTENANCE_KEY = "feature:missed-bus:maintenance";

    private final MissedBusProperties missedBusProperties;
    private final RealtimeProperties realtimeProperties;
    private final StringRedisTemplate redisTemplate;

    public boolean isMissedBusInMaintenance() {
        if (!missedBusProperties.isEnabled()) {
            return true;
        }
        if ("memory".equalsIgnoreCase(realtimeProperties.getStateStore())) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(MISSED_BUS_MAINTENANCE_KEY));
        } catch (DataAccessException e) {
            log.warn("Could not read missed-bus maintenance flag, assuming maintenance: {}", e.getMessage());
            return true;
        }
    }
}
