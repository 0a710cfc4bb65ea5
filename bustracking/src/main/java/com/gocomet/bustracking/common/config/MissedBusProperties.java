package com.gocomet.bustracking.common.config;

import com.gocomet.bustracking.missedbus.model.NoCandidatePolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app.missed-bus")
@Getter
@Setter
public class MissedBusProperties {

    private boolean enabled = true;

    private Duration requestTtl = Duration.ofMinutes(15);

    private int rateLimitMax = 3;

    private Duration rateLimitWindow = Duration.ofHours(24);

    private NoCandidatePolicy noCandidatePolicy = NoCandidatePolicy.KEEP_PENDING;

    private double nearbyRadiusKm = 5.0;

    /** Candidates whose last position is older than this are skipped. */
    private Duration locationStaleness = Duration.ofMinutes(5);
}
