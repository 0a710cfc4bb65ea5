package com.gocomet.bustracking.common.config;

import com.gocomet.bustracking.location.guard.OverspeedPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tunables for location ingestion, waiting flags, client smoothing and the expiry sweep.
 * Bound from {@code app.realtime.*}.
 */
@Component
@ConfigurationProperties(prefix = "app.realtime")
@Getter
@Setter
public class RealtimeProperties {

    /** "redis" for multi-instance deployments, "memory" for a single instance. */
    private String stateStore = "redis";

    private AntiSpoof antiSpoof = new AntiSpoof();
    private WaitingFlag waitingFlag = new WaitingFlag();
    private Interpolation interpolation = new Interpolation();
    private Sweep sweep = new Sweep();

    @Getter
    @Setter
    public static class AntiSpoof {
        private Duration minInterval = Duration.ofSeconds(2);
        private double maxSpeedKmh = 160.0;
        private OverspeedPolicy overspeedPolicy = OverspeedPolicy.REJECT;
        private Duration stateTtl = Duration.ofMinutes(30);
    }

    @Getter
    @Setter
    public static class WaitingFlag {
        private Duration ttl = Duration.ofMinutes(15);
        private double updateDistanceMeters = 50.0;
        private Duration updateInterval = Duration.ofSeconds(8);
        private Duration updateJitter = Duration.ofSeconds(2);
        private int raiseLimit = 5;
        private Duration raiseWindow = Duration.ofMinutes(1);
    }

    @Getter
    @Setter
    public static class Interpolation {
        private Duration window = Duration.ofSeconds(5);
        private int fps = 60;
        private double teleportMeters = 500.0;
    }

    @Getter
    @Setter
    public static class Sweep {
        private long intervalMs = 30000;
        private int batchSize = 50;
    }
}
