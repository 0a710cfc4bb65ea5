package com.gocomet.bustracking.config;

import com.gocomet.bustracking.common.config.MissedBusProperties;
import com.gocomet.bustracking.common.config.RealtimeProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/v1/config")
@RequiredArgsConstructor
public class ConfigController {

    private final RealtimeProperties realtimeProperties;
    private final MissedBusProperties missedBusProperties;

    /**
     * GET /v1/config/realtime: Client tunables, so devices pace and animate the way the server expects.
     */
    @GetMapping("/realtime")
    public ResponseEntity<Map<String, Object>> getRealtimeConfig() {
        RealtimeProperties.WaitingFlag flag = realtimeProperties.getWaitingFlag();
        RealtimeProperties.Interpolation interpolation = realtimeProperties.getInterpolation();

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("flagUpdateIntervalMs", flag.getUpdateInterval().toMillis());
        config.put("flagUpdateJitterMs", flag.getUpdateJitter().toMillis());
        config.put("flagUpdateDistanceMeters", flag.getUpdateDistanceMeters());
        config.put("flagTtlMs", flag.getTtl().toMillis());
        config.put("missedBusRequestTtlMs", missedBusProperties.getRequestTtl().toMillis());
        config.put("missedBusEnabled", missedBusProperties.isEnabled());
        config.put("interpolationWindowMs", interpolation.getWindow().toMillis());
        config.put("interpolationFps", interpolation.getFps());
        config.put("teleportThresholdMeters", interpolation.getTeleportMeters());
        config.put("locationMinIntervalMs", realtimeProperties.getAntiSpoof().getMinInterval().toMillis());
        return ResponseEntity.ok(config);
    }
}
