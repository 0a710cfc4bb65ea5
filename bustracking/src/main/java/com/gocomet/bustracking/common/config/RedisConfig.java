package com.gocomet.bustracking.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.scripting.support.ResourceScriptSource;

/**
 * Lua scripts backing the shared keyed state. Each script runs atomically on the
 * Redis server, so concurrent instances see a single read-modify-write per key.
 */
@Configuration
public class RedisConfig {

    /**
     * KEYS[1] = bus position hash; ARGV = expectedTs, lat, lng, ts, ttlMillis.
     * Returns 1 when the stored timestamp still matched and the new tuple was written.
     */
    @Bean
    public RedisScript<Long> positionCompareAndSetScript() {
        DefaultRedisScript<Long> script = new DefaultRedisScript<>();
        script.setScriptSource(new ResourceScriptSource(new ClassPathResource("scripts/position-cas.lua")));
        script.setResultType(Long.class);
        return script;
    }

    /**
     * KEYS[1] = per-caller ZSET; ARGV = nowMillis, windowMillis, limit, member.
     * Returns 1 when the hit was recorded, 0 when the window is already full.
     */
    @Bean
    public RedisScript<Long> slidingWindowScript() {
        DefaultRedisScript<Long> script = new DefaultRedisScript<>();
        script.setScriptSource(new ResourceScriptSource(new ClassPathResource("scripts/sliding-window.lua")));
        script.setResultType(Long.class);
        return script;
    }
}
