package com.positionengine.config;

import java.time.Duration;
import org.springframework.context.annotation.Configuration;

/**
 * Redis key layout for the persistent classification tier.
 *
 * <p>Connection settings come from Spring Boot's {@code spring.data.redis.*} auto-configuration;
 * the repository uses the auto-configured {@code StringRedisTemplate} and stores JSON values.
 *
 * <p>Key patterns:
 * <ul>
 *   <li>{@code pce:classification:{ticker}} - one cache entry as JSON</li>
 *   <li>{@code pce:classification:resolved-at} - sorted set of tickers scored by resolve time</li>
 * </ul>
 */
@Configuration
public class RedisConfig {

    public static final String KEY_PREFIX = "pce:";
    public static final String CLASSIFICATION_KEY = KEY_PREFIX + "classification:";
    public static final String CLASSIFICATION_INDEX_KEY = CLASSIFICATION_KEY + "resolved-at";

    /** Redis expiry for entries; logical staleness is decided by each entry's own ttl. */
    public static final Duration CLASSIFICATION_RETENTION = Duration.ofDays(365);
}
