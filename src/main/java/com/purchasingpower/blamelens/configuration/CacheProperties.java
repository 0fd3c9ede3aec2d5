package com.purchasingpower.blamelens.configuration;

import lombok.Data;

import java.time.Duration;

/**
 * Commit to change-request cache settings.
 *
 * <p>A TTL of zero or less disables caching entirely; lookups then always go to the provider.
 */
@Data
public class CacheProperties {

    private long ttlSeconds = 3600;

    public Duration getTtl() {
        return Duration.ofSeconds(ttlSeconds);
    }
}
