package io.b2mash.workhub.identity;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Identity resolution settings.
 *
 * @param fallbackAccountId account bound on the soft surface when the hint is absent or unknown
 * @param apiKey shared key the soft surface requires in {@code X-API-KEY}
 * @param accountCacheSize maximum cached subject-to-account entries for the strict surface
 * @param accountCacheTtl how long a cached subject-to-account entry stays valid
 */
@ConfigurationProperties(prefix = "workhub.identity")
public record IdentityProperties(
    long fallbackAccountId, String apiKey, long accountCacheSize, Duration accountCacheTtl) {}
