package uz.greenwhite.delegation.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "delegation.redis")
public class RedisProperties {

    /**
     * Refresh lock TTL in seconds.
     * Lock auto-expires after this time so a crashed holder cannot block a key forever.
     * Default: 30 seconds
     */
    private long lockTtlSeconds = 30;

    /**
     * How many times a refresh that lost the lock polls for its release.
     * Attempts x interval must cover the provider connect + read timeout.
     * Default: 110 (22 seconds at the default interval)
     */
    private int lockWaitAttempts = 110;

    /**
     * Pause between two polls in milliseconds.
     * Default: 200
     */
    private long lockWaitIntervalMs = 200;
}
