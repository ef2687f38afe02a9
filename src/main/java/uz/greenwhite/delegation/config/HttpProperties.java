package uz.greenwhite.delegation.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Transport limits for calls to provider token endpoints.
 * Provider calls are never retried; these timeouts are the only bound on a stalled provider.
 */
@Slf4j
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "delegation.http")
public class HttpProperties {

    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 15000;
    private int writeTimeoutMs = 15000;

    /**
     * Upper bound for a token endpoint response body
     */
    private int maxResponseBytes = 256 * 1024;

    /**
     * Connection pool size shared by all providers
     */
    private int maxConnections = 50;

    /**
     * How long a call waits for a free pooled connection
     */
    private long pendingAcquireTimeoutMs = 5000;

    @PostConstruct
    public void validate() {
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException("delegation.http.connect-timeout-ms must be > 0");
        }
        if (readTimeoutMs <= 0) {
            throw new IllegalArgumentException("delegation.http.read-timeout-ms must be > 0");
        }
        if (writeTimeoutMs <= 0) {
            throw new IllegalArgumentException("delegation.http.write-timeout-ms must be > 0");
        }
        if (maxResponseBytes <= 0) {
            throw new IllegalArgumentException("delegation.http.max-response-bytes must be > 0");
        }
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("delegation.http.max-connections must be > 0");
        }
        if (pendingAcquireTimeoutMs <= 0) {
            throw new IllegalArgumentException("delegation.http.pending-acquire-timeout-ms must be > 0");
        }

        log.info("Provider HTTP client config: connect={}ms, read={}ms, write={}ms",
                connectTimeoutMs, readTimeoutMs, writeTimeoutMs);
    }
}
