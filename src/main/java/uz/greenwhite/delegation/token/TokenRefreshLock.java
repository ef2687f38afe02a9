package uz.greenwhite.delegation.token;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;
import uz.greenwhite.delegation.config.HttpProperties;
import uz.greenwhite.delegation.config.RedisProperties;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Distributed single-writer lock per {@code (userId, service)} for token refresh.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TokenRefreshLock {

    private static final String LOCK_KEY_PREFIX = "delegation:refresh-lock:";

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final RedisProperties redisProperties;
    private final HttpProperties httpProperties;

    /**
     * A waiting refresh must outlast the holder's provider call, and so must the lock itself.
     */
    @PostConstruct
    void validateWaitBudget() {
        long providerCallMs = (long) httpProperties.getConnectTimeoutMs() + httpProperties.getReadTimeoutMs();
        long waitBudgetMs = redisProperties.getLockWaitAttempts() * redisProperties.getLockWaitIntervalMs();

        if (waitBudgetMs < providerCallMs) {
            throw new IllegalStateException("delegation.redis lock wait budget " + waitBudgetMs
                    + "ms is shorter than provider connect + read timeout " + providerCallMs + "ms");
        }
        if (redisProperties.getLockTtlSeconds() * 1000 < providerCallMs) {
            throw new IllegalStateException("delegation.redis.lock-ttl-seconds " + redisProperties.getLockTtlSeconds()
                    + "s is shorter than provider connect + read timeout " + providerCallMs + "ms");
        }
        log.info("Refresh lock config: ttl={}s, wait={}ms", redisProperties.getLockTtlSeconds(), waitBudgetMs);
    }

    /**
     * @return owner token to pass to {@link #release}, empty when another holder has the key
     */
    public Optional<String> tryAcquire(long userId, String service) {
        String owner = UUID.randomUUID().toString();
        Boolean acquired = redisTemplate.opsForValue()
                .setIfAbsent(key(userId, service), owner, Duration.ofSeconds(redisProperties.getLockTtlSeconds()));

        if (Boolean.TRUE.equals(acquired)) {
            log.debug("Refresh lock acquired: {}:{}", userId, service);
            return Optional.of(owner);
        }
        log.debug("Refresh lock busy: {}:{}", userId, service);
        return Optional.empty();
    }

    /**
     * Release only if still owned; an expired and re-acquired lock is left alone.
     */
    public void release(long userId, String service, String owner) {
        try {
            redisTemplate.execute(RELEASE_SCRIPT, List.of(key(userId, service)), owner);
            log.debug("Refresh lock released: {}:{}", userId, service);
        } catch (Exception e) {
            log.warn("Failed to release refresh lock {}:{}, it expires in {}s: {}",
                    userId, service, redisProperties.getLockTtlSeconds(), e.getMessage());
        }
    }

    /**
     * Poll until the current holder releases the key.
     *
     * @return true once released, false when the wait budget ran out or the thread was interrupted
     */
    public boolean awaitRelease(long userId, String service) {
        String key = key(userId, service);
        for (int i = 0; i < redisProperties.getLockWaitAttempts(); i++) {
            try {
                Thread.sleep(redisProperties.getLockWaitIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
            if (!Boolean.TRUE.equals(redisTemplate.hasKey(key))) {
                return true;
            }
        }
        return false;
    }

    private static String key(long userId, String service) {
        return LOCK_KEY_PREFIX + userId + ":" + service;
    }
}
