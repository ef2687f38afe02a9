package uz.greenwhite.delegation.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.delegation.oauth2.GrantType;
import uz.greenwhite.delegation.oauth2.ServiceType;

/**
 * Metrics for the delegation lifecycle.
 *
 * Naming convention:
 *   delegation.{stage}.{metric_type}
 *
 * Tags:
 *   result  = success | error | reused
 *   service = google | yandex | mail | vk
 *   grant   = authorization_code | refresh_token
 */
@Slf4j
@Getter
@Component
public class DelegationMetrics {

    private final MeterRegistry registry;

    // ==================== Start ====================
    private final Counter delegationStarted;

    // ==================== Complete ====================
    private final Counter delegationCompleted;
    private final Counter delegationFailed;

    // ==================== Refresh ====================
    private final Counter refreshSuccess;
    private final Counter refreshReused;
    private final Counter refreshError;
    private final Counter refreshLockContended;

    // ==================== Exchange ledger ====================
    private final Counter exchangeExpired;
    private final Counter exchangeDeleteFailed;
    private final Counter exchangeCleanupDeleted;

    public DelegationMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.delegationStarted = Counter.builder("delegation.start.total")
                .description("Authorization URLs issued")
                .register(registry);

        this.delegationCompleted = Counter.builder("delegation.complete.total")
                .description("Provider callbacks handled")
                .tag("result", "success")
                .register(registry);

        this.delegationFailed = Counter.builder("delegation.complete.total")
                .description("Provider callbacks handled")
                .tag("result", "error")
                .register(registry);

        this.refreshSuccess = Counter.builder("delegation.token.refresh.total")
                .description("Token refresh calls")
                .tag("result", "success")
                .register(registry);

        this.refreshReused = Counter.builder("delegation.token.refresh.total")
                .description("Token refresh calls")
                .tag("result", "reused")
                .register(registry);

        this.refreshError = Counter.builder("delegation.token.refresh.total")
                .description("Token refresh calls")
                .tag("result", "error")
                .register(registry);

        this.refreshLockContended = Counter.builder("delegation.token.refresh.lock.contended")
                .description("Refresh calls that waited for another holder of the key lock")
                .register(registry);

        this.exchangeExpired = Counter.builder("delegation.exchange.expired")
                .description("Exchanges rejected on read because their TTL elapsed")
                .register(registry);

        this.exchangeDeleteFailed = Counter.builder("delegation.exchange.delete.failed")
                .description("Best-effort exchange deletions that failed")
                .register(registry);

        this.exchangeCleanupDeleted = Counter.builder("delegation.exchange.cleanup.deleted")
                .description("Expired exchanges removed by the cleanup job")
                .register(registry);

        log.info("Delegation metrics registered");
    }

    /**
     * Timer for one provider token endpoint call
     */
    public Timer providerTimer(ServiceType service, GrantType grant) {
        return Timer.builder("delegation.provider.request.duration")
                .description("Provider token endpoint call duration")
                .tag("service", service.getValue())
                .tag("grant", grant.getValue())
                .register(registry);
    }
}
