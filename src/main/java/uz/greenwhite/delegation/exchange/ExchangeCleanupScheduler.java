package uz.greenwhite.delegation.exchange;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uz.greenwhite.delegation.metrics.DelegationMetrics;

/**
 * Deletes exchanges that were issued but never redeemed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "delegation.exchange.cleanup.enabled", havingValue = "true", matchIfMissing = true)
public class ExchangeCleanupScheduler {

    private final ExchangeService exchangeService;
    private final DelegationMetrics metrics;

    @Scheduled(fixedDelayString = "${delegation.exchange.cleanup.interval-ms:60000}",
            initialDelayString = "${delegation.exchange.cleanup.initial-delay-ms:60000}")
    public void purgeExpired() {
        try {
            int deleted = exchangeService.purgeExpired();
            if (deleted > 0) {
                metrics.getExchangeCleanupDeleted().increment(deleted);
                log.info("Expired exchanges removed: {}", deleted);
            }
        } catch (Exception e) {
            log.error("Exchange cleanup failed: {}", e.getMessage(), e);
        }
    }
}
