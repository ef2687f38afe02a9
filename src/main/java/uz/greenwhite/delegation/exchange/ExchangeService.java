package uz.greenwhite.delegation.exchange;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import uz.greenwhite.delegation.config.ExchangeProperties;
import uz.greenwhite.delegation.error.DelegationException;
import uz.greenwhite.delegation.metrics.DelegationMetrics;
import uz.greenwhite.delegation.util.RandomStrings;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Ledger of single-use exchanges created when an authorization URL is issued
 * and consumed when the provider calls back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExchangeService {

    private final ExchangeRepository exchangeRepository;
    private final ExchangeProperties exchangeProperties;
    private final DelegationMetrics metrics;
    private final Clock clock;

    /**
     * Mint a new exchange for {@code (service, userId)}.
     *
     * @return the exchange id, used as OAuth2 state
     */
    public String create(String service, long userId) {
        Exchange exchange = Exchange.builder()
                .id(RandomStrings.alphanumeric(exchangeProperties.getIdLength()))
                .service(service)
                .userId(userId)
                .createdAt(clock.instant())
                .build();

        try {
            exchangeRepository.insert(exchange);
        } catch (DataAccessException e) {
            throw DelegationException.internal("failed to create exchange", e);
        }

        log.debug("Exchange created: service={}, userId={}", service, userId);
        return exchange.getId();
    }

    /**
     * @throws DelegationException NOT_FOUND when absent, consumed or expired
     */
    public Exchange get(String id) {
        Optional<Exchange> found;
        try {
            found = exchangeRepository.findById(id);
        } catch (DataAccessException e) {
            throw DelegationException.internal("failed to read exchange", e);
        }

        Exchange exchange = found.orElseThrow(() -> DelegationException.notFound("exchange not found"));

        if (isExpired(exchange)) {
            metrics.getExchangeExpired().increment();
            log.info("Exchange expired: service={}, userId={}, createdAt={}",
                    exchange.getService(), exchange.getUserId(), exchange.getCreatedAt());
            deleteQuietly(id);
            throw DelegationException.notFound("exchange not found");
        }

        return exchange;
    }

    /**
     * Idempotent: removing a missing exchange is a no-op.
     */
    public void delete(String id) {
        try {
            exchangeRepository.deleteById(id);
        } catch (DataAccessException e) {
            throw DelegationException.internal("failed to delete exchange", e);
        }
    }

    /**
     * Best-effort removal. A failure leaves a row that can no longer complete a grant.
     */
    public void deleteQuietly(String id) {
        try {
            delete(id);
        } catch (DelegationException e) {
            metrics.getExchangeDeleteFailed().increment();
            log.warn("Failed to delete consumed exchange: {}", e.getCause() != null
                    ? e.getCause().getMessage() : e.getMessage());
        }
    }

    /**
     * Remove every exchange older than the configured TTL.
     *
     * @return number of rows removed
     */
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(exchangeProperties.getTtl());
        try {
            return exchangeRepository.deleteCreatedBefore(cutoff);
        } catch (DataAccessException e) {
            throw DelegationException.internal("failed to purge expired exchanges", e);
        }
    }

    private boolean isExpired(Exchange exchange) {
        if (exchange.getCreatedAt() == null) {
            return false;
        }
        return exchange.getCreatedAt().plus(exchangeProperties.getTtl()).isBefore(clock.instant());
    }
}
