package uz.greenwhite.delegation.token;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import uz.greenwhite.delegation.app.AppService;
import uz.greenwhite.delegation.config.TokenProperties;
import uz.greenwhite.delegation.error.DelegationException;
import uz.greenwhite.delegation.exchange.Exchange;
import uz.greenwhite.delegation.exchange.ExchangeService;
import uz.greenwhite.delegation.metrics.DelegationMetrics;
import uz.greenwhite.delegation.oauth2.client.OAuth2Client;
import uz.greenwhite.delegation.oauth2.model.ClientConfig;
import uz.greenwhite.delegation.oauth2.model.ProviderToken;

import java.time.Clock;
import java.util.Optional;

/**
 * Stores delegated tokens and drives their two transitions:
 * creation from an authorization code and rotation through the refresh token.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenService {

    private final TokenRepository tokenRepository;
    private final ExchangeService exchangeService;
    private final AppService appService;
    private final OAuth2Client oAuth2Client;
    private final TokenRefreshLock refreshLock;
    private final TokenProperties tokenProperties;
    private final DelegationMetrics metrics;
    private final Clock clock;

    public Token get(long userId, String service) {
        Optional<Token> token;
        try {
            token = tokenRepository.find(userId, service);
        } catch (DataAccessException e) {
            throw DelegationException.internal("failed to read token", e);
        }
        return token.orElseThrow(() -> DelegationException.notFound("token not found"));
    }

    /**
     * Redeem {@code code} for the exchange {@code exchangeId} and store the resulting token.
     * The exchange is deleted once the provider accepted the code; a failed grant leaves it in place.
     *
     * @return id of the user the exchange was issued for
     */
    public long create(String code, String exchangeId) {
        try {
            Exchange exchange = exchangeService.get(exchangeId);
            ClientConfig config = appService.resolveClientConfig(exchange.getService());

            ProviderToken providerToken = oAuth2Client.exchangeCode(config, code);

            exchangeService.deleteQuietly(exchangeId);

            Token token = Token.builder()
                    .userId(exchange.getUserId())
                    .service(exchange.getService())
                    .tokenType(providerToken.tokenType())
                    .accessToken(providerToken.accessToken())
                    .refreshToken(providerToken.refreshToken())
                    .expiry(providerToken.expiry())
                    .createdAt(clock.instant())
                    .build();

            try {
                tokenRepository.upsert(token);
            } catch (DataAccessException e) {
                throw DelegationException.internal("failed to store token", e);
            }

            metrics.getDelegationCompleted().increment();
            log.info("Delegation completed: userId={}, service={}", token.getUserId(), token.getService());
            return exchange.getUserId();

        } catch (DelegationException e) {
            metrics.getDelegationFailed().increment();
            throw e;
        }
    }

    /**
     * Rotate the stored token through the provider. A token that is still valid is returned
     * without a provider call. Concurrent refreshes of one key are serialized; the loser returns
     * the token stored by the winner.
     *
     * @return the token as stored after the refresh
     */
    public Token refresh(long userId, String service) {
        try {
            Token stored = get(userId, service);
            if (isFresh(stored)) {
                metrics.getRefreshReused().increment();
                return stored;
            }

            Optional<String> lease = acquire(userId, service);
            if (lease.isEmpty()) {
                return awaitConcurrentRefresh(userId, service);
            }

            try {
                // Another instance may have rotated the token between the first read and the lock.
                Token current = get(userId, service);
                if (isFresh(current)) {
                    metrics.getRefreshReused().increment();
                    return current;
                }
                return rotate(current);
            } finally {
                refreshLock.release(userId, service, lease.get());
            }

        } catch (DelegationException e) {
            metrics.getRefreshError().increment();
            throw e;
        }
    }

    private Token rotate(Token current) {
        if (!current.toProviderToken().hasRefreshToken()) {
            throw DelegationException.internal("token expired and refresh token is not set", null);
        }

        ClientConfig config = appService.resolveClientConfig(current.getService());
        ProviderToken fresh = oAuth2Client.refreshAccessToken(config, current.getRefreshToken());

        Token rotated = current.toBuilder()
                .tokenType(fresh.tokenType())
                .accessToken(fresh.accessToken())
                .refreshToken(fresh.hasRefreshToken() ? fresh.refreshToken() : current.getRefreshToken())
                .expiry(fresh.expiry())
                .createdAt(clock.instant())
                .build();

        int updated;
        try {
            updated = tokenRepository.update(rotated);
        } catch (DataAccessException e) {
            throw DelegationException.internal("failed to store refreshed token", e);
        }
        if (updated == 0) {
            throw DelegationException.notFound("token not found");
        }

        metrics.getRefreshSuccess().increment();
        log.info("Token refreshed: userId={}, service={}", rotated.getUserId(), rotated.getService());
        return rotated;
    }

    private Optional<String> acquire(long userId, String service) {
        try {
            return refreshLock.tryAcquire(userId, service);
        } catch (DataAccessException e) {
            throw DelegationException.internal("refresh lock unavailable", e);
        }
    }

    private Token awaitConcurrentRefresh(long userId, String service) {
        metrics.getRefreshLockContended().increment();
        log.debug("Refresh of {}:{} in progress elsewhere, waiting", userId, service);

        boolean released;
        try {
            released = refreshLock.awaitRelease(userId, service);
        } catch (DataAccessException e) {
            throw DelegationException.internal("refresh lock unavailable", e);
        }
        if (!released) {
            throw DelegationException.internal("token refresh already in progress", null);
        }

        Token token = get(userId, service);
        if (!isFresh(token)) {
            throw DelegationException.internal("concurrent refresh did not produce a valid token", null);
        }
        return token;
    }

    private boolean isFresh(Token token) {
        return !token.toProviderToken().isExpired(clock, tokenProperties.getExpiryMargin());
    }
}
