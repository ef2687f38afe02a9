package uz.greenwhite.delegation.token;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import uz.greenwhite.delegation.app.AppService;
import uz.greenwhite.delegation.config.TokenProperties;
import uz.greenwhite.delegation.error.DelegationException;
import uz.greenwhite.delegation.error.ErrorCode;
import uz.greenwhite.delegation.exchange.Exchange;
import uz.greenwhite.delegation.exchange.ExchangeService;
import uz.greenwhite.delegation.metrics.DelegationMetrics;
import uz.greenwhite.delegation.oauth2.ProviderRegistry;
import uz.greenwhite.delegation.oauth2.ServiceType;
import uz.greenwhite.delegation.oauth2.client.OAuth2Client;
import uz.greenwhite.delegation.oauth2.model.ClientConfig;
import uz.greenwhite.delegation.oauth2.model.ProviderToken;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TokenServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    private TokenRepository tokenRepository;
    private ExchangeService exchangeService;
    private AppService appService;
    private OAuth2Client oAuth2Client;
    private TokenRefreshLock refreshLock;
    private DelegationMetrics metrics;
    private TokenService tokenService;

    private final ClientConfig yandexConfig = yandexConfig();

    @BeforeEach
    void setUp() {
        tokenRepository = mock(TokenRepository.class);
        exchangeService = mock(ExchangeService.class);
        appService = mock(AppService.class);
        oAuth2Client = mock(OAuth2Client.class);
        refreshLock = mock(TokenRefreshLock.class);
        metrics = new DelegationMetrics(new SimpleMeterRegistry());

        tokenService = new TokenService(tokenRepository, exchangeService, appService, oAuth2Client,
                refreshLock, new TokenProperties(), metrics, Clock.fixed(NOW, ZoneOffset.UTC));

        when(appService.resolveClientConfig("yandex")).thenReturn(yandexConfig);
        when(refreshLock.tryAcquire(anyLong(), anyString())).thenReturn(Optional.of("owner"));
        when(tokenRepository.update(any())).thenReturn(1);
    }

    // ==================== create ====================

    @Test
    void createStoresTokenAndConsumesExchange() {
        when(exchangeService.get("state")).thenReturn(exchange());
        when(oAuth2Client.exchangeCode(yandexConfig, "code"))
                .thenReturn(new ProviderToken("at", "bearer", "rt", NOW.plusSeconds(3600)));

        long userId = tokenService.create("code", "state");

        assertThat(userId).isEqualTo(42L);
        verify(exchangeService).deleteQuietly("state");

        ArgumentCaptor<Token> captor = ArgumentCaptor.forClass(Token.class);
        verify(tokenRepository).upsert(captor.capture());
        Token stored = captor.getValue();
        assertThat(stored.getUserId()).isEqualTo(42L);
        assertThat(stored.getService()).isEqualTo("yandex");
        assertThat(stored.getAccessToken()).isEqualTo("at");
        assertThat(stored.getRefreshToken()).isEqualTo("rt");
        assertThat(stored.getExpiry()).isEqualTo(NOW.plusSeconds(3600));
        assertThat(stored.getCreatedAt()).isEqualTo(NOW);
        assertThat(metrics.getDelegationCompleted().count()).isEqualTo(1.0);
    }

    @Test
    void rejectedCodeLeavesExchangeAndTokenUntouched() {
        when(exchangeService.get("state")).thenReturn(exchange());
        when(oAuth2Client.exchangeCode(yandexConfig, "bad"))
                .thenThrow(DelegationException.internal("provider rejected authorization_code grant", null));

        assertThatThrownBy(() -> tokenService.create("bad", "state"))
                .isInstanceOf(DelegationException.class);

        verify(exchangeService, never()).deleteQuietly(anyString());
        verify(tokenRepository, never()).upsert(any());
        assertThat(metrics.getDelegationFailed().count()).isEqualTo(1.0);
    }

    @Test
    void unknownStateNeverReachesProvider() {
        when(exchangeService.get("nope")).thenThrow(DelegationException.notFound("exchange not found"));

        assertThatThrownBy(() -> tokenService.create("code", "nope"))
                .isInstanceOf(DelegationException.class)
                .extracting(e -> ((DelegationException) e).getErrorCode())
                .isEqualTo(ErrorCode.NOT_FOUND);

        verifyNoInteractions(oAuth2Client, tokenRepository);
    }

    // ==================== refresh ====================

    @Test
    void refreshOfMissingTokenIsNotFoundWithoutProviderCall() {
        when(tokenRepository.find(42L, "yandex")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> tokenService.refresh(42L, "yandex"))
                .isInstanceOf(DelegationException.class)
                .hasMessage("token not found");

        verifyNoInteractions(oAuth2Client);
        assertThat(metrics.getRefreshError().count()).isEqualTo(1.0);
    }

    @Test
    void stillValidTokenIsReturnedAsIs() {
        Token valid = token("at", "rt", NOW.plus(Duration.ofMinutes(30)));
        when(tokenRepository.find(42L, "yandex")).thenReturn(Optional.of(valid));

        assertThat(tokenService.refresh(42L, "yandex")).isEqualTo(valid);

        verifyNoInteractions(oAuth2Client, refreshLock);
        assertThat(metrics.getRefreshReused().count()).isEqualTo(1.0);
    }

    @Test
    void tokenWithoutExpiryIsNeverRotated() {
        when(tokenRepository.find(42L, "yandex")).thenReturn(Optional.of(token("at", "rt", null)));

        tokenService.refresh(42L, "yandex");

        verifyNoInteractions(oAuth2Client);
    }

    @Test
    void tokenInsideExpiryMarginIsRotated() {
        Token almostExpired = token("at", "rt", NOW.plusSeconds(5));
        when(tokenRepository.find(42L, "yandex")).thenReturn(Optional.of(almostExpired));
        when(oAuth2Client.refreshAccessToken(yandexConfig, "rt"))
                .thenReturn(new ProviderToken("at-2", "bearer", "rt-2", NOW.plusSeconds(3600)));

        Token rotated = tokenService.refresh(42L, "yandex");

        assertThat(rotated.getAccessToken()).isEqualTo("at-2");
        assertThat(rotated.getRefreshToken()).isEqualTo("rt-2");
        assertThat(rotated.getExpiry()).isEqualTo(NOW.plusSeconds(3600));
        assertThat(rotated.getCreatedAt()).isEqualTo(NOW);
        verify(tokenRepository).update(rotated);
        verify(refreshLock).release(42L, "yandex", "owner");
        assertThat(metrics.getRefreshSuccess().count()).isEqualTo(1.0);
    }

    @Test
    void rotationKeepsOldRefreshTokenWhenProviderSendsNone() {
        when(tokenRepository.find(42L, "yandex")).thenReturn(Optional.of(token("at", "rt", NOW.minusSeconds(1))));
        when(oAuth2Client.refreshAccessToken(yandexConfig, "rt"))
                .thenReturn(new ProviderToken("at-2", "bearer", null, NOW.plusSeconds(3600)));

        Token rotated = tokenService.refresh(42L, "yandex");

        assertThat(rotated.getAccessToken()).isEqualTo("at-2");
        assertThat(rotated.getRefreshToken()).isEqualTo("rt");
    }

    @Test
    void expiredTokenWithoutRefreshTokenCannotBeRotated() {
        when(tokenRepository.find(42L, "yandex")).thenReturn(Optional.of(token("at", null, NOW.minusSeconds(1))));

        assertThatThrownBy(() -> tokenService.refresh(42L, "yandex"))
                .isInstanceOf(DelegationException.class)
                .extracting(e -> ((DelegationException) e).getErrorCode())
                .isEqualTo(ErrorCode.INTERNAL);

        verifyNoInteractions(oAuth2Client);
        verify(refreshLock).release(42L, "yandex", "owner");
    }

    @Test
    void providerFailureKeepsStoredTokenAndReleasesLock() {
        when(tokenRepository.find(42L, "yandex")).thenReturn(Optional.of(token("at", "rt", NOW.minusSeconds(1))));
        when(oAuth2Client.refreshAccessToken(yandexConfig, "rt"))
                .thenThrow(DelegationException.internal("provider rejected refresh_token grant", null));

        assertThatThrownBy(() -> tokenService.refresh(42L, "yandex"))
                .isInstanceOf(DelegationException.class);

        verify(tokenRepository, never()).update(any());
        verify(refreshLock).release(42L, "yandex", "owner");
    }

    @Test
    void tokenRotatedWhileWaitingForLockIsReused() {
        Token expired = token("at", "rt", NOW.minusSeconds(1));
        Token rotatedElsewhere = token("at-2", "rt-2", NOW.plusSeconds(3600));
        when(tokenRepository.find(42L, "yandex"))
                .thenReturn(Optional.of(expired))
                .thenReturn(Optional.of(rotatedElsewhere));

        assertThat(tokenService.refresh(42L, "yandex")).isEqualTo(rotatedElsewhere);

        verifyNoInteractions(oAuth2Client);
    }

    @Test
    void concurrentRefreshReturnsWinnersToken() {
        Token expired = token("at", "rt", NOW.minusSeconds(1));
        Token winner = token("at-2", "rt-2", NOW.plusSeconds(3600));
        when(tokenRepository.find(42L, "yandex"))
                .thenReturn(Optional.of(expired))
                .thenReturn(Optional.of(winner));
        when(refreshLock.tryAcquire(42L, "yandex")).thenReturn(Optional.empty());
        when(refreshLock.awaitRelease(42L, "yandex")).thenReturn(true);

        assertThat(tokenService.refresh(42L, "yandex")).isEqualTo(winner);

        verifyNoInteractions(oAuth2Client);
        verify(refreshLock, never()).release(anyLong(), anyString(), anyString());
        assertThat(metrics.getRefreshLockContended().count()).isEqualTo(1.0);
    }

    @Test
    void concurrentRefreshThatNeverFinishesIsInternal() {
        when(tokenRepository.find(42L, "yandex")).thenReturn(Optional.of(token("at", "rt", NOW.minusSeconds(1))));
        when(refreshLock.tryAcquire(42L, "yandex")).thenReturn(Optional.empty());
        when(refreshLock.awaitRelease(42L, "yandex")).thenReturn(false);

        assertThatThrownBy(() -> tokenService.refresh(42L, "yandex"))
                .isInstanceOf(DelegationException.class)
                .hasMessage("token refresh already in progress");
    }

    @Test
    void concurrentRefreshThatFailedIsInternal() {
        when(tokenRepository.find(42L, "yandex")).thenReturn(Optional.of(token("at", "rt", NOW.minusSeconds(1))));
        when(refreshLock.tryAcquire(42L, "yandex")).thenReturn(Optional.empty());
        when(refreshLock.awaitRelease(42L, "yandex")).thenReturn(true);

        assertThatThrownBy(() -> tokenService.refresh(42L, "yandex"))
                .isInstanceOf(DelegationException.class)
                .extracting(e -> ((DelegationException) e).getErrorCode())
                .isEqualTo(ErrorCode.INTERNAL);
    }

    @Test
    void tokenDeletedDuringRotationIsNotFound() {
        when(tokenRepository.find(42L, "yandex")).thenReturn(Optional.of(token("at", "rt", NOW.minusSeconds(1))));
        when(oAuth2Client.refreshAccessToken(yandexConfig, "rt"))
                .thenReturn(new ProviderToken("at-2", "bearer", "rt-2", NOW.plusSeconds(3600)));
        when(tokenRepository.update(any())).thenReturn(0);

        assertThatThrownBy(() -> tokenService.refresh(42L, "yandex"))
                .isInstanceOf(DelegationException.class)
                .extracting(e -> ((DelegationException) e).getErrorCode())
                .isEqualTo(ErrorCode.NOT_FOUND);
    }

    private static Exchange exchange() {
        return Exchange.builder()
                .id("state")
                .service("yandex")
                .userId(42L)
                .createdAt(NOW)
                .build();
    }

    private static Token token(String accessToken, String refreshToken, Instant expiry) {
        return Token.builder()
                .userId(42L)
                .service("yandex")
                .tokenType("bearer")
                .accessToken(accessToken)
                .refreshToken(refreshToken)
                .expiry(expiry)
                .createdAt(NOW.minus(Duration.ofHours(1)))
                .build();
    }

    private static ClientConfig yandexConfig() {
        ProviderRegistry registry = new ProviderRegistry();
        return ClientConfig.builder()
                .service(ServiceType.YANDEX)
                .clientId("abc")
                .clientSecret("secret")
                .scopes(registry.lookup(ServiceType.YANDEX).scopes())
                .redirectUrl("https://x/cb")
                .endpoint(registry.lookup(ServiceType.YANDEX))
                .build();
    }
}
