package uz.greenwhite.delegation.oauth2.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Token material returned by a provider token endpoint.
 * A {@code null} expiry means the provider did not announce one.
 */
public record ProviderToken(String accessToken,
                            String tokenType,
                            String refreshToken,
                            Instant expiry) {

    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public boolean isExpired(Clock clock, Duration margin) {
        if (expiry == null) {
            return false;
        }
        return !clock.instant().plus(margin).isBefore(expiry);
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }
}
