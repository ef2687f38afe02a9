package uz.greenwhite.delegation.oauth2.client;

import lombok.Getter;

/**
 * The provider answered but refused the grant (4xx or an OAuth2 error body).
 * Not counted as a provider outage by the circuit breaker.
 */
@Getter
public class ProviderRejectedException extends RuntimeException {

    private final int status;

    public ProviderRejectedException(int status, String message) {
        super(message);
        this.status = status;
    }
}
