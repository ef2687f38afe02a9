package uz.greenwhite.delegation.oauth2.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import uz.greenwhite.delegation.error.DelegationException;
import uz.greenwhite.delegation.metrics.DelegationMetrics;
import uz.greenwhite.delegation.oauth2.GrantType;
import uz.greenwhite.delegation.oauth2.model.ClientConfig;
import uz.greenwhite.delegation.oauth2.model.ProviderToken;

import java.time.Clock;
import java.time.Instant;

/**
 * Talks to provider token endpoints with form-encoded requests, client credentials in the body.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebClientOAuth2Client implements OAuth2Client {

    private static final String CB_PREFIX = "provider-";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final DelegationMetrics metrics;
    private final Clock clock;

    @Override
    public ProviderToken exchangeCode(ClientConfig config, String code) {
        MultiValueMap<String, String> form = baseForm(GrantType.AUTHORIZATION_CODE, config);
        form.add("code", code);
        if (config.getRedirectUrl() != null && !config.getRedirectUrl().isBlank()) {
            form.add("redirect_uri", config.getRedirectUrl());
        }

        return sendTokenRequest(config, GrantType.AUTHORIZATION_CODE, form);
    }

    @Override
    public ProviderToken refreshAccessToken(ClientConfig config, String refreshToken) {
        MultiValueMap<String, String> form = baseForm(GrantType.REFRESH_TOKEN, config);
        form.add("refresh_token", refreshToken);

        return sendTokenRequest(config, GrantType.REFRESH_TOKEN, form);
    }

    private MultiValueMap<String, String> baseForm(GrantType grantType, ClientConfig config) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", grantType.getValue());
        form.add("client_id", config.getClientId());
        form.add("client_secret", config.getClientSecret());
        return form;
    }

    private ProviderToken sendTokenRequest(ClientConfig config, GrantType grantType,
                                           MultiValueMap<String, String> form) {
        String tokenUrl = config.getEndpoint().tokenUrl();
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(
                CB_PREFIX + config.getService().getValue());
        Timer.Sample sample = Timer.start(metrics.getRegistry());

        try {
            String responseBody = circuitBreaker.executeSupplier(() -> post(tokenUrl, form));
            return parseToken(responseBody);

        } catch (CallNotPermittedException e) {
            log.warn("Circuit breaker [{}] open, {} call to {} rejected",
                    circuitBreaker.getName(), grantType.getValue(), tokenUrl);
            throw DelegationException.internal("provider temporarily unavailable: " + config.getService().getValue(), e);
        } catch (ProviderRejectedException e) {
            log.warn("Provider {} rejected {} grant: status={}, {}",
                    config.getService().getValue(), grantType.getValue(), e.getStatus(), e.getMessage());
            throw DelegationException.internal("provider rejected " + grantType.getValue() + " grant", e);
        } catch (DelegationException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to call token endpoint {}: {}", tokenUrl, e.getMessage());
            throw DelegationException.internal("token endpoint call failed", e);
        } finally {
            sample.stop(metrics.providerTimer(config.getService(), grantType));
        }
    }

    private String post(String tokenUrl, MultiValueMap<String, String> form) {
        return webClient.post()
                .uri(tokenUrl)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromFormData(form))
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> {
                            int status = response.statusCode().value();
                            if (response.statusCode().is4xxClientError()) {
                                throw new ProviderRejectedException(status, errorOf(body));
                            }
                            if (response.statusCode().isError()) {
                                throw new IllegalStateException("token endpoint returned HTTP " + status);
                            }
                            return body;
                        }))
                .block();
    }

    ProviderToken parseToken(String responseBody) {
        JsonNode json;
        try {
            json = objectMapper.readTree(responseBody == null ? "" : responseBody);
        } catch (Exception e) {
            log.error("Failed to parse token response: {}", e.getMessage());
            throw DelegationException.internal("malformed token response", e);
        }

        if (json == null || !json.isObject()) {
            throw DelegationException.internal("malformed token response", null);
        }

        if (json.hasNonNull("error")) {
            throw new ProviderRejectedException(200, errorOf(responseBody));
        }

        String accessToken = text(json, "access_token");
        if (accessToken == null) {
            throw DelegationException.internal("server response missing access_token", null);
        }

        String tokenType = text(json, "token_type");
        long expiresIn = json.path("expires_in").asLong(0);
        Instant expiry = expiresIn > 0 ? clock.instant().plusSeconds(expiresIn) : null;

        return new ProviderToken(
                accessToken,
                tokenType != null ? tokenType : ProviderToken.DEFAULT_TOKEN_TYPE,
                text(json, "refresh_token"),
                expiry
        );
    }

    private String errorOf(String body) {
        try {
            JsonNode json = objectMapper.readTree(body);
            if (json != null && json.hasNonNull("error")) {
                String description = text(json, "error_description");
                return description == null
                        ? json.get("error").asText()
                        : json.get("error").asText() + ": " + description;
            }
        } catch (Exception e) {
            log.debug("Token endpoint error body is not JSON: {}", e.getMessage());
        }
        return "unrecognized error response";
    }

    private static String text(JsonNode json, String field) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
