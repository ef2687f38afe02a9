package uz.greenwhite.delegation.oauth2.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.springframework.web.util.UriComponentsBuilder;
import uz.greenwhite.delegation.oauth2.ServiceType;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ready-to-use OAuth2 client settings: an enabled App joined with its provider endpoint.
 */
@Getter
@Builder
@ToString(exclude = "clientSecret")
public class ClientConfig {

    private final ServiceType service;
    private final String clientId;
    private final String clientSecret;
    private final List<String> scopes;
    private final String redirectUrl;
    private final ProviderEndpoint endpoint;

    /**
     * Authorization URL the user is sent to; {@code state} comes back on the callback.
     */
    public String authCodeUrl(String state) {
        Map<String, String> variables = new HashMap<>();
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(endpoint.authUrl())
                .queryParam("client_id", "{clientId}");
        variables.put("clientId", clientId);

        if (redirectUrl != null && !redirectUrl.isBlank()) {
            builder.queryParam("redirect_uri", "{redirectUri}");
            variables.put("redirectUri", redirectUrl);
        }

        builder.queryParam("response_type", "code");

        if (scopes != null && !scopes.isEmpty()) {
            builder.queryParam("scope", "{scope}");
            variables.put("scope", String.join(" ", scopes));
        }

        builder.queryParam("state", "{state}");
        variables.put("state", state);

        return builder.encode()
                .buildAndExpand(variables)
                .toUriString();
    }
}
