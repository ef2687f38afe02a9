package uz.greenwhite.delegation.oauth2.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ProviderEndpoint(@JsonProperty("auth_url") String authUrl,
                               @JsonProperty("token_url") String tokenUrl,
                               @JsonProperty("scopes") List<String> scopes) {

    public ProviderEndpoint {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }
}
