package uz.greenwhite.delegation.token;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import uz.greenwhite.delegation.oauth2.model.ProviderToken;

import java.time.Instant;

/**
 * Delegated grant stored for one {@code (userId, service)} pair.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Token {

    @JsonProperty("user_id")
    private long userId;

    private String service;

    @JsonProperty("token_type")
    private String tokenType;

    @ToString.Exclude
    @JsonProperty("access_token")
    private String accessToken;

    @ToString.Exclude
    @JsonProperty("refresh_token")
    private String refreshToken;

    private Instant expiry;

    @JsonProperty("created_at")
    private Instant createdAt;

    public ProviderToken toProviderToken() {
        return new ProviderToken(accessToken, tokenType, refreshToken, expiry);
    }
}
