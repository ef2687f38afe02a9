package uz.greenwhite.delegation.app;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * OAuth2 client registered at one provider. {@code id} is the provider-issued client id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class App {

    private String id;

    private String service;

    @ToString.Exclude
    @JsonProperty(value = "password", access = JsonProperty.Access.WRITE_ONLY)
    private String password;

    @JsonProperty("callback_URL")
    private String callbackUrl;

    private Instant expiry;

    @JsonProperty(value = "created_at", access = JsonProperty.Access.READ_ONLY)
    private Instant createdAt;

    private AppStatus status;
}
