package uz.greenwhite.delegation.exchange;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Pending authorization: binds the OAuth2 {@code state} to the user who started it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Exchange {

    private String id;

    private String service;

    @JsonProperty("user_id")
    private long userId;

    @JsonProperty("created_at")
    private Instant createdAt;
}
