package uz.greenwhite.delegation.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "delegation.token")
public class TokenProperties {

    /**
     * A stored token expiring within this margin is treated as expired on refresh.
     * Default: 10 seconds
     */
    private Duration expiryMargin = Duration.ofSeconds(10);
}
