package uz.greenwhite.delegation.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Slf4j
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "delegation.exchange")
public class ExchangeProperties {

    /**
     * How long an issued authorization URL stays redeemable.
     * Default: 10 minutes
     */
    private Duration ttl = Duration.ofMinutes(10);

    /**
     * Length of the random exchange id sent as OAuth2 state.
     * Default: 32 characters
     */
    private int idLength = 32;

    @PostConstruct
    public void validate() {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("delegation.exchange.ttl must be positive");
        }
        if (idLength < 16) {
            throw new IllegalArgumentException("delegation.exchange.id-length must be >= 16");
        }
        log.info("Exchange ledger config: ttl={}, idLength={}", ttl, idLength);
    }
}
