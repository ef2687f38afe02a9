package uz.greenwhite.delegation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /**
     * Source of "now" for exchange expiry, token expiry and created_at stamps
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
