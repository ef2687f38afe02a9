package uz.greenwhite.delegation.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class ProviderWebClientConfig {

    static final String POOL_NAME = "oauth2-providers";

    private final HttpProperties httpProperties;

    /**
     * Client for provider token endpoints. Runs on its own connection pool;
     * response bodies above {@code delegation.http.max-response-bytes} fail the call.
     */
    @Bean
    public WebClient providerWebClient() {
        ConnectionProvider pool = ConnectionProvider.builder(POOL_NAME)
                .maxConnections(httpProperties.getMaxConnections())
                .pendingAcquireTimeout(Duration.ofMillis(httpProperties.getPendingAcquireTimeoutMs()))
                .build();

        HttpClient httpClient = HttpClient.create(pool)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, httpProperties.getConnectTimeoutMs())
                .responseTimeout(Duration.ofMillis(httpProperties.getReadTimeoutMs()))
                .doOnConnected(connection -> connection.addHandlerLast(
                        new WriteTimeoutHandler(httpProperties.getWriteTimeoutMs(), TimeUnit.MILLISECONDS)));

        log.info("Provider WebClient pool '{}': maxConnections={}", POOL_NAME, httpProperties.getMaxConnections());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(httpProperties.getMaxResponseBytes()))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
