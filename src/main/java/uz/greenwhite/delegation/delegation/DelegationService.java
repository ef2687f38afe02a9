package uz.greenwhite.delegation.delegation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uz.greenwhite.delegation.app.AppService;
import uz.greenwhite.delegation.exchange.ExchangeService;
import uz.greenwhite.delegation.metrics.DelegationMetrics;
import uz.greenwhite.delegation.oauth2.model.ClientConfig;
import uz.greenwhite.delegation.token.TokenService;

/**
 * Entry points of a delegation: issue the provider authorization URL,
 * then turn the provider callback into a stored token.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DelegationService {

    private final AppService appService;
    private final ExchangeService exchangeService;
    private final TokenService tokenService;
    private final DelegationMetrics metrics;

    public String start(String service, long userId) {
        ClientConfig config = appService.resolveClientConfig(service);
        String exchangeId = exchangeService.create(config.getService().getValue(), userId);

        metrics.getDelegationStarted().increment();
        log.info("Delegation started: service={}, userId={}", service, userId);

        return config.authCodeUrl(exchangeId);
    }

    public long complete(String code, String exchangeId) {
        return tokenService.create(code, exchangeId);
    }
}
