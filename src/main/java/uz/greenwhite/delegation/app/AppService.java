package uz.greenwhite.delegation.app;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import uz.greenwhite.delegation.error.DelegationException;
import uz.greenwhite.delegation.error.ErrorCode;
import uz.greenwhite.delegation.oauth2.ProviderRegistry;
import uz.greenwhite.delegation.oauth2.ServiceType;
import uz.greenwhite.delegation.oauth2.model.ClientConfig;
import uz.greenwhite.delegation.oauth2.model.ProviderEndpoint;
import uz.greenwhite.delegation.validation.AppValidator;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Directory of registered OAuth2 client apps. Every call reads storage; nothing is cached,
 * so status changes apply to the next request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppService {

    private final AppRepository appRepository;
    private final ProviderRegistry providerRegistry;
    private final AppValidator appValidator;
    private final Clock clock;

    public App resolveById(String id) {
        return read(() -> appRepository.findById(id))
                .orElseThrow(() -> DelegationException.notFound("app not found"));
    }

    /**
     * Enabled App serving {@code service}
     */
    public App resolveByService(String service) {
        return read(() -> appRepository.findEnabledByService(service))
                .orElseThrow(() -> DelegationException.notFound("app not found"));
    }

    /**
     * Enabled App for {@code service} joined with its provider endpoint.
     *
     * @throws DelegationException NOT_FOUND without an enabled App,
     *                             SERVICE_UNSUPPORTED when the App's service has no provider
     */
    public ClientConfig resolveClientConfig(String service) {
        App app = resolveByService(service);

        ServiceType type = providerRegistry.resolveType(app.getService());
        ProviderEndpoint endpoint = providerRegistry.lookup(type);

        return ClientConfig.builder()
                .service(type)
                .clientId(app.getId())
                .clientSecret(app.getPassword())
                .scopes(endpoint.scopes())
                .redirectUrl(app.getCallbackUrl())
                .endpoint(endpoint)
                .build();
    }

    public String create(App app) {
        Map<String, String> errors = appValidator.validate(app);
        if (!errors.isEmpty()) {
            throw new DelegationException(ErrorCode.VALIDATION_FAILED, "app validation failed", errors, null);
        }

        app.setCreatedAt(clock.instant());

        try {
            appRepository.insert(app);
        } catch (DuplicateKeyException e) {
            log.debug("App {} already registered", app.getId());
            throw new DelegationException(ErrorCode.ALREADY_EXISTS, "app exists", e);
        } catch (DataAccessException e) {
            throw DelegationException.internal("failed to create app " + app.getId(), e);
        }

        log.info("App registered: id={}, service={}, status={}",
                app.getId(), app.getService(), app.getStatus().getValue());
        return app.getId();
    }

    public App setStatus(String id, String status) {
        AppStatus newStatus = AppStatus.parse(status);

        App app = read(() -> appRepository.updateStatus(id, newStatus))
                .orElseThrow(() -> DelegationException.notFound("app not found"));

        log.info("App status updated: id={}, status={}", id, newStatus.getValue());
        return app;
    }

    private <T> Optional<T> read(Supplier<Optional<T>> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw DelegationException.internal("app storage failure", e);
        }
    }
}
