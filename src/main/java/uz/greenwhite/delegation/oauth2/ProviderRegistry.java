package uz.greenwhite.delegation.oauth2;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.delegation.error.DelegationException;
import uz.greenwhite.delegation.error.ErrorCode;
import uz.greenwhite.delegation.oauth2.model.ProviderEndpoint;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed table of provider endpoints and the scopes requested from each provider.
 */
@Slf4j
@Component
public class ProviderRegistry {

    private final Map<ServiceType, ProviderEndpoint> endpoints;

    public ProviderRegistry() {
        Map<ServiceType, ProviderEndpoint> map = new EnumMap<>(ServiceType.class);
        for (ServiceType type : ServiceType.values()) {
            map.put(type, endpointOf(type));
        }
        this.endpoints = Collections.unmodifiableMap(map);

        log.info("Provider registry initialized: services={}", endpoints.keySet());
    }

    public ProviderEndpoint lookup(ServiceType type) {
        return endpoints.get(type);
    }

    /**
     * Resolve a raw service key as stored on an App row.
     *
     * @throws DelegationException with {@link ErrorCode#SERVICE_UNSUPPORTED} for unknown keys
     */
    public ServiceType resolveType(String service) {
        return ServiceType.fromValue(service)
                .orElseThrow(() -> new DelegationException(ErrorCode.SERVICE_UNSUPPORTED,
                        "app service unavailable: " + service));
    }

    public boolean supports(String service) {
        return ServiceType.fromValue(service).isPresent();
    }

    public Map<ServiceType, ProviderEndpoint> getEndpoints() {
        return endpoints;
    }

    private static ProviderEndpoint endpointOf(ServiceType type) {
        return switch (type) {
            case GOOGLE -> new ProviderEndpoint(
                    "https://accounts.google.com/o/oauth2/auth",
                    "https://oauth2.googleapis.com/token",
                    List.of("https://www.googleapis.com/auth/gmail.addons.current.message.readonly"));
            case YANDEX -> new ProviderEndpoint(
                    "https://oauth.yandex.com/authorize",
                    "https://oauth.yandex.com/token",
                    List.of("mail:imap_ro"));
            case MAIL -> new ProviderEndpoint(
                    "https://o2.mail.ru/login",
                    "https://o2.mail.ru/token",
                    List.of());
            case VK -> new ProviderEndpoint(
                    "https://oauth.vk.com/authorize",
                    "https://oauth.vk.com/access_token",
                    List.of());
        };
    }
}
