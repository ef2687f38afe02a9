package uz.greenwhite.delegation.oauth2;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uz.greenwhite.delegation.oauth2.model.ProviderEndpoint;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/oauth2-provider")
@RequiredArgsConstructor
public class OAuth2ProviderController {

    private final ProviderRegistry providerRegistry;

    /**
     * Supported services
     *
     * GET http://localhost:8090/api/v1/oauth2-provider/info
     *
     * Response:
     * {
     *   "providers": {
     *     "yandex": { "auth_url": "...", "token_url": "...", "scopes": ["mail:imap_ro"] }
     *   }
     * }
     */
    @GetMapping("/info")
    public Map<String, Object> getInformation() {
        Map<String, ProviderEndpoint> providers = new LinkedHashMap<>();
        providerRegistry.getEndpoints().forEach((type, endpoint) -> providers.put(type.getValue(), endpoint));
        return Map.of("providers", providers);
    }
}
