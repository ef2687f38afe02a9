package uz.greenwhite.delegation.validation;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uz.greenwhite.delegation.app.App;
import uz.greenwhite.delegation.oauth2.ProviderRegistry;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class AppValidator {

    private static final String REQUIRED = "value is required";
    private static final Set<String> CALLBACK_SCHEMES = Set.of("http", "https");

    private final ProviderRegistry providerRegistry;

    /**
     * Validate an App before registration.
     * Returns field -> message; an empty map means valid.
     */
    public Map<String, String> validate(App app) {
        Map<String, String> errors = new LinkedHashMap<>();

        if (app == null) {
            errors.put("app", REQUIRED);
            return errors;
        }

        if (isBlank(app.getId())) {
            errors.put("id", REQUIRED);
        }

        if (isBlank(app.getService())) {
            errors.put("service", REQUIRED);
        } else if (!providerRegistry.supports(app.getService())) {
            errors.put("service", "unsupported service");
        }

        if (isBlank(app.getPassword())) {
            errors.put("password", REQUIRED);
        }

        if (isBlank(app.getCallbackUrl())) {
            errors.put("callback_URL", REQUIRED);
        } else if (!isAbsoluteHttpUrl(app.getCallbackUrl())) {
            errors.put("callback_URL", "invalid value");
        }

        if (app.getStatus() == null) {
            errors.put("status", REQUIRED);
        }

        return errors;
    }

    public boolean isValid(App app) {
        return validate(app).isEmpty();
    }

    private static boolean isAbsoluteHttpUrl(String value) {
        try {
            URI uri = URI.create(value);
            return uri.getScheme() != null
                    && CALLBACK_SCHEMES.contains(uri.getScheme().toLowerCase())
                    && uri.getHost() != null;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
