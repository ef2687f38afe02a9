package uz.greenwhite.delegation.oauth2;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of identity providers a delegation can target.
 * Adding a provider means adding a constant here and its endpoint in {@link ProviderRegistry}.
 */
public enum ServiceType {
    GOOGLE("google"),
    YANDEX("yandex"),
    MAIL("mail"),
    VK("vk");

    private final String value;

    ServiceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<ServiceType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst();
    }
}
