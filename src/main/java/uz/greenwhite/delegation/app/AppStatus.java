package uz.greenwhite.delegation.app;

import com.fasterxml.jackson.annotation.JsonValue;
import uz.greenwhite.delegation.error.DelegationException;
import uz.greenwhite.delegation.error.ErrorCode;

import java.util.Arrays;
import java.util.Optional;

public enum AppStatus {
    ENABLE("enable"),
    DISABLE("disable");

    private final String value;

    AppStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<AppStatus> fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value))
                .findFirst();
    }

    /**
     * Parse a caller-supplied status.
     *
     * @throws DelegationException with {@link ErrorCode#INVALID_STATUS} for anything but enable/disable
     */
    public static AppStatus parse(String value) {
        return fromValue(value)
                .orElseThrow(() -> new DelegationException(ErrorCode.INVALID_STATUS,
                        "app status unavailable: " + value));
    }
}
