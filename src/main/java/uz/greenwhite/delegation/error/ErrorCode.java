package uz.greenwhite.delegation.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    NOT_FOUND("NOT_FOUND", "Entity absent or filtered out by status"),
    ALREADY_EXISTS("ALREADY_EXISTS", "Uniqueness violation on creation"),
    SERVICE_UNSUPPORTED("SERVICE_UNSUPPORTED", "No provider registered for service"),
    INVALID_STATUS("INVALID_STATUS", "Status outside of the allowed values"),
    VALIDATION_FAILED("VALIDATION_FAILED", "Request payload failed validation"),
    INTERNAL("INTERNAL", "Storage or provider failure");

    private final String code;
    private final String description;
}
