package uz.greenwhite.delegation.error;

import lombok.Getter;

import java.util.Map;

/**
 * Typed failure of a delegation operation. The REST layer maps {@link #getErrorCode()}
 * to a response status; {@link ErrorCode#INTERNAL} messages are never rendered to clients.
 */
@Getter
public class DelegationException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, String> details;

    public DelegationException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    public DelegationException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, Map.of(), cause);
    }

    public DelegationException(ErrorCode errorCode, String message, Map<String, String> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static DelegationException notFound(String message) {
        return new DelegationException(ErrorCode.NOT_FOUND, message);
    }

    public static DelegationException internal(String message, Throwable cause) {
        return new DelegationException(ErrorCode.INTERNAL, message, cause);
    }

    public boolean is(ErrorCode code) {
        return errorCode == code;
    }
}
