package uz.greenwhite.delegation.error;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String INTERNAL_MESSAGE = "internal error";

    @ExceptionHandler(DelegationException.class)
    public ResponseEntity<Map<String, Object>> handleDelegation(DelegationException e) {
        HttpStatus status = statusOf(e.getErrorCode());

        if (e.is(ErrorCode.VALIDATION_FAILED)) {
            return ResponseEntity.status(status).body(Map.of("errors", e.getDetails()));
        }

        if (e.is(ErrorCode.INTERNAL)) {
            log.error("Delegation failed: {}", e.getMessage(), e);
            return ResponseEntity.status(status).body(Map.of("error", INTERNAL_MESSAGE));
        }

        log.debug("Delegation rejected [{}]: {}", e.getErrorCode().getCode(), e.getMessage());
        return ResponseEntity.status(status).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        log.debug("Bad request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", badRequestMessage(e)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", INTERNAL_MESSAGE));
    }

    static HttpStatus statusOf(ErrorCode code) {
        return switch (code) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ALREADY_EXISTS -> HttpStatus.CONFLICT;
            case SERVICE_UNSUPPORTED, VALIDATION_FAILED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INVALID_STATUS -> HttpStatus.BAD_REQUEST;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private String badRequestMessage(Exception e) {
        if (e instanceof MissingServletRequestParameterException missing) {
            return missing.getParameterName() + " not specified";
        }
        if (e instanceof MethodArgumentTypeMismatchException mismatch) {
            return "invalid value for " + mismatch.getName();
        }
        return "malformed request body";
    }
}
