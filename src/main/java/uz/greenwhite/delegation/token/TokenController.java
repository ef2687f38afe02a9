package uz.greenwhite.delegation.token;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uz.greenwhite.delegation.delegation.DelegationService;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/tokens")
@RequiredArgsConstructor
public class TokenController {

    private final DelegationService delegationService;
    private final TokenService tokenService;

    /**
     * Provider callback.
     *
     * GET /api/v1/tokens?code=...&state=...
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> complete(@RequestParam String code,
                                                        @RequestParam String state)
            throws MissingServletRequestParameterException {
        requireNotBlank("code", code);
        requireNotBlank("state", state);

        long userId = delegationService.complete(code, state);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("user_id", userId));
    }

    @GetMapping("/{userId}/{service}")
    public Token get(@PathVariable long userId, @PathVariable String service) {
        return tokenService.get(userId, service);
    }

    @PutMapping("/{userId}/{service}")
    public Token refresh(@PathVariable long userId, @PathVariable String service) {
        return tokenService.refresh(userId, service);
    }

    // Blank values are rejected like absent ones.
    private static void requireNotBlank(String name, String value) throws MissingServletRequestParameterException {
        if (value.isBlank()) {
            throw new MissingServletRequestParameterException(name, "String");
        }
    }
}
