package uz.greenwhite.delegation.app;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uz.greenwhite.delegation.delegation.DelegationService;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/apps")
@RequiredArgsConstructor
public class AppController {

    private final AppService appService;
    private final DelegationService delegationService;

    /**
     * Register an App for a service.
     *
     * POST /api/v1/apps/yandex
     * {
     *   "id": "client-id",
     *   "password": "client-secret",
     *   "callback_URL": "https://example.com/api/v1/tokens",
     *   "status": "enable"
     * }
     */
    @PostMapping("/{service}")
    public ResponseEntity<App> create(@PathVariable String service, @RequestBody App app) {
        app.setService(service);
        String id = appService.create(app);
        return ResponseEntity.status(HttpStatus.CREATED).body(appService.resolveById(id));
    }

    @GetMapping("/{service}")
    public App get(@PathVariable String service) {
        return appService.resolveByService(service);
    }

    /**
     * Authorization URL for a user.
     *
     * GET /api/v1/apps/yandex/42 -> { "url": "https://oauth.yandex.com/authorize?...&state=..." }
     */
    @GetMapping("/{service}/{userId}")
    public Map<String, String> authCodeUrl(@PathVariable String service, @PathVariable long userId) {
        return Map.of("url", delegationService.start(service, userId));
    }

    @PatchMapping("/{appId}/status/{status}")
    public App setStatus(@PathVariable String appId, @PathVariable String status) {
        return appService.setStatus(appId, status);
    }
}
