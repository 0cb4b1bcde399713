package uz.greenwhite.deviceauth.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import uz.greenwhite.deviceauth.config.DeviceAuthProperties;
import uz.greenwhite.deviceauth.credential.CredentialHolder;
import uz.greenwhite.deviceauth.flow.AttemptInProgressException;
import uz.greenwhite.deviceauth.flow.DeviceAuthOrchestrator;
import uz.greenwhite.deviceauth.model.TokenSet;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@RestController
@RequestMapping("/api/v1/device-auth")
@RequiredArgsConstructor
public class DeviceAuthController {

    private final DeviceAuthOrchestrator orchestrator;
    private final DeviceAuthProperties properties;
    private final CredentialHolder credentialHolder;

    /**
     * Configuration and credential status, secrets masked
     *
     * GET http://localhost:8090/api/v1/device-auth/info
     *
     * Response:
     * {
     *   "clientId": "2348...",
     *   "scopes": ["https://www.googleapis.com/auth/drive"],
     *   "tokenUrl": "https://accounts.google.com/o/oauth2/token",
     *   "inProgress": false,
     *   "hasAccessToken": true,
     *   "accessTokenExpired": false,
     *   "obtainedAt": "2024-05-01T10:15:30Z",
     *   "hasRefreshToken": true
     * }
     */
    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> getInformation() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("clientId", mask(properties.getClientId()));
        info.put("scopes", properties.getScopes());
        info.put("codeUrl", properties.getCodeUrl());
        info.put("tokenUrl", properties.getTokenUrl());
        info.put("autoReAuthenticate", properties.isAutoReAuthenticate());
        info.put("inProgress", orchestrator.isInProgress());
        info.put("hasAccessToken", credentialHolder.hasAccessToken());
        info.put("accessTokenExpired", credentialHolder.isAccessTokenExpired());
        info.put("obtainedAt", credentialHolder.getObtainedAt());
        info.put("hasRefreshToken", credentialHolder.getRefreshToken() != null);
        return ResponseEntity.ok(info);
    }

    /**
     * Start an attempt in the background. Progress is reported through the event channel
     * (the user code is logged).
     *
     * POST http://localhost:8090/api/v1/device-auth/authenticate
     */
    @PostMapping("/authenticate")
    public ResponseEntity<Map<String, Object>> authenticate() {
        return start("authenticate", orchestrator.authenticate());
    }

    /**
     * POST http://localhost:8090/api/v1/device-auth/refresh
     */
    @PostMapping("/refresh")
    public ResponseEntity<Map<String, Object>> refresh() {
        return start("refresh", orchestrator.refresh());
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        return ResponseEntity.ok(Map.of("cancelled", orchestrator.cancel()));
    }

    /**
     * The single-attempt guard runs when the attempt is subscribed, so a rejection arrives
     * synchronously on this thread and decides between 409 and 202.
     */
    private ResponseEntity<Map<String, Object>> start(String operation, Mono<TokenSet> attempt) {
        AtomicBoolean rejected = new AtomicBoolean();

        // Errors are already published on the event channel
        attempt.subscribe(
                tokens -> log.debug("{} finished", operation),
                error -> {
                    if (error instanceof AttemptInProgressException) {
                        rejected.set(true);
                    } else {
                        log.debug("{} ended with error: {}", operation, error.getMessage());
                    }
                });

        if (rejected.get()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("operation", operation, "status", "IN_PROGRESS"));
        }
        return ResponseEntity.accepted()
                .body(Map.of("operation", operation, "status", "STARTED"));
    }

    private String mask(String value) {
        if (value == null) return null;
        if (value.length() <= 4) return "****";
        return value.substring(0, 4) + "...";
    }
}
