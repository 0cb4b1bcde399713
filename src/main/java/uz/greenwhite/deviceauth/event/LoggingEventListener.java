package uz.greenwhite.deviceauth.event;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.deviceauth.error.DeviceAuthException;
import uz.greenwhite.deviceauth.model.DeviceCode;

/**
 * Logs what the user has to do and how each attempt ended.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoggingEventListener {

    private final DeviceAuthEvents events;

    @PostConstruct
    public void register() {
        events.subscribe(Topic.USER_CODE, this::onUserCode);
        events.subscribe(Topic.AUTH_SUCCESS, tokens ->
                log.info("Device authorization completed: tokenType={}, expiresIn={}s",
                        tokens.tokenType(), tokens.expiresInSeconds()));
        events.subscribe(Topic.REFRESH_SUCCESS, tokens ->
                log.info("Token refresh completed: expiresIn={}s", tokens.expiresInSeconds()));
        events.subscribe(Topic.ERROR, this::onError);
    }

    private void onUserCode(DeviceCode code) {
        log.info("Please visit {} and enter code {} (expires in {}s)",
                code.getVerificationUrl(), code.getUserCode(), code.getExpiresInSeconds());
    }

    private void onError(RuntimeException error) {
        if (error instanceof DeviceAuthException authError && authError.hasData()) {
            log.warn("Device authorization failed [{}]: {} - {}",
                    authError.getCode(), authError.getMessage(), authError.getData());
        } else {
            log.warn("Device authorization failed: {}", error.getMessage());
        }
    }
}
