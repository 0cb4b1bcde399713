package uz.greenwhite.deviceauth.flow;

import org.springframework.stereotype.Component;
import uz.greenwhite.deviceauth.config.DeviceAuthProperties;
import uz.greenwhite.deviceauth.error.ErrorKind;

import java.util.Optional;

/**
 * Checks the configuration before any request is sent. Returns the first violation found.
 */
@Component
public class ConfigValidator {

    /**
     * Device code flow: client id, then scopes, then client secret
     */
    public Optional<ErrorKind> validateForDeviceCode(DeviceAuthProperties properties) {
        if (isBlank(properties.getClientId())) {
            return Optional.of(ErrorKind.MISSING_CLIENT_ID);
        }
        if (properties.getScopes() == null || properties.getScopes().isEmpty()) {
            return Optional.of(ErrorKind.MISSING_SCOPES);
        }
        if (isBlank(properties.getClientSecret())) {
            return Optional.of(ErrorKind.MISSING_CLIENT_SECRET);
        }
        return Optional.empty();
    }

    public Optional<ErrorKind> validateForRefresh(DeviceAuthProperties properties) {
        if (isBlank(properties.getClientId())) {
            return Optional.of(ErrorKind.MISSING_CLIENT_ID);
        }
        if (isBlank(properties.getClientSecret())) {
            return Optional.of(ErrorKind.MISSING_CLIENT_SECRET);
        }
        if (!properties.hasRefreshToken()) {
            return Optional.of(ErrorKind.MISSING_REFRESH_TOKEN);
        }
        return Optional.empty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
