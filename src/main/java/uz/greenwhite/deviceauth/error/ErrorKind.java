package uz.greenwhite.deviceauth.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Catalog of classified device authorization failures.
 * Codes are stable and used as topic names on the event channel.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {

    MISSING_CLIENT_ID("missing_client_id", "Missing client ID in options"),
    MISSING_SCOPES("missing_scopes", "Scopes array is empty in options"),
    MISSING_CLIENT_SECRET("missing_client_secret", "Missing client secret in options"),
    MISSING_REFRESH_TOKEN("missing_refresh_token", "Missing refresh token in options"),
    AUTHORIZATION_TIMEOUT("authorization_timeout", "User did not authorize in time"),
    GOOGLE_ERROR("google_error", "Error returned from Google Auth"),
    NO_USER_CODE("no_user_code", "Unable to poll endpoint - no usercode data"),
    INVALID_REFRESH_TOKEN("invalid_refresh_token", "Invalid refresh token provided"),
    INVALID_SCOPE("invalid_scope", "Invalid scope provided in options");

    private final String code;
    private final String message;

    /**
     * Topic name of the kind-specific channel, e.g. "error.invalid_scope"
     */
    public String getTopic() {
        return "error." + code;
    }

    public DeviceAuthException toException() {
        return new DeviceAuthException(this, null);
    }

    public DeviceAuthException toException(Object data) {
        return new DeviceAuthException(this, data);
    }
}
