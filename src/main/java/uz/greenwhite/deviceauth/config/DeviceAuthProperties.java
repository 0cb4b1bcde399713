package uz.greenwhite.deviceauth.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "device-auth")
public class DeviceAuthProperties {

    public static final String DEFAULT_ACCOUNTS_URL = "https://accounts.google.com";
    public static final String DEFAULT_CODE_PATH = "/o/oauth2/device/code";
    public static final String DEFAULT_TOKEN_PATH = "/o/oauth2/token";
    public static final String DEFAULT_GRANT_TYPE = "http://oauth.net/grant_type/device/1.0";

    /**
     * Application client ID from the provider console
     */
    private String clientId;

    /**
     * Application client secret from the provider console
     */
    private String clientSecret;

    /**
     * Requested scopes, sent space-joined in declaration order
     */
    private List<String> scopes = new ArrayList<>();

    /**
     * Refresh token from an earlier authorization, if the caller stored one.
     * Updated whenever the provider issues a new one.
     */
    private String refreshToken;

    /**
     * Start a fresh device authorization when the provider rejects the refresh token
     */
    private boolean autoReAuthenticate = true;

    private String accountsUrl = DEFAULT_ACCOUNTS_URL;
    private String codePath = DEFAULT_CODE_PATH;
    private String tokenPath = DEFAULT_TOKEN_PATH;

    /**
     * grant_type sent while polling for the device authorization result
     */
    private String grantType = DEFAULT_GRANT_TYPE;

    public String getCodeUrl() {
        return accountsUrl + codePath;
    }

    public String getTokenUrl() {
        return accountsUrl + tokenPath;
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isEmpty();
    }

    public String joinedScopes() {
        return String.join(" ", scopes);
    }
}
