package uz.greenwhite.deviceauth.credential;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.deviceauth.config.DeviceAuthProperties;
import uz.greenwhite.deviceauth.model.TokenSet;

import java.time.Clock;
import java.time.Instant;

/**
 * In-memory store of the latest granted tokens. Durable storage is the caller's concern:
 * subscribe to new_access_token and persist the refresh token from there.
 *
 * The refresh token lives in {@link DeviceAuthProperties} so that refresh calls always read
 * the most recent one.
 */
@Slf4j
@Component
public class CredentialHolder {

    private static final long MARGIN_IN_MILLIS = 15 * 1000;

    private final DeviceAuthProperties properties;
    private final Clock clock;

    private TokenSet tokens = TokenSet.empty();
    private Instant obtainedAt;

    public CredentialHolder(DeviceAuthProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Merge a granted token set. Fields missing from the response keep their previous value,
     * including the refresh token.
     */
    public synchronized TokenSet store(TokenSet granted) {
        tokens = tokens.mergedWith(granted);
        obtainedAt = clock.instant();
        if (granted.refreshToken() != null) {
            properties.setRefreshToken(granted.refreshToken());
        }
        log.info("Credentials updated: tokenType={}, expiresIn={}s, refreshTokenIssued={}",
                tokens.tokenType(), tokens.expiresInSeconds(), granted.refreshToken() != null);
        return tokens;
    }

    /**
     * Forget a refresh token the provider rejected, so the next authenticate() starts
     * a device code flow instead of refreshing again.
     */
    public synchronized void discardRefreshToken() {
        properties.setRefreshToken(null);
        log.info("Refresh token discarded");
    }

    /**
     * Merged view of every token set stored so far, with the current refresh token
     */
    public synchronized TokenSet snapshot() {
        return new TokenSet(tokens.accessToken(), tokens.tokenType(), tokens.expiresInSeconds(),
                properties.getRefreshToken(), tokens.idToken());
    }

    public synchronized String getAccessToken() {
        return tokens.accessToken();
    }

    public synchronized String getRefreshToken() {
        return properties.getRefreshToken();
    }

    public synchronized boolean hasAccessToken() {
        return tokens.accessToken() != null;
    }

    public synchronized Instant getObtainedAt() {
        return obtainedAt;
    }

    /**
     * True when there is no access token or it expires within the next 15 seconds.
     * A token without expires_in is treated as valid.
     */
    public synchronized boolean isAccessTokenExpired() {
        if (tokens.accessToken() == null || obtainedAt == null) {
            return true;
        }
        if (tokens.expiresInSeconds() == null) {
            return false;
        }
        long expiresAt = obtainedAt.toEpochMilli() + tokens.expiresInSeconds() * 1000;
        return clock.millis() > expiresAt - MARGIN_IN_MILLIS;
    }

    public synchronized String getAuthorizationHeader() {
        String tokenType = tokens.tokenType();
        String header;
        if (tokenType == null || tokenType.equalsIgnoreCase("bearer")) {
            header = "Bearer " + tokens.accessToken();
        } else {
            header = tokenType + " " + tokens.accessToken();
        }
        return header.trim();
    }
}
