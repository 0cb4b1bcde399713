package uz.greenwhite.deviceauth.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenSet(@JsonProperty("access_token") String accessToken,
                       @JsonProperty("token_type") String tokenType,
                       @JsonProperty("expires_in") Long expiresInSeconds,
                       @JsonProperty("refresh_token") String refreshToken,
                       @JsonProperty("id_token") String idToken) implements Serializable {

    /**
     * Fields present in {@code update} win, absent ones are kept from this set.
     */
    public TokenSet mergedWith(TokenSet update) {
        return new TokenSet(
                update.accessToken() != null ? update.accessToken() : accessToken,
                update.tokenType() != null ? update.tokenType() : tokenType,
                update.expiresInSeconds() != null ? update.expiresInSeconds() : expiresInSeconds,
                update.refreshToken() != null ? update.refreshToken() : refreshToken,
                update.idToken() != null ? update.idToken() : idToken);
    }

    public static TokenSet empty() {
        return new TokenSet(null, null, null, null, null);
    }
}
