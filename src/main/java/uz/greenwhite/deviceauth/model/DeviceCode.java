package uz.greenwhite.deviceauth.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response of the device code request. Owned by a single authentication attempt;
 * only {@code pollIntervalSeconds} changes after creation (on slow_down).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeviceCode {

    @JsonProperty("device_code")
    private String deviceCode;

    @JsonProperty("user_code")
    private String userCode;

    @JsonProperty("verification_url")
    private String verificationUrl;

    /**
     * Null when the provider sent no expires_in; such a code never times out.
     */
    @JsonProperty("expires_in")
    private Long expiresInSeconds;

    @JsonProperty("interval")
    private long pollIntervalSeconds;

    public void slowDown() {
        pollIntervalSeconds++;
    }
}
