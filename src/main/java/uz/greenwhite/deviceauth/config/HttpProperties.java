package uz.greenwhite.deviceauth.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Timeouts for calls to the provider's code and token endpoints.
 */
@Slf4j
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "device-auth.http")
public class HttpProperties {

    private int connectTimeoutMs = 5000;

    /**
     * Upper bound for one poll or refresh round trip
     */
    private int responseTimeoutMs = 15000;

    /**
     * Token responses are small; anything bigger is treated as a transport failure
     */
    private int maxResponseBytes = 64 * 1024;

    @PostConstruct
    public void validate() {
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException("device-auth.http.connect-timeout-ms must be > 0");
        }
        if (responseTimeoutMs <= 0) {
            throw new IllegalArgumentException("device-auth.http.response-timeout-ms must be > 0");
        }
        if (maxResponseBytes <= 0) {
            throw new IllegalArgumentException("device-auth.http.max-response-bytes must be > 0");
        }

        log.info("Provider HTTP config: connect={}ms, response={}ms, maxBody={}B",
                connectTimeoutMs, responseTimeoutMs, maxResponseBytes);
    }
}
