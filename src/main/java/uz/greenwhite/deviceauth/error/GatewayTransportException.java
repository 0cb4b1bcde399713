package uz.greenwhite.deviceauth.error;

import lombok.Getter;

/**
 * The request gateway could not complete a call: connection failure, timeout,
 * open circuit breaker or a body that is not a JSON object.
 * Never classified and never retried.
 */
@Getter
public class GatewayTransportException extends RuntimeException {

    private final String url;

    public GatewayTransportException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public GatewayTransportException(String url, String message) {
        this(url, message, null);
    }
}
