package uz.greenwhite.deviceauth.error;

import lombok.Getter;

/**
 * Classified failure of a device authorization attempt.
 * Published once on the generic error topic and once on the kind-specific one.
 */
@Getter
public class DeviceAuthException extends RuntimeException {

    private final ErrorKind kind;

    /**
     * Raw provider payload, when the failure came from a provider response
     */
    private final transient Object data;

    public DeviceAuthException(ErrorKind kind, Object data) {
        super(kind.getMessage());
        this.kind = kind;
        this.data = data;
    }

    public String getCode() {
        return kind.getCode();
    }

    public boolean hasData() {
        return data != null;
    }

    @Override
    public String toString() {
        return "DeviceAuthException[" + kind.getCode() + "]: " + getMessage();
    }
}
