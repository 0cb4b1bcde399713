package uz.greenwhite.deviceauth.event;

import uz.greenwhite.deviceauth.model.DeviceCode;
import uz.greenwhite.deviceauth.model.TokenSet;

/**
 * Typed address on the {@link DeviceAuthEvents} channel.
 * Kind-specific error topics are addressed by {@link uz.greenwhite.deviceauth.error.ErrorKind} instead.
 */
public final class Topic<T> {

    public static final Topic<DeviceCode> USER_CODE = new Topic<>("user_code");
    public static final Topic<TokenSet> AUTH_SUCCESS = new Topic<>("auth_success");
    public static final Topic<TokenSet> REFRESH_SUCCESS = new Topic<>("refresh_success");
    public static final Topic<TokenSet> NEW_ACCESS_TOKEN = new Topic<>("new_access_token");

    /**
     * Every failure: classified errors and transport failures alike
     */
    public static final Topic<RuntimeException> ERROR = new Topic<>("error");

    private final String name;

    private Topic(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
