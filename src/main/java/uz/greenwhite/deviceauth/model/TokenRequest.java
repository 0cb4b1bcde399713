package uz.greenwhite.deviceauth.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

/**
 * Form body sent to the code and token endpoints. Null fields are not sent.
 */
@Builder
@Data
public class TokenRequest {

    public static final String GRANT_TYPE_REFRESH_TOKEN = "refresh_token";

    private String clientId;
    private String clientSecret;
    private String scope;
    private String code;
    private String refreshToken;
    private String grantType;

    public MultiValueMap<String, String> toForm() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        put(form, "client_id", clientId);
        put(form, "client_secret", clientSecret);
        put(form, "scope", scope);
        put(form, "code", code);
        put(form, "refresh_token", refreshToken);
        put(form, "grant_type", grantType);
        return form;
    }

    private static void put(MultiValueMap<String, String> form, String name, String value) {
        if (value != null) {
            form.add(name, value);
        }
    }
}
