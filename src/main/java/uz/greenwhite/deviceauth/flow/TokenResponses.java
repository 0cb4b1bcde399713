package uz.greenwhite.deviceauth.flow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

final class TokenResponses {

    static final String AUTHORIZATION_PENDING = "authorization_pending";
    static final String SLOW_DOWN = "slow_down";
    static final String INVALID_GRANT = "invalid_grant";

    private TokenResponses() {
    }

    static boolean isGranted(JsonNode json) {
        return json.hasNonNull("access_token") && !json.get("access_token").asText().isEmpty();
    }

    static String errorOf(JsonNode json) {
        return json.hasNonNull("error") ? json.get("error").asText() : null;
    }

    static <T> Optional<T> read(ObjectMapper objectMapper, JsonNode json, Class<T> type) {
        try {
            return Optional.ofNullable(objectMapper.treeToValue(json, type));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
