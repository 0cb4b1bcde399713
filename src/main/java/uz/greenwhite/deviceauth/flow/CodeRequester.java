package uz.greenwhite.deviceauth.flow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import uz.greenwhite.deviceauth.config.DeviceAuthProperties;
import uz.greenwhite.deviceauth.error.ErrorKind;
import uz.greenwhite.deviceauth.error.GatewayTransportException;
import uz.greenwhite.deviceauth.event.DeviceAuthEvents;
import uz.greenwhite.deviceauth.event.Topic;
import uz.greenwhite.deviceauth.http.RequestGateway;
import uz.greenwhite.deviceauth.model.DeviceCode;
import uz.greenwhite.deviceauth.model.TokenRequest;

/**
 * Requests a device code and user code from the provider.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CodeRequester {

    private static final String INVALID_SCOPE = "invalid_scope";

    private final RequestGateway gateway;
    private final DeviceAuthEvents events;
    private final ObjectMapper objectMapper;

    /**
     * Publishes user_code and returns the code on success. Provider errors are published
     * as classified errors, transport failures on the generic error topic only.
     */
    public Mono<DeviceCode> requestCode(DeviceAuthProperties properties) {
        TokenRequest request = TokenRequest.builder()
                .clientId(properties.getClientId())
                .scope(properties.joinedScopes())
                .build();

        log.info("Requesting device code: scopes=[{}]", request.getScope());

        return gateway.submit(HttpMethod.POST, properties.getCodeUrl(), request.toForm())
                .doOnError(GatewayTransportException.class, events::publishTransportFailure)
                .flatMap(this::handleResponse);
    }

    private Mono<DeviceCode> handleResponse(JsonNode json) {
        if (json.hasNonNull("error")) {
            ErrorKind kind = INVALID_SCOPE.equals(json.get("error").asText())
                    ? ErrorKind.INVALID_SCOPE
                    : ErrorKind.GOOGLE_ERROR;
            return Mono.error(events.emitError(kind, json));
        }

        DeviceCode code;
        try {
            code = objectMapper.treeToValue(json, DeviceCode.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse device code response: {}", e.getMessage());
            return Mono.error(events.emitError(ErrorKind.GOOGLE_ERROR, json));
        }

        log.info("Device code issued: userCode={}, verificationUrl={}, expiresIn={}s, interval={}s",
                code.getUserCode(), code.getVerificationUrl(),
                code.getExpiresInSeconds(), code.getPollIntervalSeconds());

        events.publish(Topic.USER_CODE, code);
        return Mono.just(code);
    }
}
