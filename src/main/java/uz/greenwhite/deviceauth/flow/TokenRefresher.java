package uz.greenwhite.deviceauth.flow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import uz.greenwhite.deviceauth.config.DeviceAuthProperties;
import uz.greenwhite.deviceauth.credential.CredentialHolder;
import uz.greenwhite.deviceauth.error.ErrorKind;
import uz.greenwhite.deviceauth.error.GatewayTransportException;
import uz.greenwhite.deviceauth.event.DeviceAuthEvents;
import uz.greenwhite.deviceauth.event.Topic;
import uz.greenwhite.deviceauth.http.RequestGateway;
import uz.greenwhite.deviceauth.model.TokenRequest;
import uz.greenwhite.deviceauth.model.TokenSet;

import java.util.Optional;

/**
 * Exchanges the stored refresh token for a new access token.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TokenRefresher {

    private final RequestGateway gateway;
    private final ConfigValidator validator;
    private final CredentialHolder credentialHolder;
    private final DeviceAuthEvents events;
    private final ObjectMapper objectMapper;

    /**
     * Validation failures are published before any request is sent.
     * A rejected refresh token (invalid_grant) is discarded and reported as invalid_refresh_token.
     */
    public Mono<TokenSet> refresh(DeviceAuthProperties properties) {
        return Mono.defer(() -> {
            Optional<ErrorKind> violation = validator.validateForRefresh(properties);
            if (violation.isPresent()) {
                return Mono.error(events.emitError(violation.get(), null));
            }

            TokenRequest request = TokenRequest.builder()
                    .clientId(properties.getClientId())
                    .clientSecret(properties.getClientSecret())
                    .refreshToken(properties.getRefreshToken())
                    .grantType(TokenRequest.GRANT_TYPE_REFRESH_TOKEN)
                    .build();

            log.info("Refreshing access token: clientId={}", properties.getClientId());

            return gateway.submit(HttpMethod.POST, properties.getTokenUrl(), request.toForm())
                    .doOnError(GatewayTransportException.class, events::publishTransportFailure)
                    .flatMap(this::handleResponse);
        });
    }

    private Mono<TokenSet> handleResponse(JsonNode json) {
        if (TokenResponses.isGranted(json)) {
            Optional<TokenSet> granted = TokenResponses.read(objectMapper, json, TokenSet.class);
            if (granted.isEmpty()) {
                return Mono.error(events.emitError(ErrorKind.GOOGLE_ERROR, json));
            }
            credentialHolder.store(granted.get());
            log.info("Access token refreshed");
            events.publish(Topic.REFRESH_SUCCESS, granted.get());
            events.publish(Topic.NEW_ACCESS_TOKEN, granted.get());
            return Mono.just(granted.get());
        }

        if (TokenResponses.INVALID_GRANT.equals(TokenResponses.errorOf(json))) {
            credentialHolder.discardRefreshToken();
            return Mono.error(events.emitError(ErrorKind.INVALID_REFRESH_TOKEN, json));
        }

        return Mono.error(events.emitError(ErrorKind.GOOGLE_ERROR, json));
    }
}
