package uz.greenwhite.deviceauth.flow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import uz.greenwhite.deviceauth.config.DeviceAuthProperties;
import uz.greenwhite.deviceauth.error.DeviceAuthException;
import uz.greenwhite.deviceauth.error.ErrorKind;
import uz.greenwhite.deviceauth.error.GatewayTransportException;
import uz.greenwhite.deviceauth.event.DeviceAuthEvents;
import uz.greenwhite.deviceauth.event.Topic;
import uz.greenwhite.deviceauth.http.RequestGateway;
import uz.greenwhite.deviceauth.model.DeviceCode;
import uz.greenwhite.deviceauth.support.TestProperties;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CodeRequester")
class CodeRequesterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private RequestGateway gateway;

    private DeviceAuthEvents events;
    private DeviceAuthProperties properties;
    private CodeRequester requester;

    private final List<DeviceCode> userCodes = new ArrayList<>();
    private final List<RuntimeException> errors = new ArrayList<>();

    @BeforeEach
    void setUp() {
        events = new DeviceAuthEvents();
        events.subscribe(Topic.USER_CODE, userCodes::add);
        events.subscribe(Topic.ERROR, errors::add);
        properties = TestProperties.valid();
        requester = new CodeRequester(gateway, events, MAPPER);
    }

    @Test
    @DisplayName("should send client id and space-joined scopes to the code endpoint")
    @SuppressWarnings("unchecked")
    void shouldSendClientIdAndScopes() throws Exception {
        properties.setScopes(List.of("scope-a", "scope-b"));
        when(gateway.submit(eq(HttpMethod.POST), eq(TestProperties.CODE_URL), any()))
                .thenReturn(Mono.just(codeResponse()));

        StepVerifier.create(requester.requestCode(properties))
                .expectNextCount(1)
                .verifyComplete();

        ArgumentCaptor<MultiValueMap<String, String>> form = ArgumentCaptor.forClass(MultiValueMap.class);
        verify(gateway).submit(eq(HttpMethod.POST), eq(TestProperties.CODE_URL), form.capture());
        assertThat(form.getValue().getFirst("client_id")).isEqualTo("testid");
        assertThat(form.getValue().getFirst("scope")).isEqualTo("scope-a scope-b");
        assertThat(form.getValue().containsKey("client_secret")).isFalse();
    }

    @Test
    @DisplayName("should publish user_code with the provider payload")
    void shouldPublishUserCode() throws Exception {
        when(gateway.submit(eq(HttpMethod.POST), eq(TestProperties.CODE_URL), any()))
                .thenReturn(Mono.just(codeResponse()));

        StepVerifier.create(requester.requestCode(properties))
                .assertNext(code -> assertThat(code).isSameAs(userCodes.get(0)))
                .verifyComplete();

        assertThat(userCodes).singleElement().satisfies(code -> {
            assertThat(code.getDeviceCode()).isEqualTo("device_code");
            assertThat(code.getUserCode()).isEqualTo("user_code");
            assertThat(code.getVerificationUrl()).isEqualTo("verification_url");
            assertThat(code.getExpiresInSeconds()).isEqualTo(100);
            assertThat(code.getPollIntervalSeconds()).isEqualTo(5);
        });
        assertThat(errors).isEmpty();
    }

    @Test
    @DisplayName("should emit invalid_scope for an invalid_scope response")
    void shouldEmitInvalidScope() throws Exception {
        JsonNode response = MAPPER.readTree("{\"error\":\"invalid_scope\"}");
        when(gateway.submit(eq(HttpMethod.POST), eq(TestProperties.CODE_URL), any()))
                .thenReturn(Mono.just(response));
        List<DeviceAuthException> invalidScope = new ArrayList<>();
        events.subscribe(ErrorKind.INVALID_SCOPE, invalidScope::add);

        StepVerifier.create(requester.requestCode(properties))
                .expectErrorSatisfies(e -> assertThat(e).isSameAs(invalidScope.get(0)))
                .verify();

        assertThat(invalidScope).singleElement()
                .satisfies(e -> assertThat(e.getData()).isEqualTo(response));
        assertThat(userCodes).isEmpty();
    }

    @Test
    @DisplayName("should emit google_error with data for any other error")
    void shouldEmitGoogleError() throws Exception {
        JsonNode response = MAPPER.readTree("{\"error\":\"invalid_client\"}");
        when(gateway.submit(eq(HttpMethod.POST), eq(TestProperties.CODE_URL), any()))
                .thenReturn(Mono.just(response));

        StepVerifier.create(requester.requestCode(properties))
                .expectErrorSatisfies(e -> assertThat(((DeviceAuthException) e).getKind())
                        .isEqualTo(ErrorKind.GOOGLE_ERROR))
                .verify();

        assertThat(errors).singleElement()
                .satisfies(e -> assertThat(((DeviceAuthException) e).getData()).isEqualTo(response));
    }

    @Test
    @DisplayName("should publish transport failures on the generic topic only")
    void shouldPublishTransportFailure() {
        GatewayTransportException failure = new GatewayTransportException(TestProperties.CODE_URL, "refused");
        when(gateway.submit(eq(HttpMethod.POST), eq(TestProperties.CODE_URL), any()))
                .thenReturn(Mono.error(failure));
        List<DeviceAuthException> classified = new ArrayList<>();
        events.subscribe(ErrorKind.GOOGLE_ERROR, classified::add);

        StepVerifier.create(requester.requestCode(properties))
                .expectErrorMatches(e -> e == failure)
                .verify();

        assertThat(errors).containsExactly(failure);
        assertThat(classified).isEmpty();
        assertThat(userCodes).isEmpty();
    }

    static JsonNode codeResponse() throws Exception {
        return MAPPER.readTree("""
                {
                  "device_code": "device_code",
                  "user_code": "user_code",
                  "verification_url": "verification_url",
                  "expires_in": 100,
                  "interval": 5
                }
                """);
    }
}
