package uz.greenwhite.deviceauth.http;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpMethod;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Mono;

public interface RequestGateway {

    /**
     * Submit a form-encoded request and parse the response body as a JSON object.
     * Provider errors arrive as normal JSON payloads with an "error" field;
     * the Mono fails with {@link uz.greenwhite.deviceauth.error.GatewayTransportException}
     * only when the call itself could not be completed.
     */
    Mono<JsonNode> submit(HttpMethod method, String url, MultiValueMap<String, String> form);
}
