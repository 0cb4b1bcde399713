package uz.greenwhite.deviceauth.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import uz.greenwhite.deviceauth.error.GatewayTransportException;

import java.net.URI;
import java.util.concurrent.TimeUnit;

/**
 * {@link RequestGateway} over WebClient with one circuit breaker per provider host.
 * Any HTTP status is accepted as long as the body is a JSON object.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebClientRequestGateway implements RequestGateway {

    private final WebClient webClient;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<JsonNode> submit(HttpMethod method, String url, MultiValueMap<String, String> form) {
        return Mono.defer(() -> {
            CircuitBreaker circuitBreaker = getCircuitBreaker(url);
            String cbName = circuitBreaker.getName();

            try {
                circuitBreaker.acquirePermission();
            } catch (CallNotPermittedException ex) {
                log.warn("Circuit breaker [{}] OPEN, request blocked: {} {}", cbName, method, url);
                return Mono.error(new GatewayTransportException(url,
                        "Circuit breaker [" + cbName + "] is OPEN: provider unavailable", ex));
            }

            long startTime = System.nanoTime();
            log.debug("Sending request [CB: {}]: {} {}", cbName, method, url);

            return webClient
                    .method(method)
                    .uri(url)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(BodyInserters.fromFormData(form))
                    .exchangeToMono(response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> {
                                log.debug("Response [CB: {}]: {} -> status={}",
                                        cbName, url, response.statusCode().value());
                                return parseBody(url, body);
                            }))
                    .doOnSuccess(json -> circuitBreaker.onSuccess(
                            System.nanoTime() - startTime, TimeUnit.NANOSECONDS))
                    .onErrorResume(ex -> {
                        circuitBreaker.onError(System.nanoTime() - startTime, TimeUnit.NANOSECONDS, ex);
                        if (ex instanceof GatewayTransportException transportEx) {
                            return Mono.error(transportEx);
                        }
                        log.error("Request failed [CB: {}]: {} -> {}", cbName, url, ex.getMessage());
                        return Mono.error(new GatewayTransportException(url,
                                "Request to " + url + " failed: " + ex.getMessage(), ex));
                    });
        });
    }

    private JsonNode parseBody(String url, String body) {
        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (Exception e) {
            throw new GatewayTransportException(url, "Response is not valid JSON: " + e.getMessage(), e);
        }
        if (json == null || !json.isObject()) {
            throw new GatewayTransportException(url, "Response is not a JSON object");
        }
        return json;
    }

    /**
     * Get or create the circuit breaker for the provider host of the url.
     */
    private CircuitBreaker getCircuitBreaker(String url) {
        String cbName = extractDomainForCB(url);
        return circuitBreakerRegistry.circuitBreaker(cbName);
    }

    /**
     * Examples:
     *   https://accounts.google.com/o/oauth2/token -> cb-accounts.google.com
     */
    private String extractDomainForCB(String url) {
        try {
            String host = URI.create(url).getHost();
            if (host == null) {
                return "cb-" + Math.abs(url.hashCode());
            }
            return "cb-" + host;
        } catch (IllegalArgumentException e) {
            log.warn("Failed to extract domain from URL {}, using hashcode", url);
            return "cb-" + Math.abs(url.hashCode());
        }
    }
}
