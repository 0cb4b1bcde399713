package uz.greenwhite.deviceauth.flow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import uz.greenwhite.deviceauth.config.DeviceAuthProperties;
import uz.greenwhite.deviceauth.credential.CredentialHolder;
import uz.greenwhite.deviceauth.error.ErrorKind;
import uz.greenwhite.deviceauth.error.GatewayTransportException;
import uz.greenwhite.deviceauth.event.DeviceAuthEvents;
import uz.greenwhite.deviceauth.event.Topic;
import uz.greenwhite.deviceauth.http.RequestGateway;
import uz.greenwhite.deviceauth.metrics.DeviceAuthMetrics;
import uz.greenwhite.deviceauth.model.DeviceCode;
import uz.greenwhite.deviceauth.model.TokenRequest;
import uz.greenwhite.deviceauth.model.TokenSet;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Polls the token endpoint until the user authorizes the device code.
 *
 * Each tick first checks expiry against the time polling started, then sends one poll.
 * authorization_pending re-arms the tick after the poll interval, slow_down does the same
 * after growing the interval by one second. Ticks never overlap: the next one is scheduled
 * only after the previous response has been handled.
 */
@Slf4j
@Component
public class TokenPoller {

    private final DeviceAuthProperties properties;
    private final RequestGateway gateway;
    private final CredentialHolder credentialHolder;
    private final DeviceAuthEvents events;
    private final DeviceAuthMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Scheduler pollScheduler;

    public TokenPoller(DeviceAuthProperties properties,
                       RequestGateway gateway,
                       CredentialHolder credentialHolder,
                       DeviceAuthEvents events,
                       DeviceAuthMetrics metrics,
                       ObjectMapper objectMapper,
                       Clock clock,
                       @Qualifier("pollScheduler") Scheduler pollScheduler) {
        this.properties = properties;
        this.gateway = gateway;
        this.credentialHolder = credentialHolder;
        this.events = events;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.pollScheduler = pollScheduler;
    }

    /**
     * Start polling for the given code. Completes with the granted tokens, or fails with the
     * published error: no_user_code, authorization_timeout, google_error or a transport failure.
     */
    public Mono<TokenSet> poll(DeviceCode code) {
        return Mono.defer(() -> {
            if (code == null || code.getDeviceCode() == null) {
                return Mono.error(events.emitError(ErrorKind.NO_USER_CODE, null));
            }

            Instant pollStart = clock.instant();
            log.info("Polling started: userCode={}, expiresIn={}s, interval={}s",
                    code.getUserCode(), code.getExpiresInSeconds(), code.getPollIntervalSeconds());

            return Mono.defer(() -> tick(code, pollStart))
                    .repeatWhenEmpty(ticks -> ticks.concatMap(i ->
                            Mono.delay(Duration.ofSeconds(code.getPollIntervalSeconds()), pollScheduler)));
        });
    }

    /**
     * One poll. Empty means "not yet, poll again".
     */
    private Mono<TokenSet> tick(DeviceCode code, Instant pollStart) {
        long elapsedMs = Duration.between(pollStart, clock.instant()).toMillis();
        if (code.getExpiresInSeconds() != null && elapsedMs > code.getExpiresInSeconds() * 1000) {
            log.info("Device code expired after {}ms: userCode={}", elapsedMs, code.getUserCode());
            return Mono.error(events.emitError(ErrorKind.AUTHORIZATION_TIMEOUT, null));
        }

        TokenRequest request = TokenRequest.builder()
                .clientId(properties.getClientId())
                .clientSecret(properties.getClientSecret())
                .code(code.getDeviceCode())
                .grantType(properties.getGrantType())
                .build();

        metrics.getPollTicks().increment();
        log.debug("Polling token endpoint: userCode={}, elapsed={}ms", code.getUserCode(), elapsedMs);

        return gateway.submit(HttpMethod.POST, properties.getTokenUrl(), request.toForm())
                .doOnError(GatewayTransportException.class, events::publishTransportFailure)
                .flatMap(json -> handleResponse(code, json));
    }

    private Mono<TokenSet> handleResponse(DeviceCode code, JsonNode json) {
        if (TokenResponses.isGranted(json)) {
            TokenSet granted = TokenResponses.read(objectMapper, json, TokenSet.class).orElse(null);
            if (granted == null) {
                return Mono.error(events.emitError(ErrorKind.GOOGLE_ERROR, json));
            }
            credentialHolder.store(granted);
            log.info("Device authorized: userCode={}", code.getUserCode());
            events.publish(Topic.AUTH_SUCCESS, granted);
            events.publish(Topic.NEW_ACCESS_TOKEN, granted);
            return Mono.just(granted);
        }

        String error = TokenResponses.errorOf(json);
        if (TokenResponses.SLOW_DOWN.equals(error)) {
            code.slowDown();
            metrics.getPollSlowDown().increment();
            log.debug("Provider asked to slow down: interval now {}s", code.getPollIntervalSeconds());
            return Mono.empty();
        }
        if (TokenResponses.AUTHORIZATION_PENDING.equals(error)) {
            return Mono.empty();
        }

        return Mono.error(events.emitError(ErrorKind.GOOGLE_ERROR, json));
    }
}
