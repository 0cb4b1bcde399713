package uz.greenwhite.deviceauth.flow;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import uz.greenwhite.deviceauth.config.DeviceAuthProperties;
import uz.greenwhite.deviceauth.error.DeviceAuthException;
import uz.greenwhite.deviceauth.error.ErrorKind;
import uz.greenwhite.deviceauth.event.DeviceAuthEvents;
import uz.greenwhite.deviceauth.event.EventDeliveryException;
import uz.greenwhite.deviceauth.metrics.DeviceAuthMetrics;
import uz.greenwhite.deviceauth.model.TokenSet;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Entry point for obtaining and maintaining credentials with the device authorization grant.
 *
 * <pre>
 * authenticate():
 *   refresh token known  -> refresh()
 *   otherwise            -> validate -> request code (user_code) -> poll -> auth_success
 *
 * refresh():
 *   no refresh token     -> authenticate()
 *   otherwise            -> refresh -> refresh_success
 *   invalid_grant        -> invalid_refresh_token -> authenticate() when auto re-authentication is on
 * </pre>
 *
 * Every outcome is published on {@link DeviceAuthEvents} before the returned Mono signals it.
 * One attempt runs at a time per instance: calls made while an attempt is in flight fail
 * with {@link AttemptInProgressException} and publish nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceAuthOrchestrator {

    private final DeviceAuthProperties properties;
    private final ConfigValidator validator;
    private final CodeRequester codeRequester;
    private final TokenPoller poller;
    private final TokenRefresher refresher;
    private final DeviceAuthEvents events;
    private final DeviceAuthMetrics metrics;

    private final AtomicBoolean inFlight = new AtomicBoolean();
    private volatile Sinks.One<Boolean> cancelSignal = Sinks.one();

    public Mono<TokenSet> authenticate() {
        return guarded(this::startAuthentication);
    }

    public Mono<TokenSet> refresh() {
        return guarded(this::startRefresh);
    }

    /**
     * Stop the outstanding poll before its next tick. The attempt completes empty.
     *
     * @return true if an attempt was in flight
     */
    public boolean cancel() {
        if (!inFlight.get()) {
            return false;
        }
        log.info("Cancelling device authorization attempt");
        cancelSignal.tryEmitValue(Boolean.TRUE);
        return true;
    }

    public boolean isInProgress() {
        return inFlight.get();
    }

    private Mono<TokenSet> guarded(Supplier<Mono<TokenSet>> attempt) {
        return Mono.defer(() -> {
            if (!inFlight.compareAndSet(false, true)) {
                return Mono.error(new AttemptInProgressException());
            }
            cancelSignal = Sinks.one();
            return Mono.defer(attempt)
                    .doFinally(signal -> inFlight.set(false));
        });
    }

    private Mono<TokenSet> startAuthentication() {
        if (properties.hasRefreshToken()) {
            log.debug("Refresh token present, refreshing instead of requesting a device code");
            return startRefresh();
        }
        return startDeviceCodeFlow();
    }

    private Mono<TokenSet> startDeviceCodeFlow() {
        Optional<ErrorKind> violation = validator.validateForDeviceCode(properties);
        if (violation.isPresent()) {
            return Mono.error(events.emitError(violation.get(), null));
        }

        metrics.getDeviceCodeAttempts().increment();
        Sinks.One<Boolean> cancel = cancelSignal;

        return codeRequester.requestCode(properties)
                .flatMap(code -> poller.poll(code)
                        .takeUntilOther(cancel.asMono()));
    }

    private Mono<TokenSet> startRefresh() {
        if (!properties.hasRefreshToken()) {
            return startAuthentication();
        }

        metrics.getRefreshAttempts().increment();
        Mono<TokenSet> refreshed = refresher.refresh(properties);
        if (!properties.isAutoReAuthenticate()) {
            return refreshed;
        }

        return refreshed.onErrorResume(DeviceAuthOrchestrator::isInvalidRefreshToken, e -> {
            log.info("Refresh token rejected, starting device authorization");
            return startDeviceCodeFlow();
        });
    }

    /**
     * A subscriber failure on the error topics replaces the published error in the Mono,
     * so the decision is made on the published kind.
     */
    private static boolean isInvalidRefreshToken(Throwable error) {
        Object published = error instanceof EventDeliveryException delivery ? delivery.getPayload() : error;
        return published instanceof DeviceAuthException authError
                && authError.getKind() == ErrorKind.INVALID_REFRESH_TOKEN;
    }
}
