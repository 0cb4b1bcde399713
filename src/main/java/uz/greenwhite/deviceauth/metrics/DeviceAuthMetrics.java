package uz.greenwhite.deviceauth.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.deviceauth.error.DeviceAuthException;
import uz.greenwhite.deviceauth.event.DeviceAuthEvents;
import uz.greenwhite.deviceauth.event.Topic;

/**
 * Counters for the device authorization flow.
 *
 * Naming convention:
 *   device_auth.{stage}.{metric_type}
 *
 * Tags:
 *   flow   = device_code | refresh
 *   result = success | error
 *   code   = error kind code, or "transport"
 */
@Slf4j
@Getter
@Component
public class DeviceAuthMetrics {

    private static final String ERROR_METER = "device_auth.error.total";
    private static final String ERROR_DESCRIPTION = "Device auth errors by code";

    private final MeterRegistry registry;

    private final Counter deviceCodeAttempts;
    private final Counter refreshAttempts;
    private final Counter authSuccess;
    private final Counter refreshSuccess;
    private final Counter pollTicks;
    private final Counter pollSlowDown;
    private final Counter transportFailures;

    public DeviceAuthMetrics(MeterRegistry registry, DeviceAuthEvents events) {
        this.registry = registry;

        this.deviceCodeAttempts = Counter.builder("device_auth.attempt.total")
                .description("Device code authorization attempts")
                .tag("flow", "device_code")
                .register(registry);

        this.refreshAttempts = Counter.builder("device_auth.attempt.total")
                .description("Token refresh attempts")
                .tag("flow", "refresh")
                .register(registry);

        this.authSuccess = Counter.builder("device_auth.result.total")
                .description("Completed device authorizations")
                .tag("flow", "device_code")
                .tag("result", "success")
                .register(registry);

        this.refreshSuccess = Counter.builder("device_auth.result.total")
                .description("Completed token refreshes")
                .tag("flow", "refresh")
                .tag("result", "success")
                .register(registry);

        this.pollTicks = Counter.builder("device_auth.poll.ticks")
                .description("Token endpoint polls")
                .register(registry);

        this.pollSlowDown = Counter.builder("device_auth.poll.slow_down")
                .description("slow_down responses while polling")
                .register(registry);

        this.transportFailures = Counter.builder(ERROR_METER)
                .description(ERROR_DESCRIPTION)
                .tag("code", "transport")
                .register(registry);

        events.subscribe(Topic.AUTH_SUCCESS, tokens -> authSuccess.increment());
        events.subscribe(Topic.REFRESH_SUCCESS, tokens -> refreshSuccess.increment());
        events.subscribe(Topic.ERROR, this::recordError);

        log.info("Device auth metrics registered");
    }

    private void recordError(RuntimeException error) {
        if (error instanceof DeviceAuthException classified) {
            Counter.builder(ERROR_METER)
                    .description(ERROR_DESCRIPTION)
                    .tag("code", classified.getCode())
                    .register(registry)
                    .increment();
        } else {
            transportFailures.increment();
        }
    }
}
