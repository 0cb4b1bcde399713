package uz.greenwhite.deviceauth.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.deviceauth.error.DeviceAuthException;
import uz.greenwhite.deviceauth.error.ErrorKind;
import uz.greenwhite.deviceauth.error.GatewayTransportException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous publish/subscribe channel for device authorization events.
 *
 * Handlers run on the publishing thread in subscription order. A throwing handler
 * does not stop delivery to the rest; failures are rethrown together afterwards
 * as {@link EventDeliveryException}.
 */
@Slf4j
@Component
public class DeviceAuthEvents {

    private final Map<Topic<?>, List<Consumer<Object>>> handlers = new ConcurrentHashMap<>();
    private final Map<ErrorKind, List<Consumer<? super DeviceAuthException>>> errorHandlers =
            new EnumMap<>(ErrorKind.class);

    public DeviceAuthEvents() {
        for (ErrorKind kind : ErrorKind.values()) {
            errorHandlers.put(kind, new CopyOnWriteArrayList<>());
        }
    }

    @SuppressWarnings("unchecked")
    public <T> void subscribe(Topic<T> topic, Consumer<? super T> handler) {
        handlers.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>())
                .add((Consumer<Object>) handler);
    }

    /**
     * Subscribe to a single error kind ("error.&lt;code&gt;")
     */
    public void subscribe(ErrorKind kind, Consumer<? super DeviceAuthException> handler) {
        errorHandlers.get(kind).add(handler);
    }

    public <T> void publish(Topic<T> topic, T payload) {
        List<RuntimeException> failures = new ArrayList<>();
        deliver(topic.getName(), handlers.getOrDefault(topic, List.of()), payload, failures);
        rethrow(topic.getName(), payload, failures);
    }

    /**
     * Classified error: kind-specific subscribers first, then the generic error topic.
     */
    public void publishError(DeviceAuthException error) {
        log.warn("Device auth error [{}]: {}", error.getCode(), error.getMessage());

        List<RuntimeException> failures = new ArrayList<>();
        deliver(error.getKind().getTopic(), errorHandlers.get(error.getKind()), error, failures);
        deliver(Topic.ERROR.getName(), handlers.getOrDefault(Topic.ERROR, List.of()), error, failures);
        rethrow(error.getKind().getTopic(), error, failures);
    }

    /**
     * Build and publish a classified error; the returned exception is the published instance.
     */
    public DeviceAuthException emitError(ErrorKind kind, Object data) {
        DeviceAuthException error = kind.toException(data);
        publishError(error);
        return error;
    }

    /**
     * Transport failures are not classified and only reach the generic error topic.
     */
    public void publishTransportFailure(GatewayTransportException failure) {
        log.error("Device auth transport failure: {} -> {}", failure.getUrl(), failure.getMessage());
        publish(Topic.ERROR, failure);
    }

    public int subscriberCount(Topic<?> topic) {
        return handlers.getOrDefault(topic, List.of()).size();
    }

    private <T> void deliver(String topic, List<? extends Consumer<? super T>> subscribers,
                             T payload, List<RuntimeException> failures) {
        for (Consumer<? super T> handler : subscribers) {
            try {
                handler.accept(payload);
            } catch (RuntimeException e) {
                log.error("Subscriber on topic '{}' failed: {}", topic, e.getMessage(), e);
                failures.add(e);
            }
        }
    }

    private void rethrow(String topic, Object payload, List<RuntimeException> failures) {
        if (!failures.isEmpty()) {
            throw new EventDeliveryException(topic, payload, failures);
        }
    }
}
