package uz.greenwhite.deviceauth.event;

import lombok.Getter;

import java.util.List;

/**
 * One or more subscribers threw while a notification was delivered.
 * The first failure is the cause, the others are suppressed.
 */
@Getter
public class EventDeliveryException extends RuntimeException {

    /**
     * The notification that was being delivered; every subscriber has seen it.
     */
    private final transient Object payload;

    public EventDeliveryException(String topic, Object payload, List<RuntimeException> failures) {
        super("Subscriber failed on topic '" + topic + "' (" + failures.size() + " failure(s))",
                failures.get(0));
        this.payload = payload;
        failures.stream().skip(1).forEach(this::addSuppressed);
    }
}
