package io.github.eutro.irgraph.edit.notify;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Fans validation results out to subscribers, in subscription order.
 * <p>
 * A subscriber that throws is unsubscribed; publishing never fails.
 */
public class ValidationNotifier {
    private static final Logger LOGGER = LogManager.getLogger();

    private final Set<Consumer<ValidationEvent>> subscribers = new LinkedHashSet<>();

    public void subscribe(@NotNull Consumer<ValidationEvent> subscriber) {
        subscribers.add(subscriber);
    }

    public boolean unsubscribe(Consumer<ValidationEvent> subscriber) {
        return subscribers.remove(subscriber);
    }

    /**
     * Deliver a validation result to every subscriber.
     *
     * @param valid       Whether the module is valid.
     * @param diagnostics The diagnostics.
     * @return The event that was delivered.
     */
    public ValidationEvent publish(boolean valid, List<String> diagnostics) {
        ValidationEvent event = new ValidationEvent(valid, diagnostics);
        List<Consumer<ValidationEvent>> dead = new ArrayList<>();
        for (Consumer<ValidationEvent> subscriber : new ArrayList<>(subscribers)) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                LOGGER.warn("Dropping validation subscriber {}", subscriber, e);
                dead.add(subscriber);
            }
        }
        dead.forEach(subscribers::remove);
        return event;
    }

    public int subscriberCount() {
        return subscribers.size();
    }
}
