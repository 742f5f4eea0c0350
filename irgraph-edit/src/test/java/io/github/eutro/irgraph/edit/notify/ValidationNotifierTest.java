package io.github.eutro.irgraph.edit.notify;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

public class ValidationNotifierTest {
    @Test
    void testDeliveryOrder() {
        ValidationNotifier notifier = new ValidationNotifier();
        List<String> seen = new ArrayList<>();
        notifier.subscribe(e -> seen.add("first " + e.valid));
        notifier.subscribe(e -> seen.add("second " + e.diagnostics));
        ValidationEvent event = notifier.publish(false, Collections.singletonList("ERROR: bad"));
        assertEquals(Arrays.asList("first false", "second [ERROR: bad]"), seen);
        assertFalse(event.valid);
        assertThrows(UnsupportedOperationException.class, () -> event.diagnostics.add("more"));
    }

    @Test
    void testThrowingSubscriberIsDropped() {
        ValidationNotifier notifier = new ValidationNotifier();
        List<ValidationEvent> seen = new ArrayList<>();
        notifier.subscribe(e -> {
            throw new IllegalStateException("subscriber is gone");
        });
        notifier.subscribe(seen::add);
        assertEquals(2, notifier.subscriberCount());

        notifier.publish(true, Collections.emptyList());
        assertEquals(1, seen.size());
        assertEquals(1, notifier.subscriberCount());

        notifier.publish(true, Collections.emptyList());
        assertEquals(2, seen.size());
    }

    @Test
    void testUnsubscribe() {
        ValidationNotifier notifier = new ValidationNotifier();
        List<ValidationEvent> seen = new ArrayList<>();
        Consumer<ValidationEvent> subscriber = seen::add;
        notifier.subscribe(subscriber);
        notifier.subscribe(subscriber);
        assertEquals(1, notifier.subscriberCount());

        notifier.publish(true, Collections.emptyList());
        assertEquals(1, seen.size());

        assertTrue(notifier.unsubscribe(subscriber));
        assertFalse(notifier.unsubscribe(subscriber));
        notifier.publish(true, Collections.emptyList());
        assertEquals(1, seen.size());
        assertEquals(0, notifier.subscriberCount());
    }
}
