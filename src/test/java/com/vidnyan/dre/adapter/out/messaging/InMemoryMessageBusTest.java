package com.vidnyan.dre.adapter.out.messaging;

import com.vidnyan.dre.application.port.out.MessageBus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMessageBusTest {

    @Test
    void publish_ShouldDeliverMatchingEventsOnTheExecutor() {
        // Arrange
        List<Runnable> queued = new ArrayList<>();
        Executor deferred = queued::add;
        InMemoryMessageBus bus = new InMemoryMessageBus(deferred);
        List<String> received = new ArrayList<>();
        bus.subscribe("topic", String.class, received::add);

        // Act
        bus.publish("topic", "hello");
        bus.publish("topic", 42);
        bus.publish("other", "ignored");

        // Assert
        assertTrue(received.isEmpty(), "delivery must not happen on the publishing thread");
        queued.forEach(Runnable::run);
        assertEquals(List.of("hello"), received);
    }

    @Test
    void publish_ShouldKeepDeliveringAfterListenerFailure() {
        InMemoryMessageBus bus = new InMemoryMessageBus(Runnable::run);
        List<String> received = new ArrayList<>();
        bus.subscribe("topic", String.class, s -> {
            throw new IllegalStateException("listener broke");
        });
        bus.subscribe("topic", String.class, received::add);

        bus.publish("topic", "first");
        bus.publish("topic", "second");

        assertEquals(List.of("first", "second"), received);
    }

    @Test
    void cancel_ShouldStopDelivery() {
        InMemoryMessageBus bus = new InMemoryMessageBus(Runnable::run);
        List<String> received = new ArrayList<>();
        MessageBus.Subscription subscription = bus.subscribe("topic", String.class, received::add);

        bus.publish("topic", "before");
        subscription.cancel();
        bus.publish("topic", "after");

        assertEquals(List.of("before"), received);
    }
}
