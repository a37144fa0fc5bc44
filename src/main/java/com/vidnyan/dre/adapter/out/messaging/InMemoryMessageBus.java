package com.vidnyan.dre.adapter.out.messaging;

import com.vidnyan.dre.application.port.out.MessageBus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * In-process message bus. Listeners run on the event executor, so publishers never wait;
 * with a single-threaded executor events arrive in publish order.
 */
@Slf4j
@Component
public class InMemoryMessageBus implements MessageBus {

    private final Executor eventExecutor;
    private final Map<String, List<Listener<?>>> listeners = new ConcurrentHashMap<>();

    public InMemoryMessageBus(@Qualifier("eventExecutor") Executor eventExecutor) {
        this.eventExecutor = eventExecutor;
    }

    @Override
    public void publish(String topic, Object event) {
        List<Listener<?>> subscribed = listeners.get(topic);
        if (subscribed == null || subscribed.isEmpty()) {
            log.trace("No listeners on {} for {}", topic, event);
            return;
        }
        for (Listener<?> listener : subscribed) {
            if (listener.accepts(event)) {
                eventExecutor.execute(() -> deliver(topic, listener, event));
            }
        }
    }

    @Override
    public <T> Subscription subscribe(String topic, Class<T> eventType, Consumer<T> consumer) {
        Listener<T> listener = new Listener<>(eventType, consumer);
        listeners.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).add(listener);
        log.debug("Subscribed {} listener to {}", eventType.getSimpleName(), topic);
        return () -> listeners.getOrDefault(topic, List.of()).remove(listener);
    }

    private void deliver(String topic, Listener<?> listener, Object event) {
        try {
            listener.deliver(event);
        } catch (RuntimeException e) {
            log.warn("Listener on {} failed for {}: {}", topic, event, e.getMessage(), e);
        }
    }

    private record Listener<T>(Class<T> eventType, Consumer<T> consumer) {

        boolean accepts(Object event) {
            return eventType.isInstance(event);
        }

        void deliver(Object event) {
            consumer.accept(eventType.cast(event));
        }
    }
}
