package com.vidnyan.dre.application.port.out;

import java.util.function.Consumer;

/**
 * Asynchronous topic-based message bus.
 * Publishing never waits for subscribers.
 */
public interface MessageBus {

    String REQUEST_TRANSITIONS = "dre.request.transitions";
    String INTEGRATION_COMPLETED = "dre.integration.completed";

    void publish(String topic, Object event);

    /**
     * Deliver events of the given type published on the topic.
     */
    <T> Subscription subscribe(String topic, Class<T> eventType, Consumer<T> listener);

    interface Subscription {
        void cancel();
    }
}
