package com.vidnyan.dre.application.service;

import com.vidnyan.dre.application.port.in.DynamicRequestUseCase;
import com.vidnyan.dre.application.port.out.MessageBus;
import com.vidnyan.dre.domain.integration.IntegrationCompletedEvent;
import com.vidnyan.dre.domain.integration.IntegrationStatus;
import com.vidnyan.dre.domain.metrics.MetricsSnapshot;
import com.vidnyan.dre.domain.request.RequestStatus;
import com.vidnyan.dre.domain.request.RequestTransition;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Aggregates request and integration counters from bus events.
 * Never called by the lifecycle itself.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsCollector {

    private final MessageBus messageBus;
    private final DynamicRequestUseCase requests;

    private final Map<String, Instant> createdAt = new ConcurrentHashMap<>();
    private final List<MessageBus.Subscription> subscriptions = new ArrayList<>();

    private long totalRequests;
    private long completedRequests;
    private long failedRequests;
    private double totalResponseSeconds;

    private long totalIntegrations;
    private long successfulIntegrations;
    private long failedIntegrations;
    private double totalImprovement;

    @PostConstruct
    public void subscribe() {
        subscriptions.add(messageBus.subscribe(
                MessageBus.REQUEST_TRANSITIONS, RequestTransition.class, this::onTransition));
        subscriptions.add(messageBus.subscribe(
                MessageBus.INTEGRATION_COMPLETED, IntegrationCompletedEvent.class, this::onIntegration));
        log.info("Metrics collector subscribed to {} and {}",
                MessageBus.REQUEST_TRANSITIONS, MessageBus.INTEGRATION_COMPLETED);
    }

    @PreDestroy
    public void unsubscribe() {
        subscriptions.forEach(MessageBus.Subscription::cancel);
        subscriptions.clear();
    }

    void onTransition(RequestTransition transition) {
        if (transition.from() == null) {
            createdAt.put(transition.requestId(), transition.timestamp());
            synchronized (this) {
                totalRequests++;
            }
            return;
        }
        if (!transition.to().isTerminal()) {
            return;
        }
        Instant created = createdAt.remove(transition.requestId());
        synchronized (this) {
            if (transition.to() == RequestStatus.COMPLETED) {
                completedRequests++;
                if (created != null) {
                    totalResponseSeconds += Duration.between(created, transition.timestamp()).toMillis() / 1000.0;
                }
            } else {
                failedRequests++;
            }
        }
    }

    void onIntegration(IntegrationCompletedEvent event) {
        synchronized (this) {
            totalIntegrations++;
            if (event.status() == IntegrationStatus.COMPLETED) {
                successfulIntegrations++;
            } else {
                failedIntegrations++;
            }
            totalImprovement += event.confidenceImprovement();
        }
    }

    public synchronized MetricsSnapshot snapshot() {
        long finished = completedRequests + failedRequests;
        return new MetricsSnapshot(
                totalRequests,
                completedRequests,
                failedRequests,
                Math.max(0, totalRequests - finished),
                requests.queuedRequests(),
                finished == 0 ? 0.0 : (double) completedRequests / finished,
                completedRequests == 0 ? 0.0 : totalResponseSeconds / completedRequests,
                totalIntegrations,
                successfulIntegrations,
                failedIntegrations,
                totalIntegrations == 0 ? 0.0 : totalImprovement / totalIntegrations);
    }
}
