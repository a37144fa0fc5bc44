package com.vidnyan.dre.application.service;

import com.vidnyan.dre.application.port.in.ContextIntegrationUseCase;
import com.vidnyan.dre.application.port.out.MessageBus;
import com.vidnyan.dre.domain.error.IntegrationNotFoundException;
import com.vidnyan.dre.domain.integration.ContextIntegration;
import com.vidnyan.dre.domain.integration.IntegrationCompletedEvent;
import com.vidnyan.dre.domain.integration.IntegrationResult;
import com.vidnyan.dre.domain.integration.IntegrationStatus;
import com.vidnyan.dre.domain.integration.IntegrationStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs integrations and keeps their records for status and result lookups.
 * Without an explicit strategy the one recommended by the compatibility analysis is used.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContextIntegrationService implements ContextIntegrationUseCase {

    private final ContextIntegrator integrator;
    private final MessageBus messageBus;
    private final Clock clock;

    private final Map<String, ContextIntegration> integrations = new ConcurrentHashMap<>();

    @Override
    public ContextIntegration integrate(IntegrateCommand command) {
        ContextIntegration integration = prepare(command);
        record(integration);
        return integration;
    }

    @Override
    public ContextIntegration prepare(IntegrateCommand command) {
        Instant startedAt = clock.instant();
        IntegrationStrategy strategy = command.strategy();

        try {
            if (strategy == null) {
                strategy = integrator.analyze(
                        command.originalContext() != null ? command.originalContext() : Map.of(),
                        command.newFindings() != null ? command.newFindings() : Map.of())
                        .recommendedStrategy();
                log.debug("[ContextIntegrationService] No strategy given for request {}, using recommended {}",
                        command.requestId(), strategy.wireName());
            }
            IntegrationResult result = integrator.integrate(
                    command.requestId(),
                    command.originalContext(),
                    command.newFindings(),
                    strategy,
                    command.sourceConfidence());
            return new ContextIntegration(
                    result.integrationId(),
                    command.requestingAgent(),
                    command.workflowId(),
                    command.requestId(),
                    strategy,
                    result.complete() ? IntegrationStatus.COMPLETED : IntegrationStatus.INCOMPLETE,
                    result,
                    result.complete() ? null : "Unresolved conflicts: " + result.unresolvedConflicts(),
                    startedAt,
                    clock.instant());
        } catch (RuntimeException e) {
            log.error("[ContextIntegrationService] Integration for request {} failed: {}",
                    command.requestId(), e.getMessage(), e);
            return new ContextIntegration(
                    UUID.randomUUID().toString(),
                    command.requestingAgent(),
                    command.workflowId(),
                    command.requestId(),
                    strategy,
                    IntegrationStatus.FAILED,
                    null,
                    e.getMessage(),
                    startedAt,
                    clock.instant());
        }
    }

    @Override
    public void record(ContextIntegration integration) {
        integrations.put(integration.integrationId(), integration);
        log.info("[ContextIntegrationService] Integration {} for {} / {}: {} (improvement {})",
                integration.integrationId(), integration.requestingAgent(), integration.workflowId(),
                integration.status().wireName(), String.format("%.3f", integration.confidenceImprovement()));
        messageBus.publish(MessageBus.INTEGRATION_COMPLETED, IntegrationCompletedEvent.of(integration));
    }

    @Override
    public ContextIntegration getIntegration(String integrationId) {
        ContextIntegration integration = integrations.get(integrationId);
        if (integration == null) {
            throw new IntegrationNotFoundException(integrationId);
        }
        return integration;
    }
}
