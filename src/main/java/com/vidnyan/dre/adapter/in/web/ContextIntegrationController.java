package com.vidnyan.dre.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.dre.application.port.in.ContextIntegrationUseCase;
import com.vidnyan.dre.application.port.in.ContextIntegrationUseCase.IntegrateCommand;
import com.vidnyan.dre.application.service.MetricsCollector;
import com.vidnyan.dre.domain.error.ResultsNotAvailableException;
import com.vidnyan.dre.domain.integration.ContextIntegration;
import com.vidnyan.dre.domain.integration.IntegrationChanges;
import com.vidnyan.dre.domain.integration.IntegrationResult;
import com.vidnyan.dre.domain.integration.IntegrationStatus;
import com.vidnyan.dre.domain.integration.IntegrationStrategy;
import com.vidnyan.dre.domain.integration.SourceConfidence;
import com.vidnyan.dre.domain.metrics.MetricsSnapshot;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * REST API for merging helper findings into an agent's context.
 */
@Slf4j
@RestController
@RequestMapping("/context-integration")
@RequiredArgsConstructor
public class ContextIntegrationController {

    private final ContextIntegrationUseCase integrations;
    private final MetricsCollector metricsCollector;

    @PostMapping("/create")
    public IntegrationCreatedResponse create(@RequestBody IntegrateBody body) {
        log.info("Integration for {} in {} (request {}, strategy {})", body.getRequestingAgent(),
                body.getWorkflowId(), body.getRequestId(), body.getIntegrationStrategy());
        if (body.getRequestingAgent() == null || body.getRequestingAgent().isBlank()) {
            throw new IllegalArgumentException("requesting_agent is required");
        }
        SourceConfidence confidence = body.getOriginalConfidence() != null || body.getNewConfidence() != null
                ? new SourceConfidence(
                        body.getOriginalConfidence() != null ? body.getOriginalConfidence() : 0.5,
                        body.getNewConfidence() != null ? body.getNewConfidence() : 0.5)
                : null;

        ContextIntegration integration = integrations.integrate(new IntegrateCommand(
                body.getRequestingAgent(),
                body.getWorkflowId(),
                body.getRequestId(),
                body.getOriginalContext(),
                body.getNewFindings(),
                body.getIntegrationStrategy(),
                confidence));

        IntegrationResult result = integration.result();
        IntegrationSummary summary = result == null ? null : new IntegrationSummary(
                result.strategyUsed(),
                result.recommendedStrategy(),
                result.changes(),
                result.unresolvedConflicts(),
                result.confidenceImprovement());
        return new IntegrationCreatedResponse(
                integration.integrationId(),
                integration.status(),
                result == null ? Map.of() : result.integratedContext(),
                summary,
                integration.confidenceImprovement(),
                integration.errorMessage());
    }

    @GetMapping("/{integrationId}/status")
    public IntegrationStatusResponse status(@PathVariable String integrationId) {
        ContextIntegration integration = integrations.getIntegration(integrationId);
        return new IntegrationStatusResponse(
                integration.integrationId(),
                integration.status(),
                integration.requestingAgent(),
                integration.workflowId(),
                integration.requestId(),
                integration.strategy(),
                integration.createdAt(),
                integration.completedAt(),
                integration.confidenceImprovement(),
                integration.isComplete());
    }

    @GetMapping("/{integrationId}/results")
    public IntegrationResult results(@PathVariable String integrationId) {
        ContextIntegration integration = integrations.getIntegration(integrationId);
        if (integration.result() == null) {
            throw new ResultsNotAvailableException(integrationId, integration.status().wireName());
        }
        return integration.result();
    }

    @GetMapping("/metrics")
    public IntegrationMetricsResponse metrics() {
        MetricsSnapshot snapshot = metricsCollector.snapshot();
        return new IntegrationMetricsResponse(
                snapshot.totalIntegrations(),
                snapshot.successfulIntegrations(),
                snapshot.failedIntegrations(),
                snapshot.avgConfidenceImprovement());
    }

    @Data
    public static class IntegrateBody {
        private String requestingAgent;
        private String workflowId;
        private String requestId;
        private Map<String, Object> originalContext;
        private Map<String, Object> newFindings;
        private IntegrationStrategy integrationStrategy;
        private Double originalConfidence;
        private Double newConfidence;
    }

    public record IntegrationSummary(
        IntegrationStrategy strategyUsed,
        IntegrationStrategy recommendedStrategy,
        IntegrationChanges changesMade,
        Set<String> unresolvedConflicts,
        double confidenceImprovement
    ) {}

    public record IntegrationCreatedResponse(
        String integrationId,
        IntegrationStatus status,
        Map<String, Object> integratedContext,
        IntegrationSummary integrationSummary,
        double confidenceImprovement,
        String errorMessage
    ) {}

    public record IntegrationStatusResponse(
        String integrationId,
        IntegrationStatus status,
        String requestingAgent,
        String workflowId,
        String requestId,
        IntegrationStrategy integrationStrategy,
        Instant createdAt,
        Instant completedAt,
        double confidenceImprovement,
        @JsonProperty("is_complete") boolean isComplete
    ) {}

    public record IntegrationMetricsResponse(
        long totalIntegrations,
        long successfulIntegrations,
        long failedIntegrations,
        double avgConfidenceImprovement
    ) {}
}
