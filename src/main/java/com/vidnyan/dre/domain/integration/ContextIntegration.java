package com.vidnyan.dre.domain.integration;

import java.time.Instant;

/**
 * A tracked integration operation, queryable by id.
 */
public record ContextIntegration(
    String integrationId,
    String requestingAgent,
    String workflowId,
    String requestId,
    IntegrationStrategy strategy,
    IntegrationStatus status,
    IntegrationResult result,
    String errorMessage,
    Instant createdAt,
    Instant completedAt
) {

    public boolean isComplete() {
        return status == IntegrationStatus.COMPLETED;
    }

    public double confidenceImprovement() {
        return result == null ? 0.0 : result.confidenceImprovement();
    }
}
