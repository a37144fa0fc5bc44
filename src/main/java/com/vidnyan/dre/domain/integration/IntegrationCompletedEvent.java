package com.vidnyan.dre.domain.integration;

import java.time.Instant;

/**
 * Published once an integration reaches a final status.
 */
public record IntegrationCompletedEvent(
    String integrationId,
    String requestId,
    IntegrationStatus status,
    double confidenceImprovement,
    Instant timestamp
) {

    public static IntegrationCompletedEvent of(ContextIntegration integration) {
        return new IntegrationCompletedEvent(
                integration.integrationId(),
                integration.requestId(),
                integration.status(),
                integration.confidenceImprovement(),
                integration.completedAt());
    }
}
