package com.vidnyan.dre.domain.metrics;

/**
 * Point-in-time view of request and integration counters.
 * Counters lag the lifecycle slightly since events arrive asynchronously.
 */
public record MetricsSnapshot(
    long totalRequests,
    long completedRequests,
    long failedRequests,
    long activeRequests,
    int queuedRequests,
    double successRate,
    double avgResponseTime,         // seconds, completed requests only
    long totalIntegrations,
    long successfulIntegrations,
    long failedIntegrations,
    double avgConfidenceImprovement
) {
}
