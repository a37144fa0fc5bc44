package com.vidnyan.dre.domain.request;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A dynamic request raised by an executing agent for a helper agent.
 * Immutable snapshot; the lifecycle manager replaces it on every transition.
 */
@Value
@Builder(toBuilder = true)
public class AgentRequest {
    String requestId;
    String requestingAgent;
    String workflowId;
    RequestType requestType;
    RequestUrgency urgency;
    String description;
    RequestStatus status;

    String gapId;              // null for explicit requests without a gap
    String parentRequestId;
    int spawnDepth;
    boolean autoGenerated;

    @Builder.Default
    List<String> specificExpertiseNeeded = List.of();
    @Builder.Default
    Map<String, Object> contextRequirements = Map.of();
    @Builder.Default
    Map<String, Object> gapContext = Map.of();   // related context of the originating gap

    String assignedAgent;
    String contextPackageId;
    String spawnedWorkflowId;
    String integrationId;
    HelperResult responseData;
    Double confidenceScore;
    String errorMessage;

    Instant createdAt;
    Instant completedAt;
    Instant timeoutAt;

    public boolean isComplete() {
        return status.isTerminal();
    }

    public boolean isTimedOut(Instant now) {
        return !isComplete() && !now.isBefore(timeoutAt);
    }

    /**
     * Processing duration, or null while still running.
     */
    public Duration duration() {
        return completedAt == null ? null : Duration.between(createdAt, completedAt);
    }

    /**
     * Key under which duplicate requests for the same gap are suppressed.
     */
    public DedupKey dedupKey() {
        return gapId == null ? null : new DedupKey(requestingAgent, workflowId, gapId);
    }

    public record DedupKey(String requestingAgent, String workflowId, String gapId) {
    }
}
