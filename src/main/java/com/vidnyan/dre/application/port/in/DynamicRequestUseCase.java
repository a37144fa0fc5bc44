package com.vidnyan.dre.application.port.in;

import com.vidnyan.dre.domain.gap.InformationGap;
import com.vidnyan.dre.domain.request.AgentRequest;
import com.vidnyan.dre.domain.request.HelperResult;
import com.vidnyan.dre.domain.request.RequestStatus;
import com.vidnyan.dre.domain.request.RequestTransition;
import com.vidnyan.dre.domain.request.RequestType;
import com.vidnyan.dre.domain.request.RequestUrgency;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Primary use case: let executing agents ask for helper agents and follow their progress.
 */
public interface DynamicRequestUseCase {

    /**
     * Create a request, or return the live one already open for the same gap.
     * @throws com.vidnyan.dre.domain.error.SpawnDepthExceededException when nested too deep
     */
    AgentRequest createRequest(CreateRequestCommand command);

    /**
     * Scan an agent's trace for gaps and open requests for the serious ones.
     * Never fails because of a bad trace.
     */
    GapDetectionOutcome detectGaps(DetectGapsCommand command);

    RequestStatusView getStatus(String requestId);

    /**
     * Results of a finished request; empty while it is still running.
     */
    Optional<RequestResultsView> getResults(String requestId);

    List<RequestTransition> getHistory(String requestId);

    int queuedRequests();

    /**
     * Explicit request parameters.
     */
    record CreateRequestCommand(
        String requestingAgent,
        String workflowId,
        RequestType requestType,
        RequestUrgency urgency,
        String description,
        List<String> specificExpertiseNeeded,
        Map<String, Object> contextRequirements,
        Integer timeoutMinutes,     // null = configured default
        String gapId,
        String parentRequestId,
        Integer spawnDepth          // null = derived from parent, else 1
    ) {}

    record DetectGapsCommand(
        String agentName,
        Map<String, Object> taskContext,
        List<String> executionLog,
        Map<String, Object> currentFindings
    ) {}

    record GapDetectionOutcome(
        List<InformationGap> gapsDetected,
        int highPriorityGaps,
        List<String> autoRequestIds
    ) {
        public int gapCount() {
            return gapsDetected.size();
        }
    }

    record RequestStatusView(
        String requestId,
        RequestStatus status,
        String assignedAgent,
        double progressPercentage,
        Instant estimatedCompletion,
        boolean responseAvailable
    ) {}

    record RequestResultsView(
        String requestId,
        RequestStatus status,
        HelperResult responseData,
        Double confidenceScore,
        Double processingDuration,  // seconds
        String assignedAgent,
        String integrationId,
        String errorMessage
    ) {}
}
