package com.vidnyan.dre.adapter.in.web;

import com.vidnyan.dre.application.port.in.DynamicRequestUseCase;
import com.vidnyan.dre.application.port.in.DynamicRequestUseCase.CreateRequestCommand;
import com.vidnyan.dre.application.port.in.DynamicRequestUseCase.DetectGapsCommand;
import com.vidnyan.dre.application.port.in.DynamicRequestUseCase.GapDetectionOutcome;
import com.vidnyan.dre.application.port.in.DynamicRequestUseCase.RequestResultsView;
import com.vidnyan.dre.application.port.in.DynamicRequestUseCase.RequestStatusView;
import com.vidnyan.dre.application.service.MetricsCollector;
import com.vidnyan.dre.domain.error.ResultsNotAvailableException;
import com.vidnyan.dre.domain.gap.InformationGap;
import com.vidnyan.dre.domain.metrics.MetricsSnapshot;
import com.vidnyan.dre.domain.request.AgentRequest;
import com.vidnyan.dre.domain.request.RequestStatus;
import com.vidnyan.dre.domain.request.RequestTransition;
import com.vidnyan.dre.domain.request.RequestType;
import com.vidnyan.dre.domain.request.RequestUrgency;
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
import java.util.List;
import java.util.Map;

/**
 * REST API for agents that need help from other agents.
 */
@Slf4j
@RestController
@RequestMapping("/dynamic-requests")
@RequiredArgsConstructor
public class DynamicRequestController {

    private final DynamicRequestUseCase dynamicRequests;
    private final MetricsCollector metricsCollector;

    @PostMapping("/create")
    public CreatedResponse create(@RequestBody CreateRequestBody body) {
        log.info("Create request from {} in {}: {}", body.getRequestingAgent(), body.getWorkflowId(),
                body.getRequestType());
        AgentRequest request = dynamicRequests.createRequest(new CreateRequestCommand(
                body.getRequestingAgent(),
                body.getWorkflowId(),
                body.getRequestType(),
                body.getUrgency(),
                body.getDescription(),
                body.getSpecificExpertiseNeeded(),
                body.getContextRequirements(),
                body.getTimeoutMinutes(),
                body.getGapId(),
                body.getParentRequestId(),
                body.getSpawnDepth()));
        return new CreatedResponse(
                request.getRequestId(),
                request.getStatus(),
                request.getCreatedAt(),
                request.getRequestingAgent(),
                request.getWorkflowId(),
                request.getRequestType(),
                request.getUrgency(),
                request.getDescription(),
                request.getSpawnDepth());
    }

    @PostMapping("/detect-gaps")
    public GapDetectionResponse detectGaps(@RequestBody DetectGapsBody body) {
        log.info("Gap detection for {} ({} log lines)", body.getAgentName(),
                body.getExecutionLog() == null ? 0 : body.getExecutionLog().size());
        GapDetectionOutcome outcome = dynamicRequests.detectGaps(new DetectGapsCommand(
                body.getAgentName(),
                body.getTaskContext(),
                body.getExecutionLog(),
                body.getCurrentFindings()));
        return new GapDetectionResponse(
                outcome.gapsDetected(),
                outcome.gapCount(),
                outcome.highPriorityGaps(),
                outcome.autoRequestIds());
    }

    @GetMapping("/{requestId}/status")
    public RequestStatusView status(@PathVariable String requestId) {
        return dynamicRequests.getStatus(requestId);
    }

    @GetMapping("/{requestId}/results")
    public RequestResultsView results(@PathVariable String requestId) {
        return dynamicRequests.getResults(requestId)
                .orElseThrow(() -> new ResultsNotAvailableException(
                        requestId, dynamicRequests.getStatus(requestId).status().wireName()));
    }

    @GetMapping("/{requestId}/history")
    public List<RequestTransition> history(@PathVariable String requestId) {
        return dynamicRequests.getHistory(requestId);
    }

    @GetMapping("/metrics")
    public MetricsSnapshot metrics() {
        return metricsCollector.snapshot();
    }

    @Data
    public static class CreateRequestBody {
        private String requestingAgent;
        private String workflowId;
        private RequestType requestType;
        private RequestUrgency urgency;
        private String description;
        private List<String> specificExpertiseNeeded;
        private Map<String, Object> contextRequirements;
        private Integer timeoutMinutes;
        private String gapId;
        private String parentRequestId;
        private Integer spawnDepth;
    }

    @Data
    public static class DetectGapsBody {
        private String agentName;
        private Map<String, Object> taskContext;
        private List<String> executionLog;
        private Map<String, Object> currentFindings;
    }

    public record CreatedResponse(
        String requestId,
        RequestStatus status,
        Instant createdAt,
        String requestingAgent,
        String workflowId,
        RequestType requestType,
        RequestUrgency urgency,
        String description,
        int spawnDepth
    ) {}

    public record GapDetectionResponse(
        List<InformationGap> gapsDetected,
        int gapCount,
        int highPriorityGaps,
        List<String> autoRequestIds
    ) {}
}
