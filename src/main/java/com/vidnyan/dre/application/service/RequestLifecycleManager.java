package com.vidnyan.dre.application.service;

import com.vidnyan.dre.application.port.in.ContextIntegrationUseCase;
import com.vidnyan.dre.application.port.in.ContextIntegrationUseCase.IntegrateCommand;
import com.vidnyan.dre.application.port.in.DynamicRequestUseCase;
import com.vidnyan.dre.application.port.out.AgentRegistry;
import com.vidnyan.dre.application.port.out.HelperWorkflowLauncher;
import com.vidnyan.dre.application.port.out.HelperWorkflowLauncher.HelperExecution;
import com.vidnyan.dre.application.port.out.MessageBus;
import com.vidnyan.dre.application.port.out.RequestArchive;
import com.vidnyan.dre.config.DynamicRequestProperties;
import com.vidnyan.dre.domain.error.DynamicRequestException;
import com.vidnyan.dre.domain.error.NoCapableAgentException;
import com.vidnyan.dre.domain.error.RequestNotFoundException;
import com.vidnyan.dre.domain.error.RequestTimeoutException;
import com.vidnyan.dre.domain.error.SpawnDepthExceededException;
import com.vidnyan.dre.domain.gap.InformationGap;
import com.vidnyan.dre.domain.integration.ContextIntegration;
import com.vidnyan.dre.domain.integration.SourceConfidence;
import com.vidnyan.dre.domain.request.AgentRequest;
import com.vidnyan.dre.domain.request.ContextPackage;
import com.vidnyan.dre.domain.request.HelperResult;
import com.vidnyan.dre.domain.request.RequestStatus;
import com.vidnyan.dre.domain.request.RequestTransition;
import com.vidnyan.dre.domain.request.RequestUrgency;
import com.vidnyan.dre.domain.request.RequestType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * Owns every dynamic request from creation to a terminal state.
 *
 * <pre>
 * PENDING -> [ANALYZING] -> AGENT_SELECTED -> CONTEXT_GENERATED -> EXECUTING -> COMPLETED
 *    \___________\________________\__________________\________________\____-> FAILED
 * </pre>
 *
 * Only auto-generated requests pass through ANALYZING. At most
 * {@code dre.max-concurrent-requests} lifecycles run at once, the rest wait in FIFO order.
 * Transitions of one request are serialized on its slot; nothing is locked across requests.
 * Terminal requests move to the {@link RequestArchive} and stay readable there.
 */
@Slf4j
@Service
public class RequestLifecycleManager implements DynamicRequestUseCase {

    static final String WORKFLOW_ID_KEY = "workflow_id";
    static final String SPAWN_DEPTH_KEY = "spawn_depth";
    static final String UNKNOWN_WORKFLOW = "unknown";

    private final DynamicRequestProperties properties;
    private final GapDetector gapDetector;
    private final AgentSelector agentSelector;
    private final ContextPackageBuilder packageBuilder;
    private final AgentRegistry agentRegistry;
    private final HelperWorkflowLauncher helperLauncher;
    private final ContextIntegrationUseCase integrationUseCase;
    private final RequestArchive archive;
    private final MessageBus messageBus;
    private final Executor requestExecutor;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private final Map<String, RequestSlot> activeRequests = new ConcurrentHashMap<>();
    private final Map<AgentRequest.DedupKey, String> liveByGap = new ConcurrentHashMap<>();
    private final Queue<String> pending = new ConcurrentLinkedQueue<>();
    private final AtomicInteger inFlight = new AtomicInteger();

    public RequestLifecycleManager(DynamicRequestProperties properties,
                                   GapDetector gapDetector,
                                   AgentSelector agentSelector,
                                   ContextPackageBuilder packageBuilder,
                                   AgentRegistry agentRegistry,
                                   HelperWorkflowLauncher helperLauncher,
                                   ContextIntegrationUseCase integrationUseCase,
                                   RequestArchive archive,
                                   MessageBus messageBus,
                                   @Qualifier("requestExecutor") Executor requestExecutor,
                                   TaskScheduler scheduler,
                                   Clock clock) {
        this.properties = properties;
        this.gapDetector = gapDetector;
        this.agentSelector = agentSelector;
        this.packageBuilder = packageBuilder;
        this.agentRegistry = agentRegistry;
        this.helperLauncher = helperLauncher;
        this.integrationUseCase = integrationUseCase;
        this.archive = archive;
        this.messageBus = messageBus;
        this.requestExecutor = requestExecutor;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    // ---------------------------------------------------------------- creation

    @Override
    public AgentRequest createRequest(CreateRequestCommand command) {
        requireText(command.requestingAgent(), "requesting_agent");
        requireText(command.workflowId(), "workflow_id");
        if (command.requestType() == null) {
            throw new IllegalArgumentException("request_type is required");
        }
        int timeoutMinutes = command.timeoutMinutes() != null
                ? command.timeoutMinutes()
                : properties.getDefaultTimeoutMinutes();
        if (timeoutMinutes < 0) {
            throw new IllegalArgumentException("timeout_minutes must not be negative");
        }
        int spawnDepth = checkSpawnDepth(resolveSpawnDepth(command));

        Instant now = clock.instant();
        AgentRequest request = AgentRequest.builder()
                .requestId(UUID.randomUUID().toString())
                .requestingAgent(command.requestingAgent())
                .workflowId(command.workflowId())
                .requestType(command.requestType())
                .urgency(command.urgency() != null ? command.urgency() : RequestUrgency.MEDIUM)
                .description(command.description() != null ? command.description() : "")
                .status(RequestStatus.PENDING)
                .gapId(command.gapId())
                .parentRequestId(command.parentRequestId())
                .spawnDepth(spawnDepth)
                .autoGenerated(false)
                .specificExpertiseNeeded(command.specificExpertiseNeeded() != null
                        ? List.copyOf(command.specificExpertiseNeeded()) : List.of())
                .contextRequirements(command.contextRequirements() != null
                        ? command.contextRequirements() : Map.of())
                .createdAt(now)
                .timeoutAt(now.plus(Duration.ofMinutes(timeoutMinutes)))
                .build();
        return open(request);
    }

    @Override
    public GapDetectionOutcome detectGaps(DetectGapsCommand command) {
        Map<String, Object> taskContext = command.taskContext() != null ? command.taskContext() : Map.of();
        Map<String, Object> findings = command.currentFindings() != null ? command.currentFindings() : Map.of();

        List<InformationGap> gaps = gapDetector.detectGaps(
                command.agentName(), taskContext, command.executionLog(), findings);

        String workflowId = taskContext.get(WORKFLOW_ID_KEY) instanceof String id && !id.isBlank()
                ? id : UNKNOWN_WORKFLOW;
        int depth = (taskContext.get(SPAWN_DEPTH_KEY) instanceof Number n ? n.intValue() : 0) + 1;

        List<String> requestIds = new ArrayList<>();
        for (InformationGap gap : gaps) {
            if (!gap.severity().isAtLeast(properties.getAutoRequestMinSeverity())) {
                continue;
            }
            try {
                AgentRequest request = openForGap(command.agentName(), workflowId, gap, depth, findings);
                if (!requestIds.contains(request.getRequestId())) {
                    requestIds.add(request.getRequestId());
                }
            } catch (SpawnDepthExceededException e) {
                log.warn("[RequestLifecycleManager] Not opening a request for gap {} of {}: {}",
                        gap.gapId(), command.agentName(), e.getMessage());
            }
        }

        int highPriority = (int) gaps.stream().filter(InformationGap::isHighPriority).count();
        return new GapDetectionOutcome(gaps, highPriority, requestIds);
    }

    private AgentRequest openForGap(String agentName, String workflowId, InformationGap gap, int depth,
                                    Map<String, Object> findings) {
        checkSpawnDepth(depth);
        Instant now = clock.instant();
        AgentRequest request = AgentRequest.builder()
                .requestId(UUID.randomUUID().toString())
                .requestingAgent(agentName)
                .workflowId(workflowId)
                .requestType(RequestType.forGap(gap.gapType()))
                .urgency(RequestUrgency.forSeverity(gap.severity()))
                .description(gap.description())
                .status(RequestStatus.PENDING)
                .gapId(gap.gapId())
                .spawnDepth(depth)
                .autoGenerated(true)
                .specificExpertiseNeeded(gap.suggestedExpertise().stream().sorted().toList())
                .contextRequirements(findings)
                .gapContext(gap.relatedContext())
                .createdAt(now)
                .timeoutAt(now.plus(Duration.ofMinutes(properties.getDefaultTimeoutMinutes())))
                .build();
        return open(request);
    }

    /**
     * Register a new request, or hand back the live one already open for the same gap.
     */
    private AgentRequest open(AgentRequest request) {
        String requestId = request.getRequestId();
        RequestSlot slot = new RequestSlot(request);
        activeRequests.put(requestId, slot);

        AgentRequest.DedupKey key = request.dedupKey();
        if (key != null) {
            String owner = liveByGap.compute(key, (k, existing) ->
                    existing != null && activeRequests.containsKey(existing) ? existing : requestId);
            if (!owner.equals(requestId)) {
                activeRequests.remove(requestId, slot);
                log.info("[RequestLifecycleManager] Gap {} of {} already has live request {}",
                        key.gapId(), key.requestingAgent(), owner);
                RequestSlot live = activeRequests.get(owner);
                if (live != null) {
                    return live.request;
                }
                return archive.find(owner).orElseThrow(() -> new RequestNotFoundException(owner));
            }
        }

        RequestTransition created = new RequestTransition(requestId, null, RequestStatus.PENDING, request.getCreatedAt());
        synchronized (slot) {
            slot.history.add(created);
            messageBus.publish(MessageBus.REQUEST_TRANSITIONS, created);
        }
        log.info("[RequestLifecycleManager] Request {} created by {} in {}: {} / {} (depth {}{})",
                requestId, request.getRequestingAgent(), request.getWorkflowId(),
                request.getRequestType().wireName(), request.getUrgency().wireName(),
                request.getSpawnDepth(), request.isAutoGenerated() ? ", auto" : "");

        ScheduledFuture<?> timeoutTask = scheduler.schedule(() -> expire(slot), request.getTimeoutAt());
        synchronized (slot) {
            if (!slot.request.isComplete()) {
                slot.timeoutTask = timeoutTask;
            }
        }

        pending.add(requestId);
        drain();
        return request;
    }

    private int resolveSpawnDepth(CreateRequestCommand command) {
        Integer explicit = command.spawnDepth();
        if (explicit != null && explicit < 1) {
            throw new IllegalArgumentException("spawn_depth must be at least 1");
        }
        if (command.parentRequestId() != null) {
            int childDepth = findRequest(command.parentRequestId()).getSpawnDepth() + 1;
            return explicit != null ? Math.max(explicit, childDepth) : childDepth;
        }
        return explicit != null ? explicit : 1;
    }

    private int checkSpawnDepth(int depth) {
        if (depth > properties.getMaxSpawnDepth()) {
            throw new SpawnDepthExceededException(depth, properties.getMaxSpawnDepth());
        }
        return depth;
    }

    // ---------------------------------------------------------------- admission

    private void drain() {
        while (true) {
            int running = inFlight.get();
            if (running >= properties.getMaxConcurrentRequests() || pending.isEmpty()) {
                return;
            }
            if (!inFlight.compareAndSet(running, running + 1)) {
                continue;
            }
            String next = pending.poll();
            RequestSlot slot = next == null ? null : activeRequests.get(next);
            if (slot == null || !admit(slot)) {
                inFlight.decrementAndGet();
                continue;
            }
            try {
                requestExecutor.execute(() -> process(slot));
            } catch (RejectedExecutionException e) {
                log.error("[RequestLifecycleManager] Executor rejected request {}", next, e);
                fail(slot, "Request could not be scheduled: " + e.getMessage());
            }
        }
    }

    private boolean admit(RequestSlot slot) {
        synchronized (slot) {
            if (slot.request.isComplete()) {
                return false;
            }
            slot.admitted = true;
            return true;
        }
    }

    // ---------------------------------------------------------------- processing

    private void process(RequestSlot slot) {
        String requestId = slot.request.getRequestId();
        try {
            if (slot.request.isAutoGenerated() && !advance(slot, RequestStatus.ANALYZING, UnaryOperator.identity())) {
                return;
            }
            List<String> expertise = resolveExpertise(slot.request);
            String agent = agentSelector.selectAgent(new LinkedHashSet<>(expertise), agentRegistry.snapshot());
            if (!advance(slot, RequestStatus.AGENT_SELECTED,
                    b -> b.assignedAgent(agent).specificExpertiseNeeded(expertise))) {
                return;
            }

            ContextPackage contextPackage = packageBuilder.build(slot.request);
            if (!advance(slot, RequestStatus.CONTEXT_GENERATED,
                    b -> b.contextPackageId(contextPackage.packageId()))) {
                return;
            }

            HelperExecution execution = helperLauncher.launch(slot.request, contextPackage);
            RequestTransition executing;
            synchronized (slot) {
                executing = applyTransition(slot, RequestStatus.EXECUTING,
                        b -> b.spawnedWorkflowId(execution.workflowId()));
                if (executing != null) {
                    slot.execution = execution;
                }
            }
            if (executing == null) {
                execution.cancel(new DynamicRequestException("Request " + requestId + " ended before its helper started"));
                return;
            }
            afterTransition(slot, executing);
            execution.completion().whenComplete((result, error) -> onHelperFinished(slot, result, error));
        } catch (NoCapableAgentException e) {
            fail(slot, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[RequestLifecycleManager] Processing of request {} failed: {}", requestId, e.getMessage(), e);
            fail(slot, e.getMessage());
        }
    }

    private List<String> resolveExpertise(AgentRequest request) {
        if (!request.getSpecificExpertiseNeeded().isEmpty()) {
            return request.getSpecificExpertiseNeeded();
        }
        return properties.capabilitiesFor(request.getRequestType());
    }

    private void onHelperFinished(RequestSlot slot, HelperResult result, Throwable error) {
        AgentRequest request = slot.request;
        try {
            if (request.isComplete()) {
                log.debug("[RequestLifecycleManager] Ignoring late helper outcome for {}", request.getRequestId());
                return;
            }
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                fail(slot, "Helper failed: " + cause.getMessage());
                return;
            }

            ContextIntegration integration = integrationUseCase.prepare(new IntegrateCommand(
                    request.getRequestingAgent(),
                    request.getWorkflowId(),
                    request.getRequestId(),
                    request.getContextRequirements(),
                    result.findings(),
                    properties.getDefaultIntegrationStrategy(),
                    new SourceConfidence(properties.getConfidenceThreshold(), result.overallConfidence())));

            RequestTransition completed;
            synchronized (slot) {
                completed = applyTransition(slot, RequestStatus.COMPLETED, b -> b
                        .responseData(result)
                        .confidenceScore(result.overallConfidence())
                        .integrationId(integration.integrationId()));
                if (completed != null) {
                    integrationUseCase.record(integration);
                }
            }
            if (completed == null) {
                log.info("[RequestLifecycleManager] Request {} ended while its findings were integrated, dropping integration {}",
                        request.getRequestId(), integration.integrationId());
                return;
            }
            afterTransition(slot, completed);
        } catch (RuntimeException e) {
            log.error("[RequestLifecycleManager] Could not complete request {}: {}",
                    request.getRequestId(), e.getMessage(), e);
            fail(slot, e.getMessage());
        }
    }

    private void expire(RequestSlot slot) {
        AgentRequest request = slot.request;
        RequestTimeoutException cause = new RequestTimeoutException(request.getRequestId(), request.getTimeoutAt());
        HelperExecution execution;
        RequestTransition failed;
        synchronized (slot) {
            execution = slot.execution;
            failed = applyTransition(slot, RequestStatus.FAILED, b -> b.errorMessage(cause.getMessage()));
        }
        if (failed == null) {
            return;
        }
        log.warn("[RequestLifecycleManager] {}", cause.getMessage());
        if (execution != null) {
            try {
                execution.cancel(cause);
            } catch (RuntimeException e) {
                log.warn("[RequestLifecycleManager] Cancel of helper {} failed: {}",
                        execution.workflowId(), e.getMessage());
            }
        }
        afterTransition(slot, failed);
    }

    private void fail(RequestSlot slot, String message) {
        advance(slot, RequestStatus.FAILED, b -> b.errorMessage(message));
    }

    // ---------------------------------------------------------------- transitions

    private boolean advance(RequestSlot slot, RequestStatus next,
                            UnaryOperator<AgentRequest.AgentRequestBuilder> changes) {
        RequestTransition transition;
        synchronized (slot) {
            transition = applyTransition(slot, next, changes);
        }
        if (transition == null) {
            return false;
        }
        afterTransition(slot, transition);
        return true;
    }

    /**
     * Caller holds the slot monitor. The transition is published before the monitor is
     * released, so events of one request reach the bus in order. Returns null when the
     * edge does not exist.
     */
    private RequestTransition applyTransition(RequestSlot slot, RequestStatus next,
                                              UnaryOperator<AgentRequest.AgentRequestBuilder> changes) {
        AgentRequest current = slot.request;
        if (!current.getStatus().canTransitionTo(next)) {
            log.debug("[RequestLifecycleManager] Skipping {} -> {} for {}",
                    current.getStatus(), next, current.getRequestId());
            return null;
        }
        Instant now = clock.instant();
        AgentRequest.AgentRequestBuilder builder = changes.apply(current.toBuilder().status(next));
        if (next.isTerminal()) {
            builder.completedAt(now);
        }
        slot.request = builder.build();
        RequestTransition transition = new RequestTransition(current.getRequestId(), current.getStatus(), next, now);
        slot.history.add(transition);
        messageBus.publish(MessageBus.REQUEST_TRANSITIONS, transition);
        return transition;
    }

    private void afterTransition(RequestSlot slot, RequestTransition transition) {
        if (transition.to() == RequestStatus.FAILED) {
            log.warn("[RequestLifecycleManager] Request {} failed: {}",
                    transition.requestId(), slot.request.getErrorMessage());
        } else {
            log.info("[RequestLifecycleManager] Request {}: {} -> {}",
                    transition.requestId(), transition.from(), transition.to());
        }
        if (transition.to().isTerminal()) {
            finish(slot);
        }
    }

    private void finish(RequestSlot slot) {
        AgentRequest request;
        List<RequestTransition> history;
        ScheduledFuture<?> timeoutTask;
        boolean admitted;
        synchronized (slot) {
            request = slot.request;
            history = List.copyOf(slot.history);
            timeoutTask = slot.timeoutTask;
            admitted = slot.admitted;
            slot.timeoutTask = null;
            slot.admitted = false;
            slot.execution = null;
        }
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
        }

        archive.archive(request, history);
        activeRequests.remove(request.getRequestId(), slot);
        AgentRequest.DedupKey key = request.dedupKey();
        if (key != null) {
            liveByGap.remove(key, request.getRequestId());
        }
        if (admitted) {
            inFlight.decrementAndGet();
            drain();
        }
    }

    // ---------------------------------------------------------------- queries

    @Override
    public RequestStatusView getStatus(String requestId) {
        AgentRequest request = findRequest(requestId);
        Instant estimated = request.isComplete() ? null : estimateCompletion(request);
        return new RequestStatusView(
                request.getRequestId(),
                request.getStatus(),
                request.getAssignedAgent(),
                request.getStatus().progressPercentage(),
                estimated,
                request.getResponseData() != null);
    }

    @Override
    public Optional<RequestResultsView> getResults(String requestId) {
        AgentRequest request = findRequest(requestId);
        if (!request.isComplete()) {
            return Optional.empty();
        }
        Duration duration = request.duration();
        return Optional.of(new RequestResultsView(
                request.getRequestId(),
                request.getStatus(),
                request.getResponseData(),
                request.getConfidenceScore(),
                duration == null ? null : duration.toMillis() / 1000.0,
                request.getAssignedAgent(),
                request.getIntegrationId(),
                request.getErrorMessage()));
    }

    @Override
    public List<RequestTransition> getHistory(String requestId) {
        RequestSlot slot = activeRequests.get(requestId);
        if (slot != null) {
            synchronized (slot) {
                return List.copyOf(slot.history);
            }
        }
        if (archive.find(requestId).isEmpty()) {
            throw new RequestNotFoundException(requestId);
        }
        return archive.history(requestId);
    }

    @Override
    public int queuedRequests() {
        return pending.size();
    }

    int inFlightRequests() {
        return inFlight.get();
    }

    /**
     * Current snapshot of a live or archived request. Live requests past their deadline are
     * failed before they are returned.
     */
    AgentRequest findRequest(String requestId) {
        RequestSlot slot = activeRequests.get(requestId);
        if (slot == null) {
            return archive.find(requestId).orElseThrow(() -> new RequestNotFoundException(requestId));
        }
        if (slot.request.isTimedOut(clock.instant())) {
            expire(slot);
        }
        return slot.request;
    }

    private Instant estimateCompletion(AgentRequest request) {
        double minutes = request.getRequestType().baseMinutes() * request.getUrgency().durationMultiplier();
        return request.getCreatedAt().plusSeconds(Math.round(minutes * 60));
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }

    /**
     * Mutable holder for a live request. Fields other than {@code request} are only touched
     * under the slot's monitor.
     */
    private static final class RequestSlot {
        private volatile AgentRequest request;
        private final List<RequestTransition> history = new ArrayList<>();
        private HelperExecution execution;
        private ScheduledFuture<?> timeoutTask;
        private boolean admitted;

        RequestSlot(AgentRequest request) {
            this.request = request;
        }
    }
}
