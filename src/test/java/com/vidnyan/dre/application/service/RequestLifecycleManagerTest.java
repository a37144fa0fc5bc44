package com.vidnyan.dre.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.dre.adapter.out.registry.FileSystemAgentRegistry;
import com.vidnyan.dre.adapter.out.store.InMemoryContextPackageStore;
import com.vidnyan.dre.adapter.out.store.InMemoryRequestArchive;
import com.vidnyan.dre.application.port.in.DynamicRequestUseCase.CreateRequestCommand;
import com.vidnyan.dre.application.port.in.DynamicRequestUseCase.DetectGapsCommand;
import com.vidnyan.dre.application.port.in.DynamicRequestUseCase.GapDetectionOutcome;
import com.vidnyan.dre.application.port.in.DynamicRequestUseCase.RequestResultsView;
import com.vidnyan.dre.application.port.in.DynamicRequestUseCase.RequestStatusView;
import com.vidnyan.dre.application.port.out.MessageBus;
import com.vidnyan.dre.config.DreConfiguration;
import com.vidnyan.dre.config.DynamicRequestProperties;
import com.vidnyan.dre.config.GapDetectionProperties;
import com.vidnyan.dre.domain.agent.AgentCapabilityProfile;
import com.vidnyan.dre.domain.error.RequestNotFoundException;
import com.vidnyan.dre.domain.error.RequestTimeoutException;
import com.vidnyan.dre.domain.error.SpawnDepthExceededException;
import com.vidnyan.dre.domain.integration.IntegrationCompletedEvent;
import com.vidnyan.dre.domain.integration.IntegrationResult;
import com.vidnyan.dre.domain.integration.IntegrationStrategy;
import com.vidnyan.dre.domain.integration.SourceConfidence;
import com.vidnyan.dre.domain.request.AgentRequest;
import com.vidnyan.dre.domain.request.RequestStatus;
import com.vidnyan.dre.domain.request.RequestTransition;
import com.vidnyan.dre.domain.request.RequestType;
import com.vidnyan.dre.domain.request.RequestUrgency;
import com.vidnyan.dre.support.MutableClock;
import com.vidnyan.dre.support.RecordingMessageBus;
import com.vidnyan.dre.support.StubHelperLauncher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class RequestLifecycleManagerTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private DynamicRequestProperties properties;
    private MutableClock clock;
    private RecordingMessageBus bus;
    private StubHelperLauncher launcher;
    private FileSystemAgentRegistry registry;
    private InMemoryRequestArchive archive;
    private TaskScheduler scheduler;
    private GapDetectionProperties gapProperties;
    private ObjectMapper objectMapper;
    private RequestLifecycleManager manager;

    @BeforeEach
    void setUp() {
        properties = new DynamicRequestProperties();
        properties.init();
        gapProperties = new GapDetectionProperties();
        gapProperties.init();

        objectMapper = new DreConfiguration().objectMapper();
        clock = new MutableClock(START);
        bus = new RecordingMessageBus();
        launcher = new StubHelperLauncher();
        archive = new InMemoryRequestArchive();
        scheduler = mock(TaskScheduler.class);

        registry = new FileSystemAgentRegistry(objectMapper);
        registry.upsert(new AgentCapabilityProfile("security-auditor",
                Set.of("security-audit", "vulnerability-assessment"), 0, 0.9));
        registry.upsert(new AgentCapabilityProfile("researcher",
                Set.of("codebase-research", "architecture-analysis", "dependency-analysis"), 1, 0.8));

        manager = newManager(new ContextIntegrator());
    }

    private RequestLifecycleManager newManager(ContextIntegrator integrator) {
        return new RequestLifecycleManager(
                properties,
                new GapDetector(gapProperties, (gap, context) -> gap.severity()),
                new AgentSelector(properties),
                new ContextPackageBuilder(properties, new InMemoryContextPackageStore(), objectMapper, clock),
                registry,
                launcher,
                new ContextIntegrationService(integrator, bus, clock),
                archive,
                bus,
                Runnable::run,
                scheduler,
                clock);
    }

    @Test
    void createRequest_ShouldRunExplicitRequestUpToExecution() {
        // Act
        AgentRequest request = manager.createRequest(command("wf-1", null));

        // Assert
        assertEquals(RequestStatus.PENDING, request.getStatus());
        RequestStatusView status = manager.getStatus(request.getRequestId());
        assertEquals(RequestStatus.EXECUTING, status.status());
        assertEquals("security-auditor", status.assignedAgent());
        assertEquals(80.0, status.progressPercentage());
        assertFalse(status.responseAvailable());
        assertEquals(List.of(RequestStatus.PENDING, RequestStatus.AGENT_SELECTED,
                        RequestStatus.CONTEXT_GENERATED, RequestStatus.EXECUTING),
                manager.getHistory(request.getRequestId()).stream().map(RequestTransition::to).toList());
        assertEquals(1, launcher.launches().size());
        assertEquals(1, request.getSpawnDepth());
    }

    @Test
    void getStatus_ShouldEstimateCompletionFromTypeAndUrgency() {
        AgentRequest request = manager.createRequest(command("wf-1", null));

        // security audit 30 minutes at high urgency (x0.7)
        assertEquals(START.plus(Duration.ofMinutes(21)), manager.getStatus(request.getRequestId()).estimatedCompletion());
    }

    @Test
    void helperCompletion_ShouldIntegrateFindingsAndComplete() {
        AgentRequest request = manager.createRequest(command("wf-1", null));
        clock.advance(Duration.ofSeconds(90));

        launcher.launchFor(request.getRequestId())
                .succeed(StubHelperLauncher.result(Map.of("security_score", 85), 0.9));

        RequestResultsView results = manager.getResults(request.getRequestId()).orElseThrow();
        assertEquals(RequestStatus.COMPLETED, results.status());
        assertEquals(0.9, results.confidenceScore());
        assertEquals(90.0, results.processingDuration());
        assertEquals(85, results.responseData().findings().get("security_score"));
        assertNotNull(results.integrationId());
        assertTrue(archive.find(request.getRequestId()).isPresent());

        IntegrationCompletedEvent integration =
                bus.events(MessageBus.INTEGRATION_COMPLETED, IntegrationCompletedEvent.class).get(0);
        assertEquals(results.integrationId(), integration.integrationId());
        assertEquals(request.getRequestId(), integration.requestId());

        RequestStatusView status = manager.getStatus(request.getRequestId());
        assertEquals(100.0, status.progressPercentage());
        assertNull(status.estimatedCompletion());
        assertTrue(status.responseAvailable());
    }

    @Test
    void helperFailure_ShouldFailRequest() {
        AgentRequest request = manager.createRequest(command("wf-1", null));

        launcher.launchFor(request.getRequestId()).fail(new IllegalStateException("model unavailable"));

        RequestResultsView results = manager.getResults(request.getRequestId()).orElseThrow();
        assertEquals(RequestStatus.FAILED, results.status());
        assertTrue(results.errorMessage().contains("model unavailable"));
    }

    @Test
    void getResults_ShouldBeEmptyWhileRunning() {
        AgentRequest request = manager.createRequest(command("wf-1", null));

        assertTrue(manager.getResults(request.getRequestId()).isEmpty());
    }

    @Test
    void createRequest_ShouldReturnLiveRequestForSameGap() {
        // Arrange
        AgentRequest first = manager.createRequest(command("wf-1", "gap-42"));

        // Act
        AgentRequest duplicate = manager.createRequest(command("wf-1", "gap-42"));
        AgentRequest otherWorkflow = manager.createRequest(command("wf-2", "gap-42"));

        // Assert
        assertEquals(first.getRequestId(), duplicate.getRequestId());
        assertNotEquals(first.getRequestId(), otherWorkflow.getRequestId());
        assertEquals(2, launcher.launches().size());
    }

    @Test
    void createRequest_ShouldOpenNewRequestOnceGapRequestFinished() {
        AgentRequest first = manager.createRequest(command("wf-1", "gap-42"));
        launcher.launchFor(first.getRequestId()).succeed(StubHelperLauncher.result(Map.of(), 0.8));

        AgentRequest second = manager.createRequest(command("wf-1", "gap-42"));

        assertNotEquals(first.getRequestId(), second.getRequestId());
    }

    @Test
    void getStatus_ShouldFailRequestPastItsDeadline() {
        // Arrange
        AgentRequest request = manager.createRequest(new CreateRequestCommand("backend-agent", "wf-1",
                RequestType.SECURITY_AUDIT, RequestUrgency.HIGH, "Need security review",
                List.of("security-audit"), Map.of(), 0, null, null, null));

        // Act
        RequestStatusView status = manager.getStatus(request.getRequestId());

        // Assert
        assertEquals(RequestStatus.FAILED, status.status());
        RequestResultsView results = manager.getResults(request.getRequestId()).orElseThrow();
        assertTrue(results.errorMessage().contains("timed out"));
        assertInstanceOf(RequestTimeoutException.class, launcher.launchFor(request.getRequestId()).cancelReason());
    }

    @Test
    void scheduledTimeout_ShouldFailRequestAndIgnoreLateResult() {
        AgentRequest request = manager.createRequest(command("wf-1", null));
        ArgumentCaptor<Runnable> timeout = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(timeout.capture(), any(Instant.class));

        clock.advance(Duration.ofMinutes(30));
        timeout.getValue().run();
        launcher.launchFor(request.getRequestId()).succeed(StubHelperLauncher.result(Map.of("late", true), 0.9));

        RequestResultsView results = manager.getResults(request.getRequestId()).orElseThrow();
        assertEquals(RequestStatus.FAILED, results.status());
        assertNull(results.responseData());
    }

    @Test
    void timeoutDuringIntegration_ShouldFailRequestWithoutRecordingIntegration() {
        // Arrange
        AtomicReference<Runnable> timeout = new AtomicReference<>();
        ContextIntegrator slowIntegrator = new ContextIntegrator() {
            @Override
            public IntegrationResult integrate(String requestId, Map<String, Object> originalContext,
                                               Map<String, Object> newFindings, IntegrationStrategy strategy,
                                               SourceConfidence confidence) {
                clock.advance(Duration.ofMinutes(31));
                timeout.get().run();
                return super.integrate(requestId, originalContext, newFindings, strategy, confidence);
            }
        };
        RequestLifecycleManager slowManager = newManager(slowIntegrator);
        AgentRequest request = slowManager.createRequest(command("wf-1", null));
        ArgumentCaptor<Runnable> scheduled = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(scheduled.capture(), any(Instant.class));
        timeout.set(scheduled.getValue());

        // Act
        launcher.launchFor(request.getRequestId()).succeed(StubHelperLauncher.result(Map.of("security_score", 85), 0.9));

        // Assert
        RequestResultsView results = slowManager.getResults(request.getRequestId()).orElseThrow();
        assertEquals(RequestStatus.FAILED, results.status());
        assertNull(results.integrationId());
        assertNull(results.responseData());
        assertTrue(bus.events(MessageBus.INTEGRATION_COMPLETED, IntegrationCompletedEvent.class).isEmpty());
        assertEquals(1, slowManager.getHistory(request.getRequestId()).stream()
                .filter(t -> t.to().isTerminal()).count());
    }

    @Test
    void transitions_ShouldReachTheBusInOrder() {
        AgentRequest request = manager.createRequest(command("wf-1", null));
        launcher.launchFor(request.getRequestId()).succeed(StubHelperLauncher.result(Map.of("security_score", 85), 0.9));

        List<RequestTransition> published = bus.events(MessageBus.REQUEST_TRANSITIONS, RequestTransition.class);
        assertEquals(manager.getHistory(request.getRequestId()), published);
        for (int i = 1; i < published.size(); i++) {
            assertEquals(published.get(i - 1).to(), published.get(i).from());
        }
    }

    @Test
    void createRequest_ShouldRejectTooDeepSpawnsWithoutSideEffects() {
        CreateRequestCommand tooDeep = new CreateRequestCommand("backend-agent", "wf-1",
                RequestType.RESEARCH, RequestUrgency.LOW, "Dig deeper", List.of(), Map.of(), null, null, null, 4);

        SpawnDepthExceededException ex = assertThrows(SpawnDepthExceededException.class,
                () -> manager.createRequest(tooDeep));

        assertEquals(4, ex.getSpawnDepth());
        assertEquals(3, ex.getMaxSpawnDepth());
        assertTrue(bus.all().isEmpty());
        assertTrue(launcher.launches().isEmpty());
        assertEquals(0, manager.queuedRequests());
    }

    @Test
    void createRequest_ShouldNestChildrenBelowTheirParent() {
        AgentRequest parent = manager.createRequest(new CreateRequestCommand("backend-agent", "wf-1",
                RequestType.RESEARCH, RequestUrgency.LOW, "Look around", List.of(), Map.of(), null, null, null, 2));

        AgentRequest child = manager.createRequest(new CreateRequestCommand("researcher", "wf-1",
                RequestType.RESEARCH, RequestUrgency.LOW, "Look closer", List.of(), Map.of(), null, null,
                parent.getRequestId(), null));

        assertEquals(3, child.getSpawnDepth());
        assertThrows(SpawnDepthExceededException.class, () -> manager.createRequest(new CreateRequestCommand(
                "researcher", "wf-1", RequestType.RESEARCH, RequestUrgency.LOW, "Too far", List.of(), Map.of(),
                null, null, child.getRequestId(), null)));
    }

    @Test
    void createRequest_ShouldQueueBeyondConcurrencyLimit() {
        // Arrange
        properties.setMaxConcurrentRequests(2);

        // Act
        AgentRequest first = manager.createRequest(command("wf-1", null));
        AgentRequest second = manager.createRequest(command("wf-2", null));
        AgentRequest third = manager.createRequest(command("wf-3", null));

        // Assert
        assertEquals(RequestStatus.PENDING, manager.getStatus(third.getRequestId()).status());
        assertEquals(1, manager.queuedRequests());
        assertEquals(2, manager.inFlightRequests());

        launcher.launchFor(first.getRequestId()).succeed(StubHelperLauncher.result(Map.of(), 0.8));

        assertEquals(RequestStatus.EXECUTING, manager.getStatus(third.getRequestId()).status());
        assertEquals(RequestStatus.EXECUTING, manager.getStatus(second.getRequestId()).status());
        assertEquals(0, manager.queuedRequests());
        assertEquals(2, manager.inFlightRequests());
    }

    @Test
    void createRequest_ShouldFailWhenNoAgentIsCapable() {
        AgentRequest request = manager.createRequest(new CreateRequestCommand("backend-agent", "wf-1",
                RequestType.PERFORMANCE_ASSESSMENT, RequestUrgency.MEDIUM, "Is this fast enough?",
                List.of(), Map.of(), null, null, null, null));

        RequestResultsView results = manager.getResults(request.getRequestId()).orElseThrow();
        assertEquals(RequestStatus.FAILED, results.status());
        assertTrue(results.errorMessage().contains("performance-profiling"));
        assertEquals(0, manager.inFlightRequests());
    }

    @Test
    void createRequest_ShouldRejectMissingFields() {
        assertThrows(IllegalArgumentException.class, () -> manager.createRequest(new CreateRequestCommand(
                "", "wf-1", RequestType.RESEARCH, null, null, null, null, null, null, null, null)));
        assertThrows(IllegalArgumentException.class, () -> manager.createRequest(new CreateRequestCommand(
                "agent", "wf-1", null, null, null, null, null, null, null, null, null)));
    }

    @Test
    void detectGaps_ShouldOpenRequestsForHighSeverityGaps() {
        // Act
        GapDetectionOutcome outcome = manager.detectGaps(new DetectGapsCommand("backend-agent",
                Map.of("workflow_id", "wf-7"),
                List.of("Need security validation", "Performance unclear"),
                Map.of("auth_method", "JWT")));

        // Assert
        assertEquals(1, outcome.autoRequestIds().size());
        assertEquals(1, outcome.highPriorityGaps());
        String requestId = outcome.autoRequestIds().get(0);
        AgentRequest request = launcher.launchFor(requestId).request();
        assertTrue(request.isAutoGenerated());
        assertEquals("wf-7", request.getWorkflowId());
        assertEquals(RequestType.SECURITY_AUDIT, request.getRequestType());
        assertEquals(RequestUrgency.HIGH, request.getUrgency());
        assertEquals(Map.of("auth_method", "JWT"), request.getContextRequirements());
        assertEquals(List.of(RequestStatus.PENDING, RequestStatus.ANALYZING, RequestStatus.AGENT_SELECTED,
                        RequestStatus.CONTEXT_GENERATED, RequestStatus.EXECUTING),
                manager.getHistory(requestId).stream().map(RequestTransition::to).toList());
    }

    @Test
    void detectGaps_ShouldReuseRequestsOnRepeatedScans() {
        DetectGapsCommand scan = new DetectGapsCommand("backend-agent", Map.of(),
                List.of("Potential security risk in login"), Map.of());

        GapDetectionOutcome first = manager.detectGaps(scan);
        GapDetectionOutcome second = manager.detectGaps(scan);

        assertEquals(first.autoRequestIds(), second.autoRequestIds());
        assertEquals("unknown", launcher.launchFor(first.autoRequestIds().get(0)).request().getWorkflowId());
    }

    @Test
    void detectGaps_ShouldNotSpawnBeyondMaxDepth() {
        GapDetectionOutcome outcome = manager.detectGaps(new DetectGapsCommand("helper-agent",
                Map.of("spawn_depth", 3), List.of("Potential security risk in login"), Map.of()));

        assertEquals(1, outcome.highPriorityGaps());
        assertTrue(outcome.autoRequestIds().isEmpty());
        assertTrue(launcher.launches().isEmpty());
    }

    @Test
    void transitions_ShouldOnlyFollowStateMachineEdges() {
        AgentRequest ok = manager.createRequest(command("wf-1", null));
        AgentRequest failed = manager.createRequest(command("wf-2", null));
        launcher.launchFor(ok.getRequestId()).succeed(StubHelperLauncher.result(Map.of("x", 1), 0.8));
        launcher.launchFor(failed.getRequestId()).fail(new IllegalStateException("boom"));

        List<RequestTransition> transitions = bus.events(MessageBus.REQUEST_TRANSITIONS, RequestTransition.class);
        assertFalse(transitions.isEmpty());
        for (RequestTransition transition : transitions) {
            if (transition.from() == null) {
                assertEquals(RequestStatus.PENDING, transition.to());
            } else {
                assertTrue(transition.from().canTransitionTo(transition.to()),
                        transition.from() + " -> " + transition.to());
            }
        }
        assertEquals(manager.getHistory(ok.getRequestId()), archive.history(ok.getRequestId()));
    }

    @Test
    void getStatus_ShouldRejectUnknownRequest() {
        assertThrows(RequestNotFoundException.class, () -> manager.getStatus("missing"));
        assertThrows(RequestNotFoundException.class, () -> manager.getHistory("missing"));
    }

    private CreateRequestCommand command(String workflowId, String gapId) {
        return new CreateRequestCommand("backend-agent", workflowId, RequestType.SECURITY_AUDIT, RequestUrgency.HIGH,
                "Need security review", List.of("security-audit"), Map.of("auth_method", "JWT"),
                null, gapId, null, null);
    }
}
