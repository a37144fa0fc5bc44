package com.vidnyan.dre.adapter.out.helper;

import com.vidnyan.dre.application.port.out.HelperWorkflowLauncher.HelperExecution;
import com.vidnyan.dre.config.DynamicRequestProperties;
import com.vidnyan.dre.domain.request.AgentRequest;
import com.vidnyan.dre.domain.request.ContextPackage;
import com.vidnyan.dre.domain.request.HelperResult;
import com.vidnyan.dre.domain.request.RequestStatus;
import com.vidnyan.dre.domain.request.RequestType;
import com.vidnyan.dre.domain.request.RequestUrgency;
import com.vidnyan.dre.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SimulatedHelperWorkflowLauncherTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private TaskScheduler scheduler;
    private SimulatedHelperWorkflowLauncher launcher;

    @BeforeEach
    void setUp() {
        DynamicRequestProperties properties = new DynamicRequestProperties();
        properties.init();
        scheduler = mock(TaskScheduler.class);
        launcher = new SimulatedHelperWorkflowLauncher(properties, scheduler, new MutableClock(NOW));
    }

    @Test
    void launch_ShouldScheduleAnswerAfterConfiguredDelay() {
        doReturn(mock(ScheduledFuture.class)).when(scheduler).schedule(any(Runnable.class), any(Instant.class));

        HelperExecution execution = launcher.launch(request(RequestType.SECURITY_AUDIT, Map.of()), contextPackage());

        verify(scheduler).schedule(any(Runnable.class), eq(NOW.plusSeconds(2)));
        assertTrue(execution.workflowId().startsWith("helper-"));
        assertFalse(execution.completion().isDone());
    }

    @Test
    void respond_ShouldAnswerSecurityAudits() {
        HelperResult result = launcher.respond(request(RequestType.SECURITY_AUDIT, Map.of()));

        assertEquals(85, result.findings().get("security_score"));
        assertEquals(0.85, result.overallConfidence());
        assertFalse(result.recommendations().isEmpty());
    }

    @Test
    void respond_ShouldFillMissingContextField() {
        HelperResult result = launcher.respond(request(RequestType.SUPPLEMENTAL_CONTEXT,
                Map.of("missing_field", "dependencies")));

        assertTrue(result.findings().containsKey("dependencies"));
    }

    @Test
    void cancel_ShouldCompleteExceptionally() {
        ScheduledFuture<?> answer = mock(ScheduledFuture.class);
        doReturn(answer).when(scheduler).schedule(any(Runnable.class), any(Instant.class));
        HelperExecution execution = launcher.launch(request(RequestType.RESEARCH, Map.of()), contextPackage());

        execution.cancel(new IllegalStateException("timed out"));

        CompletionException ex = assertThrows(CompletionException.class, () -> execution.completion().join());
        assertEquals("timed out", ex.getCause().getMessage());
        verify(answer).cancel(false);
    }

    private AgentRequest request(RequestType type, Map<String, Object> gapContext) {
        return AgentRequest.builder()
                .requestId("req-1")
                .requestingAgent("backend-agent")
                .workflowId("wf-1")
                .requestType(type)
                .urgency(RequestUrgency.HIGH)
                .description("help")
                .status(RequestStatus.CONTEXT_GENERATED)
                .spawnDepth(1)
                .gapContext(gapContext)
                .assignedAgent("helper")
                .createdAt(NOW)
                .timeoutAt(NOW.plusSeconds(1800))
                .build();
    }

    private ContextPackage contextPackage() {
        return new ContextPackage("pkg-1", Map.of(), 4000, 100, "req-1", NOW);
    }
}
