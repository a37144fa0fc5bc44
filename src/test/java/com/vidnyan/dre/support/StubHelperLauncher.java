package com.vidnyan.dre.support;

import com.vidnyan.dre.application.port.out.HelperWorkflowLauncher;
import com.vidnyan.dre.domain.request.AgentRequest;
import com.vidnyan.dre.domain.request.ContextPackage;
import com.vidnyan.dre.domain.request.HelperResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Launcher whose helpers finish only when a test completes them.
 */
public class StubHelperLauncher implements HelperWorkflowLauncher {

    private final List<Launch> launches = new CopyOnWriteArrayList<>();

    @Override
    public HelperExecution launch(AgentRequest request, ContextPackage contextPackage) {
        Launch launch = new Launch("helper-" + (launches.size() + 1), request, contextPackage, new CompletableFuture<>());
        launches.add(launch);
        return launch;
    }

    public List<Launch> launches() {
        return List.copyOf(launches);
    }

    public Launch launchFor(String requestId) {
        return launches.stream()
                .filter(l -> l.request().getRequestId().equals(requestId))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no helper launched for " + requestId));
    }

    public static HelperResult result(Map<String, Object> findings, double confidence) {
        return new HelperResult("done", findings, List.of("ship it"), Map.of("overall", confidence));
    }

    public static final class Launch implements HelperExecution {
        private final String workflowId;
        private final AgentRequest request;
        private final ContextPackage contextPackage;
        private final CompletableFuture<HelperResult> completion;
        private volatile Throwable cancelReason;

        Launch(String workflowId, AgentRequest request, ContextPackage contextPackage,
               CompletableFuture<HelperResult> completion) {
            this.workflowId = workflowId;
            this.request = request;
            this.contextPackage = contextPackage;
            this.completion = completion;
        }

        @Override
        public String workflowId() {
            return workflowId;
        }

        @Override
        public CompletableFuture<HelperResult> completion() {
            return completion;
        }

        @Override
        public void cancel(Throwable reason) {
            cancelReason = reason;
        }

        public AgentRequest request() {
            return request;
        }

        public ContextPackage contextPackage() {
            return contextPackage;
        }

        public Throwable cancelReason() {
            return cancelReason;
        }

        public void succeed(HelperResult result) {
            completion.complete(result);
        }

        public void fail(Throwable error) {
            completion.completeExceptionally(error);
        }
    }
}
