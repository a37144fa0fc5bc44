package com.vidnyan.dre.application.port.out;

import com.vidnyan.dre.domain.request.AgentRequest;
import com.vidnyan.dre.domain.request.ContextPackage;
import com.vidnyan.dre.domain.request.HelperResult;

import java.util.concurrent.CompletableFuture;

/**
 * Port for spawning the sub-workflow in which a helper agent works on a request.
 */
public interface HelperWorkflowLauncher {

    /**
     * Start the helper. Must not block until the helper is done.
     */
    HelperExecution launch(AgentRequest request, ContextPackage contextPackage);

    /**
     * Handle on a running helper sub-workflow.
     */
    interface HelperExecution {

        String workflowId();

        /**
         * Completes with the helper's result, or exceptionally when the helper fails.
         */
        CompletableFuture<HelperResult> completion();

        /**
         * Best-effort stop signal. Callers do not wait for acknowledgment.
         */
        void cancel(Throwable reason);
    }
}
