package com.vidnyan.dre.application.port.in;

import com.vidnyan.dre.domain.integration.ContextIntegration;
import com.vidnyan.dre.domain.integration.IntegrationStrategy;
import com.vidnyan.dre.domain.integration.SourceConfidence;

import java.util.Map;

/**
 * Merge a helper's findings back into the requesting agent's context.
 */
public interface ContextIntegrationUseCase {

    /**
     * Run an integration and keep it for later lookups.
     * Returns a failed or incomplete record instead of throwing.
     */
    ContextIntegration integrate(IntegrateCommand command);

    /**
     * Run an integration without keeping or announcing it. Pair with {@link #record}.
     */
    ContextIntegration prepare(IntegrateCommand command);

    /**
     * Keep a prepared integration and publish its completion.
     */
    void record(ContextIntegration integration);

    /**
     * @throws com.vidnyan.dre.domain.error.IntegrationNotFoundException for unknown ids
     */
    ContextIntegration getIntegration(String integrationId);

    record IntegrateCommand(
        String requestingAgent,
        String workflowId,
        String requestId,
        Map<String, Object> originalContext,
        Map<String, Object> newFindings,
        IntegrationStrategy strategy,       // null = recommended by the compatibility analysis
        SourceConfidence sourceConfidence   // null = neutral
    ) {}
}
