package com.vidnyan.dre.domain.integration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Terminal artifact of merging a helper's findings into a requester's context.
 * Immutable value object.
 */
public record IntegrationResult(
    String integrationId,
    String requestId,
    IntegrationStrategy strategyUsed,
    IntegrationStrategy recommendedStrategy,
    Map<String, Object> originalContext,
    Map<String, Object> newFindings,
    Map<String, Object> integratedContext,
    IntegrationChanges changes,
    Set<String> unresolvedConflicts,
    double confidenceImprovement,
    boolean complete
) {

    public IntegrationResult {
        originalContext = unmodifiableCopy(originalContext);
        newFindings = unmodifiableCopy(newFindings);
        integratedContext = unmodifiableCopy(integratedContext);
        unresolvedConflicts = Collections.unmodifiableSet(new LinkedHashSet<>(unresolvedConflicts));
    }

    private static Map<String, Object> unmodifiableCopy(Map<String, Object> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
