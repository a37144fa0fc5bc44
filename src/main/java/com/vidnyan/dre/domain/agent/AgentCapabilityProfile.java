package com.vidnyan.dre.domain.agent;

import java.util.Set;

/**
 * Snapshot of a helper agent's capabilities and standing.
 * Owned by the registry, read-only to the selector.
 */
public record AgentCapabilityProfile(
    String agentName,
    Set<String> capabilities,
    int currentLoad,
    double historicalSuccessRate
) {

    public AgentCapabilityProfile {
        if (agentName == null || agentName.isBlank()) {
            throw new IllegalArgumentException("agentName is required");
        }
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
        currentLoad = Math.max(0, currentLoad);
        historicalSuccessRate = Math.max(0.0, Math.min(1.0, historicalSuccessRate));
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }
}
