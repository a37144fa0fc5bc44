package com.vidnyan.dre.application.port.out;

import com.vidnyan.dre.domain.agent.AgentCapabilityProfile;

import java.util.List;
import java.util.Optional;

/**
 * Port for the capability registry of helper agents.
 * Reads are snapshots; updates come from outside the engine.
 */
public interface AgentRegistry {

    /**
     * Current profiles. The returned list never changes after it is handed out.
     */
    List<AgentCapabilityProfile> snapshot();

    Optional<AgentCapabilityProfile> find(String agentName);

    void upsert(AgentCapabilityProfile profile);
}
