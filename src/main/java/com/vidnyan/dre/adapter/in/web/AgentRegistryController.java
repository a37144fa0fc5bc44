package com.vidnyan.dre.adapter.in.web;

import com.vidnyan.dre.application.port.out.AgentRegistry;
import com.vidnyan.dre.domain.agent.AgentCapabilityProfile;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Set;

/**
 * Read and update helper agent profiles.
 */
@Slf4j
@RestController
@RequestMapping("/agents")
@RequiredArgsConstructor
public class AgentRegistryController {

    private final AgentRegistry agentRegistry;

    @GetMapping
    public List<AgentCapabilityProfile> list() {
        return agentRegistry.snapshot();
    }

    @PutMapping("/{agentName}")
    public AgentCapabilityProfile upsert(@PathVariable String agentName, @RequestBody AgentProfileBody body) {
        AgentCapabilityProfile profile = new AgentCapabilityProfile(
                agentName,
                body.getCapabilities() != null ? body.getCapabilities() : Set.of(),
                body.getCurrentLoad() != null ? body.getCurrentLoad() : 0,
                body.getHistoricalSuccessRate() != null ? body.getHistoricalSuccessRate() : 0.0);
        agentRegistry.upsert(profile);
        log.info("Updated agent {}: {} (load {})", agentName, profile.capabilities(), profile.currentLoad());
        return profile;
    }

    @Data
    public static class AgentProfileBody {
        private Set<String> capabilities;
        private Integer currentLoad;
        private Double historicalSuccessRate;
    }
}
