package com.vidnyan.dre.adapter.out.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.dre.application.port.out.AgentRegistry;
import com.vidnyan.dre.domain.agent.AgentCapabilityProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Agent registry seeded from JSON profiles on the classpath, one agent per file.
 * Readers get the current immutable list; updates swap in a new one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemAgentRegistry implements AgentRegistry {

    private static final Comparator<AgentCapabilityProfile> BY_NAME =
            Comparator.comparing(AgentCapabilityProfile::agentName);

    private final ObjectMapper objectMapper;

    @Value("${dre.agents.path:classpath*:agents/*.json}")
    private String agentsPath;

    private final AtomicReference<List<AgentCapabilityProfile>> profiles = new AtomicReference<>(List.of());

    @PostConstruct
    public void loadProfiles() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources(agentsPath);

            for (Resource resource : resources) {
                try {
                    AgentDto dto = objectMapper.readValue(resource.getInputStream(), AgentDto.class);
                    AgentCapabilityProfile profile = mapToProfile(dto);
                    upsert(profile);
                    log.info("Loaded agent: {} {}", profile.agentName(), profile.capabilities());
                } catch (IOException | IllegalArgumentException e) {
                    log.warn("Failed to load agent from {}: {}", resource.getFilename(), e.getMessage());
                }
            }

            log.info("Loaded {} agents from {}", profiles.get().size(), agentsPath);
        } catch (IOException e) {
            log.error("Failed to load agent profiles", e);
        }
    }

    @Override
    public List<AgentCapabilityProfile> snapshot() {
        return profiles.get();
    }

    @Override
    public Optional<AgentCapabilityProfile> find(String agentName) {
        return profiles.get().stream()
                .filter(p -> p.agentName().equals(agentName))
                .findFirst();
    }

    @Override
    public void upsert(AgentCapabilityProfile profile) {
        profiles.updateAndGet(current -> {
            List<AgentCapabilityProfile> next = new ArrayList<>(current);
            next.removeIf(p -> p.agentName().equals(profile.agentName()));
            next.add(profile);
            next.sort(BY_NAME);
            return List.copyOf(next);
        });
    }

    private AgentCapabilityProfile mapToProfile(AgentDto dto) {
        return new AgentCapabilityProfile(
                dto.agentName,
                dto.capabilities != null ? Set.copyOf(dto.capabilities) : Set.of(),
                dto.currentLoad != null ? dto.currentLoad : 0,
                dto.historicalSuccessRate != null ? dto.historicalSuccessRate : 0.0);
    }

    // DTO for JSON deserialization
    static class AgentDto {
        public String agentName;
        public List<String> capabilities;
        public Integer currentLoad;
        public Double historicalSuccessRate;
    }
}
