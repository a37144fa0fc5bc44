package com.vidnyan.dre.application.service;

import com.vidnyan.dre.config.DynamicRequestProperties;
import com.vidnyan.dre.domain.agent.AgentCapabilityProfile;
import com.vidnyan.dre.domain.error.NoCapableAgentException;
import com.vidnyan.dre.domain.gap.InformationGap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Picks the helper agent best suited to a gap.
 *
 * score = capabilityWeight * capabilityMatch
 *       + availabilityWeight * (1 - normalizedLoad)
 *       + performanceWeight * historicalSuccessRate
 *
 * Agents offering none of the required capabilities are not considered.
 * Equal scores go to the less loaded agent, then to the lexicographically first name.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentSelector {

    private static final Comparator<ScoredCandidate> RANKING =
            Comparator.comparingDouble(ScoredCandidate::score).reversed()
                    .thenComparingInt(c -> c.profile().currentLoad())
                    .thenComparing(c -> c.profile().agentName());

    private final DynamicRequestProperties properties;

    public String selectAgent(InformationGap gap, List<AgentCapabilityProfile> registry) {
        return selectAgent(gap.suggestedExpertise(), registry);
    }

    /**
     * @throws NoCapableAgentException when no agent offers any required capability
     */
    public String selectAgent(Set<String> requiredCapabilities, List<AgentCapabilityProfile> registry) {
        List<ScoredCandidate> ranked = rankCandidates(requiredCapabilities, registry);
        if (ranked.isEmpty()) {
            log.warn("[AgentSelector] No capable agent among {} for {}", registry.size(), requiredCapabilities);
            throw new NoCapableAgentException(requiredCapabilities);
        }
        ScoredCandidate best = ranked.get(0);
        log.info("[AgentSelector] Selected {} (score {}) out of {} candidates for {}",
                best.profile().agentName(), String.format("%.3f", best.score()), ranked.size(), requiredCapabilities);
        return best.profile().agentName();
    }

    /**
     * All eligible candidates, best first.
     */
    public List<ScoredCandidate> rankCandidates(Set<String> requiredCapabilities,
                                                List<AgentCapabilityProfile> registry) {
        List<AgentCapabilityProfile> eligible = registry.stream()
                .filter(profile -> requiredCapabilities.isEmpty() || matchCount(profile, requiredCapabilities) > 0)
                .toList();
        int maxLoad = eligible.stream().mapToInt(AgentCapabilityProfile::currentLoad).max().orElse(0);

        return eligible.stream()
                .map(profile -> new ScoredCandidate(profile, score(profile, requiredCapabilities, maxLoad)))
                .sorted(RANKING)
                .toList();
    }

    private double score(AgentCapabilityProfile profile, Set<String> required, int maxLoad) {
        DynamicRequestProperties.Selection weights = properties.getSelection();
        double capabilityMatch = required.isEmpty()
                ? 1.0
                : (double) matchCount(profile, required) / required.size();
        double normalizedLoad = maxLoad == 0 ? 0.0 : (double) profile.currentLoad() / maxLoad;

        return weights.getCapabilityWeight() * capabilityMatch
                + weights.getAvailabilityWeight() * (1.0 - normalizedLoad)
                + weights.getPerformanceWeight() * profile.historicalSuccessRate();
    }

    private static long matchCount(AgentCapabilityProfile profile, Set<String> required) {
        return required.stream().filter(profile::hasCapability).count();
    }

    public record ScoredCandidate(AgentCapabilityProfile profile, double score) {
    }
}
