package com.vidnyan.dre.domain.gap;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * A detected deficiency in an agent's knowledge relative to its task.
 * Immutable value object.
 */
public record InformationGap(
    String gapId,
    GapType gapType,
    String description,
    Severity severity,
    String detectedBy,
    Set<String> suggestedExpertise,
    Map<String, Object> relatedContext
) {

    public InformationGap {
        suggestedExpertise = suggestedExpertise == null ? Set.of() : Set.copyOf(suggestedExpertise);
        relatedContext = relatedContext == null ? Map.of() : Map.copyOf(relatedContext);
    }

    /**
     * Stable id for the same gap detected by the same agent, so repeated scans
     * map onto the same request.
     */
    public static String stableId(String detectedBy, GapType gapType, String signatureKey) {
        String key = detectedBy + ":" + gapType.wireName() + ":" + signatureKey;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    public InformationGap withSeverity(Severity newSeverity) {
        return new InformationGap(gapId, gapType, description, newSeverity, detectedBy,
                suggestedExpertise, relatedContext);
    }

    @JsonProperty("priority_score")
    public int priorityScore() {
        int base = severity.score();
        return gapType == GapType.SECURITY_CONCERN ? base * 2 : base;
    }

    @JsonIgnore
    public boolean isHighPriority() {
        return severity.isAtLeast(Severity.HIGH);
    }
}
