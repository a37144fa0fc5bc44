package com.vidnyan.dre.domain.request;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured output of a helper sub-workflow.
 */
public record HelperResult(
    String analysis,
    Map<String, Object> findings,
    List<String> recommendations,
    Map<String, Double> confidenceMetrics
) {

    public static final double DEFAULT_CONFIDENCE = 0.8;

    public HelperResult {
        findings = findings == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(findings));
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        confidenceMetrics = confidenceMetrics == null ? Map.of() : Map.copyOf(confidenceMetrics);
    }

    public double overallConfidence() {
        double overall = confidenceMetrics.getOrDefault("overall", DEFAULT_CONFIDENCE);
        return Math.max(0.0, Math.min(1.0, overall));
    }
}
