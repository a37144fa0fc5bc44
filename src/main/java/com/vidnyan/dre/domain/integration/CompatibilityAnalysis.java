package com.vidnyan.dre.domain.integration;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Partition of new-finding keys relative to the original context.
 * The three key sets are disjoint and keep the order of the new findings.
 */
public record CompatibilityAnalysis(
    Set<String> conflicts,      // same key, different value
    Set<String> supplements,    // key absent from the original
    Set<String> overlaps,       // same key, same value
    Set<String> incompleteOriginals,
    Set<String> corrections     // conflicts whose new value says it corrects the old one
) {

    public CompatibilityAnalysis {
        conflicts = ordered(conflicts);
        supplements = ordered(supplements);
        overlaps = ordered(overlaps);
        incompleteOriginals = ordered(incompleteOriginals);
        corrections = ordered(corrections);
    }

    /**
     * 1.0 for fully compatible inputs, lowered by conflicts and raised by supplements
     * and by new values for incomplete originals.
     */
    public double compatibilityScore() {
        double score = 1.0;
        score -= Math.min(conflicts.size() * 0.2, 0.8);
        score += Math.min(supplements.size() * 0.1 + incompleteOriginals.size() * 0.15, 0.5);
        return Math.max(0.0, Math.min(1.0, score));
    }

    /**
     * Strategy that suits this mix of conflicts, corrections and supplements.
     */
    public IntegrationStrategy recommendedStrategy() {
        double score = compatibilityScore();
        if (conflicts.size() > 3 || score < 0.3) {
            return IntegrationStrategy.SELECTIVE;
        }
        if (corrections.size() > 2) {
            return IntegrationStrategy.PRIORITIZE_NEW;
        }
        if (supplements.size() > 2) {
            return IntegrationStrategy.MERGE;
        }
        if (score < 0.7) {
            return IntegrationStrategy.APPEND;
        }
        return IntegrationStrategy.MERGE;
    }

    private static Set<String> ordered(Set<String> keys) {
        return keys == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(keys));
    }
}
