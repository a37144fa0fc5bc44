package com.vidnyan.dre.application.service;

import com.vidnyan.dre.domain.error.IntegrationConflictException;
import com.vidnyan.dre.domain.integration.CompatibilityAnalysis;
import com.vidnyan.dre.domain.integration.IntegrationChanges;
import com.vidnyan.dre.domain.integration.IntegrationResult;
import com.vidnyan.dre.domain.integration.IntegrationStrategy;
import com.vidnyan.dre.domain.integration.SourceConfidence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Merges new findings into an existing context.
 *
 * New keys are first split into conflicts, supplements and overlaps relative to the
 * original context, then the chosen strategy decides what ends up in the result.
 */
@Slf4j
@Component
public class ContextIntegrator {

    static final String APPEND_SECTION = "supplemental_findings";

    private static final List<String> INCOMPLETE_MARKERS = List.of("todo", "tbd", "unknown", "incomplete", "partial");
    private static final List<String> CORRECTION_MARKERS = List.of("corrects", "fixes", "updates", "revises",
            "replaces previous");

    public IntegrationResult integrate(Map<String, Object> originalContext,
                                       Map<String, Object> newFindings,
                                       IntegrationStrategy strategy) {
        return integrate(null, originalContext, newFindings, strategy, SourceConfidence.neutral());
    }

    /**
     * Integrate and report what changed. Never throws on conflicts: a result that leaves
     * conflicts unresolved comes back with {@code complete == false}.
     */
    public IntegrationResult integrate(String requestId,
                                       Map<String, Object> originalContext,
                                       Map<String, Object> newFindings,
                                       IntegrationStrategy strategy,
                                       SourceConfidence confidence) {
        Map<String, Object> original = originalContext == null ? Map.of() : originalContext;
        Map<String, Object> incoming = newFindings == null ? Map.of() : newFindings;
        SourceConfidence sources = confidence == null ? SourceConfidence.neutral() : confidence;

        CompatibilityAnalysis analysis = analyze(original, incoming);
        Outcome outcome = apply(strategy, original, incoming, analysis, sources);

        Set<String> unresolved = new LinkedHashSet<>(analysis.conflicts());
        unresolved.removeAll(outcome.settled());
        boolean complete = true;
        try {
            verifyResolved(unresolved);
        } catch (IntegrationConflictException e) {
            log.warn("[ContextIntegrator] Integration for request {} left {} conflicts unresolved: {}",
                    requestId, e.getUnresolvedKeys().size(), e.getMessage());
            complete = false;
        }

        double improvement = confidenceImprovement(analysis, outcome, unresolved.size());
        IntegrationChanges changes = new IntegrationChanges(
                outcome.added(), outcome.updated(),
                complete ? outcome.resolved() : Set.of(), outcome.dropped());

        log.info("[ContextIntegrator] {} integration: {} conflicts, {} supplements, {} overlaps -> {} fields, improvement {}",
                strategy == null ? "unconfigured" : strategy.wireName(),
                analysis.conflicts().size(), analysis.supplements().size(), analysis.overlaps().size(),
                outcome.integrated().size(), String.format("%.3f", improvement));

        return new IntegrationResult(
                UUID.randomUUID().toString(),
                requestId,
                strategy,
                analysis.recommendedStrategy(),
                original,
                incoming,
                outcome.integrated(),
                changes,
                unresolved,
                improvement,
                complete);
    }

    /**
     * Partition the new keys relative to the original context.
     */
    public CompatibilityAnalysis analyze(Map<String, Object> original, Map<String, Object> incoming) {
        Set<String> conflicts = new LinkedHashSet<>();
        Set<String> supplements = new LinkedHashSet<>();
        Set<String> overlaps = new LinkedHashSet<>();
        Set<String> incomplete = new LinkedHashSet<>();
        Set<String> corrections = new LinkedHashSet<>();

        for (Map.Entry<String, Object> entry : incoming.entrySet()) {
            String key = entry.getKey();
            if (!original.containsKey(key)) {
                supplements.add(key);
            } else if (sameValue(original.get(key), entry.getValue())) {
                overlaps.add(key);
            } else {
                conflicts.add(key);
                if (looksIncomplete(original.get(key))) {
                    incomplete.add(key);
                }
                if (looksLikeCorrection(entry.getValue())) {
                    corrections.add(key);
                }
            }
        }
        return new CompatibilityAnalysis(conflicts, supplements, overlaps, incomplete, corrections);
    }

    private Outcome apply(IntegrationStrategy strategy, Map<String, Object> original, Map<String, Object> incoming,
                          CompatibilityAnalysis analysis, SourceConfidence sources) {
        Outcome outcome = new Outcome(new LinkedHashMap<>(original));
        if (strategy == null) {
            addSupplements(outcome, incoming, analysis);
            return outcome;
        }
        switch (strategy) {
            case MERGE -> {
                addSupplements(outcome, incoming, analysis);
                for (String key : analysis.conflicts()) {
                    if (analysis.incompleteOriginals().contains(key)) {
                        outcome.fill(key, incoming.get(key));
                    } else if (sources.incomingWins()) {
                        outcome.takeIncoming(key, incoming.get(key), compare(sources.incoming(), sources.original()));
                    } else {
                        outcome.keepOriginal(key, compare(sources.original(), sources.incoming()));
                    }
                }
            }
            case APPEND -> {
                String section = APPEND_SECTION;
                for (int i = 1; original.containsKey(section); i++) {
                    section = APPEND_SECTION + "_" + i;
                }
                outcome.integrated().put(section, new LinkedHashMap<>(incoming));
                outcome.added().add(section);
                outcome.gapsFilled += analysis.supplements().size();
                outcome.supplementsIntegrated += analysis.supplements().size();
                // conflicting values survive side by side under the section
                outcome.settled().addAll(analysis.conflicts());
            }
            case SELECTIVE -> {
                addSupplements(outcome, incoming, analysis);
                outcome.dropped().addAll(analysis.conflicts());
                outcome.dropped().addAll(analysis.overlaps());
                outcome.settled().addAll(analysis.conflicts());
            }
            case PRIORITIZE_NEW -> {
                addSupplements(outcome, incoming, analysis);
                for (String key : analysis.conflicts()) {
                    if (analysis.incompleteOriginals().contains(key)) {
                        outcome.fill(key, incoming.get(key));
                    } else {
                        outcome.takeIncoming(key, incoming.get(key), compare(sources.incoming(), sources.original()));
                    }
                }
            }
            case PRIORITIZE_ORIGINAL -> {
                addSupplements(outcome, incoming, analysis);
                for (String key : analysis.conflicts()) {
                    outcome.keepOriginal(key, compare(sources.original(), sources.incoming()));
                }
            }
        }
        return outcome;
    }

    private static void addSupplements(Outcome outcome, Map<String, Object> incoming, CompatibilityAnalysis analysis) {
        for (String key : analysis.supplements()) {
            outcome.integrated().put(key, incoming.get(key));
            outcome.added().add(key);
            outcome.gapsFilled++;
            outcome.supplementsIntegrated++;
        }
    }

    private static void verifyResolved(Set<String> unresolved) {
        if (!unresolved.isEmpty()) {
            throw new IntegrationConflictException(unresolved);
        }
    }

    /**
     * Non-decreasing in the number of integrated supplements, clamped to [0, 1].
     */
    private static double confidenceImprovement(CompatibilityAnalysis analysis, Outcome outcome, int unresolved) {
        double base = analysis.compatibilityScore() * 0.3;
        double gapTerm = Math.min(outcome.gapsFilled * 0.1, 0.4);
        double supplementTerm = Math.min(outcome.supplementsIntegrated * 0.05, 0.2);
        double resolvedTerm = Math.min(outcome.resolvedTowardHigher * 0.05, 0.1);
        double penalty = Math.min((unresolved + outcome.resolvedTowardLower) * 0.05, 0.3);

        double total = base + gapTerm + supplementTerm + resolvedTerm - penalty;
        return Math.max(0.0, Math.min(1.0, total));
    }

    private static int compare(double winner, double loser) {
        return Double.compare(winner, loser);
    }

    static boolean sameValue(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            try {
                return new BigDecimal(x.toString()).compareTo(new BigDecimal(y.toString())) == 0;
            } catch (NumberFormatException e) {
                return x.doubleValue() == y.doubleValue();
            }
        }
        return Objects.equals(a, b);
    }

    static boolean looksIncomplete(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String text) {
            String lower = text.toLowerCase(Locale.ROOT);
            return lower.isBlank() || INCOMPLETE_MARKERS.stream().anyMatch(lower::contains);
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return false;
    }

    static boolean looksLikeCorrection(Object value) {
        if (!(value instanceof String text)) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return CORRECTION_MARKERS.stream().anyMatch(lower::contains);
    }

    /**
     * Mutable accumulator for one integration run.
     */
    private static final class Outcome {
        private final Map<String, Object> integrated;
        private final Set<String> added = new LinkedHashSet<>();
        private final Set<String> updated = new LinkedHashSet<>();
        private final Set<String> resolved = new LinkedHashSet<>();
        private final Set<String> dropped = new LinkedHashSet<>();
        private final Set<String> settled = new LinkedHashSet<>();
        private int gapsFilled;
        private int supplementsIntegrated;
        private int resolvedTowardHigher;
        private int resolvedTowardLower;

        Outcome(Map<String, Object> integrated) {
            this.integrated = integrated;
        }

        void fill(String key, Object value) {
            integrated.put(key, value);
            updated.add(key);
            resolved.add(key);
            settled.add(key);
            gapsFilled++;
        }

        void takeIncoming(String key, Object value, int confidenceOrder) {
            integrated.put(key, value);
            updated.add(key);
            resolve(key, confidenceOrder);
        }

        void keepOriginal(String key, int confidenceOrder) {
            resolve(key, confidenceOrder);
        }

        private void resolve(String key, int confidenceOrder) {
            resolved.add(key);
            settled.add(key);
            if (confidenceOrder > 0) {
                resolvedTowardHigher++;
            } else if (confidenceOrder < 0) {
                resolvedTowardLower++;
            }
        }

        Map<String, Object> integrated() { return integrated; }
        Set<String> added() { return added; }
        Set<String> updated() { return updated; }
        Set<String> resolved() { return resolved; }
        Set<String> dropped() { return dropped; }
        Set<String> settled() { return settled; }
    }
}
