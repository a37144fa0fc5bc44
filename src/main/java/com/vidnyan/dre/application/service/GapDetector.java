package com.vidnyan.dre.application.service;

import com.vidnyan.dre.application.port.out.GapScoringModel;
import com.vidnyan.dre.config.GapDetectionProperties;
import com.vidnyan.dre.domain.error.GapDetectionException;
import com.vidnyan.dre.domain.gap.GapSignature;
import com.vidnyan.dre.domain.gap.GapType;
import com.vidnyan.dre.domain.gap.InformationGap;
import com.vidnyan.dre.domain.gap.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Finds information gaps in an agent's execution trace.
 *
 * Rule based: log lines are matched against the signature table and the task's
 * required context fields are diffed against what the agent already knows.
 * A scoring model may then adjust severities. Pure apart from logging.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GapDetector {

    static final String REQUIRED_CONTEXT_KEY = "required_context";

    private final GapDetectionProperties properties;
    private final GapScoringModel scoringModel;

    /**
     * Detect gaps, most severe first. Returns an empty list for malformed input.
     */
    public List<InformationGap> detectGaps(String agentName,
                                           Map<String, Object> taskContext,
                                           List<String> executionLog,
                                           Map<String, Object> currentFindings) {
        try {
            if (agentName == null || agentName.isBlank()) {
                throw new GapDetectionException("agent name is missing");
            }
            Map<String, Object> context = taskContext == null ? Map.of() : taskContext;
            Map<String, Object> findings = currentFindings == null ? Map.of() : currentFindings;
            List<String> trace = executionLog == null ? List.of() : executionLog;

            List<GapSignature> table = properties.signatureTable();
            List<RankedGap> detected = new ArrayList<>();
            Set<String> seen = new HashSet<>();

            detectPatternGaps(agentName, trace, findings, table, detected, seen);
            detectContextGaps(agentName, context, findings, table.size(), detected, seen);

            List<InformationGap> gaps = detected.stream()
                    .map(ranked -> ranked.withGap(applyScoring(ranked.gap(), context)))
                    .sorted(Comparator.comparing((RankedGap r) -> r.gap().severity()).reversed()
                            .thenComparingInt(RankedGap::order))
                    .map(RankedGap::gap)
                    .toList();

            log.info("[GapDetector] {} gaps for {} ({} high priority)",
                    gaps.size(), agentName, gaps.stream().filter(InformationGap::isHighPriority).count());
            return gaps;
        } catch (GapDetectionException e) {
            log.warn("[GapDetector] Ignoring malformed trace from {}: {}", agentName, e.getMessage());
            return List.of();
        } catch (RuntimeException e) {
            log.error("[GapDetector] Gap detection failed for {}: {}", agentName, e.getMessage(), e);
            return List.of();
        }
    }

    private void detectPatternGaps(String agentName, List<String> trace, Map<String, Object> findings,
                                   List<GapSignature> table, List<RankedGap> out, Set<String> seen) {
        for (String line : trace) {
            if (line == null) {
                throw new GapDetectionException("execution log contains a null entry");
            }
            for (int order = 0; order < table.size(); order++) {
                GapSignature signature = table.get(order);
                if (signature.resolvedBy() != null && findings.containsKey(signature.resolvedBy())) {
                    continue;
                }
                Pattern match = signature.firstMatch(line);
                if (match == null) {
                    continue;
                }
                String gapId = InformationGap.stableId(agentName, signature.gapType(), match.pattern());
                if (seen.add(gapId)) {
                    InformationGap gap = new InformationGap(
                            gapId,
                            signature.gapType(),
                            "Log indicates " + signature.gapType().wireName() + ": \"" + line.trim() + "\"",
                            signature.defaultSeverity(),
                            agentName,
                            signature.suggestedExpertise(),
                            Map.of("log_entry", line, "pattern", match.pattern()));
                    out.add(new RankedGap(gap, order));
                }
            }
        }
    }

    private void detectContextGaps(String agentName, Map<String, Object> context, Map<String, Object> findings,
                                   int firstOrder, List<RankedGap> out, Set<String> seen) {
        List<String> required = requiredFields(context);
        for (int i = 0; i < required.size(); i++) {
            String field = required.get(i);
            if (context.containsKey(field) || findings.containsKey(field)) {
                continue;
            }
            String gapId = InformationGap.stableId(agentName, GapType.MISSING_CONTEXT, field);
            if (seen.add(gapId)) {
                InformationGap gap = new InformationGap(
                        gapId,
                        GapType.MISSING_CONTEXT,
                        "Missing " + field + " information",
                        properties.getMissingContextSeverity(),
                        agentName,
                        new LinkedHashSet<>(properties.expertiseFor(field)),
                        Map.of("missing_field", field));
                out.add(new RankedGap(gap, firstOrder + i));
            }
        }
    }

    private List<String> requiredFields(Map<String, Object> context) {
        Object declared = context.get(REQUIRED_CONTEXT_KEY);
        if (declared == null) {
            return properties.getRequiredContext();
        }
        if (!(declared instanceof Collection<?> fields)) {
            throw new GapDetectionException(REQUIRED_CONTEXT_KEY + " must be a list of field names");
        }
        List<String> names = new ArrayList<>();
        for (Object field : fields) {
            if (!(field instanceof String name)) {
                throw new GapDetectionException(REQUIRED_CONTEXT_KEY + " contains a non-string entry");
            }
            names.add(name);
        }
        return names;
    }

    private InformationGap applyScoring(InformationGap gap, Map<String, Object> context) {
        try {
            Severity scored = scoringModel.score(gap, context);
            return scored == null || scored == gap.severity() ? gap : gap.withSeverity(scored);
        } catch (RuntimeException e) {
            log.warn("[GapDetector] Scoring failed for gap {}, keeping {}: {}",
                    gap.gapId(), gap.severity(), e.getMessage());
            return gap;
        }
    }

    /**
     * Gap plus its position in the signature table, used to break severity ties.
     */
    private record RankedGap(InformationGap gap, int order) {
        RankedGap withGap(InformationGap replacement) {
            return new RankedGap(replacement, order);
        }
    }
}
