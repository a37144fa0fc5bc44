package com.vidnyan.dre.config;

import com.vidnyan.dre.domain.gap.GapSignature;
import com.vidnyan.dre.domain.gap.GapType;
import com.vidnyan.dre.domain.gap.Severity;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Gap signature table and context expectations used by the gap detector.
 * Signature order matters: it breaks severity ties when gaps are ranked.
 */
@Data
@Component
@ConfigurationProperties(prefix = "dre.gap-detection")
public class GapDetectionProperties {

    private List<Signature> signatures = new ArrayList<>();

    /**
     * Context fields every task is expected to carry, unless the task declares its own.
     */
    private List<String> requiredContext = new ArrayList<>();

    private Map<String, List<String>> contextExpertise = new LinkedHashMap<>();

    private Severity missingContextSeverity = Severity.MEDIUM;

    /**
     * Words in a log line that push a gap one severity level up.
     */
    private List<String> escalationKeywords = new ArrayList<>();

    @PostConstruct
    public void init() {
        if (signatures.isEmpty()) {
            signatures.add(new Signature(GapType.SECURITY_CONCERN,
                    List.of("security (validation|review|audit|check)", "potential security risk",
                            "audit required", "vulnerabilit(y|ies)"),
                    Severity.HIGH, "security_score",
                    List.of("security-audit", "vulnerability-assessment")));
            signatures.add(new Signature(GapType.MISSING_DEPENDENCY,
                    List.of("need information about", "requires analysis of",
                            "depends on understanding", "missing context for"),
                    Severity.MEDIUM, null,
                    List.of("dependency-analysis", "codebase-research")));
            signatures.add(new Signature(GapType.INSUFFICIENT_EXPERTISE,
                    List.of("beyond my expertise", "need specialist knowledge",
                            "requires domain expert", "unfamiliar with"),
                    Severity.MEDIUM, null,
                    List.of("domain-expertise")));
            signatures.add(new Signature(GapType.PERFORMANCE_IMPACT,
                    List.of("performance (implications|unclear|impact|concerns?)", "scalability concerns?",
                            "resource impact", "optimization needed"),
                    Severity.MEDIUM, "performance_metrics",
                    List.of("performance-profiling", "monitoring")));
        }
        if (requiredContext.isEmpty()) {
            requiredContext.addAll(List.of(
                    "system_architecture", "dependencies", "security_requirements", "performance_targets"));
        }
        if (contextExpertise.isEmpty()) {
            contextExpertise.put("system_architecture", List.of("architecture-analysis", "codebase-research"));
            contextExpertise.put("dependencies", List.of("dependency-analysis"));
            contextExpertise.put("security_requirements", List.of("security-audit"));
            contextExpertise.put("performance_targets", List.of("performance-profiling"));
        }
        if (escalationKeywords.isEmpty()) {
            escalationKeywords.addAll(List.of("critical", "urgent", "blocker", "outage"));
        }
    }

    /**
     * Compiled signature table in declaration order.
     */
    public List<GapSignature> signatureTable() {
        return signatures.stream()
                .map(s -> GapSignature.of(s.getType(), s.getPatterns(), s.getSeverity(), s.getResolvedBy(),
                        new LinkedHashSet<>(s.getExpertise())))
                .toList();
    }

    public List<String> expertiseFor(String contextField) {
        return contextExpertise.getOrDefault(contextField, List.of());
    }

    @Data
    public static class Signature {
        private GapType type;
        private List<String> patterns = new ArrayList<>();
        private Severity severity = Severity.MEDIUM;
        private String resolvedBy;
        private List<String> expertise = new ArrayList<>();

        public Signature() {
        }

        public Signature(GapType type, List<String> patterns, Severity severity, String resolvedBy,
                         List<String> expertise) {
            this.type = type;
            this.patterns = new ArrayList<>(patterns);
            this.severity = severity;
            this.resolvedBy = resolvedBy;
            this.expertise = new ArrayList<>(expertise);
        }
    }
}
