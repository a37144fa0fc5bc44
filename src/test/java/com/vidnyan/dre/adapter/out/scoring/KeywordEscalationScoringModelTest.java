package com.vidnyan.dre.adapter.out.scoring;

import com.vidnyan.dre.config.GapDetectionProperties;
import com.vidnyan.dre.domain.gap.GapType;
import com.vidnyan.dre.domain.gap.InformationGap;
import com.vidnyan.dre.domain.gap.Severity;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KeywordEscalationScoringModelTest {

    private final KeywordEscalationScoringModel model = newModel();

    @Test
    void score_ShouldEscalateOneLevelOnKeyword() {
        assertEquals(Severity.HIGH, model.score(gap(Severity.MEDIUM, "Urgent: resource impact on checkout"), Map.of()));
        assertEquals(Severity.CRITICAL, model.score(gap(Severity.CRITICAL, "outage risk"), Map.of()));
    }

    @Test
    void score_ShouldKeepSeverityWithoutKeyword() {
        assertEquals(Severity.MEDIUM, model.score(gap(Severity.MEDIUM, "resource impact on checkout"), Map.of()));
        InformationGap contextGap = new InformationGap("g", GapType.MISSING_CONTEXT, "Missing dependencies",
                Severity.MEDIUM, "agent", Set.of(), Map.of("missing_field", "dependencies"));
        assertEquals(Severity.MEDIUM, model.score(contextGap, Map.of()));
    }

    private static InformationGap gap(Severity severity, String logEntry) {
        return new InformationGap("g", GapType.PERFORMANCE_IMPACT, "desc", severity, "agent",
                Set.of("performance-profiling"), Map.of("log_entry", logEntry));
    }

    private static KeywordEscalationScoringModel newModel() {
        GapDetectionProperties properties = new GapDetectionProperties();
        properties.init();
        return new KeywordEscalationScoringModel(properties);
    }
}
