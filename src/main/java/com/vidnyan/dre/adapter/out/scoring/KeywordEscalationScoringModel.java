package com.vidnyan.dre.adapter.out.scoring;

import com.vidnyan.dre.application.port.out.GapScoringModel;
import com.vidnyan.dre.config.GapDetectionProperties;
import com.vidnyan.dre.domain.gap.InformationGap;
import com.vidnyan.dre.domain.gap.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Raises a gap one severity level when its log line carries an escalation keyword
 * such as "critical" or "blocker".
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KeywordEscalationScoringModel implements GapScoringModel {

    private final GapDetectionProperties properties;

    @Override
    public Severity score(InformationGap gap, Map<String, Object> taskContext) {
        if (!(gap.relatedContext().get("log_entry") instanceof String entry)) {
            return gap.severity();
        }
        String line = entry.toLowerCase(Locale.ROOT);
        for (String keyword : properties.getEscalationKeywords()) {
            if (line.contains(keyword.toLowerCase(Locale.ROOT))) {
                log.debug("Escalating gap {} on keyword '{}'", gap.gapId(), keyword);
                return gap.severity().escalate();
            }
        }
        return gap.severity();
    }
}
