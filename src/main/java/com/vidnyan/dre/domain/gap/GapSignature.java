package com.vidnyan.dre.domain.gap;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One row of the gap signature table: log-line patterns that indicate a gap type.
 * Declaration order in the table breaks severity ties.
 */
public record GapSignature(
    GapType gapType,
    List<Pattern> patterns,
    Severity defaultSeverity,
    String resolvedBy,      // findings key that makes this signature moot, may be null
    Set<String> suggestedExpertise
) {

    public GapSignature {
        patterns = List.copyOf(patterns);
        suggestedExpertise = suggestedExpertise == null ? Set.of() : Set.copyOf(suggestedExpertise);
    }

    /**
     * Compile case-insensitive patterns from plain regex strings.
     */
    public static GapSignature of(GapType type, List<String> regexes, Severity severity,
                                  String resolvedBy, Set<String> expertise) {
        List<Pattern> compiled = regexes.stream()
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
        return new GapSignature(type, compiled, severity, resolvedBy, expertise);
    }

    /**
     * Return the first pattern matching the line, or null.
     */
    public Pattern firstMatch(String line) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(line).find()) {
                return pattern;
            }
        }
        return null;
    }
}
