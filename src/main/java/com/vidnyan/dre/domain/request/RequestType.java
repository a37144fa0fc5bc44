package com.vidnyan.dre.domain.request;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.vidnyan.dre.domain.gap.GapType;

import java.util.Locale;

/**
 * What kind of help a request asks for.
 */
public enum RequestType {
    RESEARCH(15),
    VALIDATION(10),
    ANALYSIS(20),
    EXPERTISE(25),
    SUPPLEMENTAL_CONTEXT(15),
    DEPENDENCY_ANALYSIS(15),
    SECURITY_AUDIT(30),
    PERFORMANCE_ASSESSMENT(20);

    private final int baseMinutes;

    RequestType(int baseMinutes) {
        this.baseMinutes = baseMinutes;
    }

    /**
     * Typical helper turnaround before urgency adjustment.
     */
    public int baseMinutes() {
        return baseMinutes;
    }

    public static RequestType forGap(GapType gapType) {
        return switch (gapType) {
            case MISSING_DEPENDENCY -> DEPENDENCY_ANALYSIS;
            case INSUFFICIENT_EXPERTISE -> EXPERTISE;
            case SECURITY_CONCERN -> SECURITY_AUDIT;
            case PERFORMANCE_IMPACT -> PERFORMANCE_ASSESSMENT;
            case MISSING_CONTEXT -> SUPPLEMENTAL_CONTEXT;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RequestType fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
