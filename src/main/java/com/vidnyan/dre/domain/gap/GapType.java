package com.vidnyan.dre.domain.gap;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of information gaps an executing agent can run into.
 */
public enum GapType {
    MISSING_DEPENDENCY,
    INSUFFICIENT_EXPERTISE,
    SECURITY_CONCERN,
    PERFORMANCE_IMPACT,
    MISSING_CONTEXT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static GapType fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
