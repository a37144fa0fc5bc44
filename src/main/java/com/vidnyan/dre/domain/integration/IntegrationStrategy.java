package com.vidnyan.dre.domain.integration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a helper's findings are reconciled with the requester's context.
 */
public enum IntegrationStrategy {
    MERGE,
    APPEND,
    SELECTIVE,
    PRIORITIZE_NEW,
    PRIORITIZE_ORIGINAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IntegrationStrategy fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
