package com.vidnyan.dre.domain.integration;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IntegrationStatus {
    COMPLETED,
    INCOMPLETE,   // conflicts left unresolved, partial result kept
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
