package com.vidnyan.dre.domain.request;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.vidnyan.dre.domain.gap.Severity;

import java.util.Locale;

/**
 * Request urgency, used for scheduling estimates and sub-workflow priority.
 */
public enum RequestUrgency {
    LOW(1.5),
    MEDIUM(1.0),
    HIGH(0.7),
    CRITICAL(0.5);

    private final double durationMultiplier;

    RequestUrgency(double durationMultiplier) {
        this.durationMultiplier = durationMultiplier;
    }

    public double durationMultiplier() {
        return durationMultiplier;
    }

    public boolean isElevated() {
        return this == HIGH || this == CRITICAL;
    }

    public static RequestUrgency forSeverity(Severity severity) {
        return switch (severity) {
            case LOW -> LOW;
            case MEDIUM -> MEDIUM;
            case HIGH -> HIGH;
            case CRITICAL -> CRITICAL;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RequestUrgency fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
