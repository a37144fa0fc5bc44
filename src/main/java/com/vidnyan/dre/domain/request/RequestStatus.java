package com.vidnyan.dre.domain.request;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle states of a dynamic agent request.
 * Every non-terminal state may also fail.
 */
public enum RequestStatus {
    PENDING(0.0),
    ANALYZING(20.0),
    AGENT_SELECTED(40.0),
    CONTEXT_GENERATED(60.0),
    EXECUTING(80.0),
    COMPLETED(100.0),
    FAILED(100.0);

    private final double progressPercentage;

    RequestStatus(double progressPercentage) {
        this.progressPercentage = progressPercentage;
    }

    public double progressPercentage() {
        return progressPercentage;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Forward edges of the state machine.
     */
    public Set<RequestStatus> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(ANALYZING, AGENT_SELECTED, FAILED);
            case ANALYZING -> EnumSet.of(AGENT_SELECTED, FAILED);
            case AGENT_SELECTED -> EnumSet.of(CONTEXT_GENERATED, FAILED);
            case CONTEXT_GENERATED -> EnumSet.of(EXECUTING, FAILED);
            case EXECUTING -> EnumSet.of(COMPLETED, FAILED);
            case COMPLETED, FAILED -> EnumSet.noneOf(RequestStatus.class);
        };
    }

    public boolean canTransitionTo(RequestStatus next) {
        return successors().contains(next);
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
