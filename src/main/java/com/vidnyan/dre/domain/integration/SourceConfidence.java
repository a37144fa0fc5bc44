package com.vidnyan.dre.domain.integration;

/**
 * Confidence attached to each side of an integration, used to settle merge conflicts.
 */
public record SourceConfidence(double original, double incoming) {

    public static SourceConfidence neutral() {
        return new SourceConfidence(0.5, 0.5);
    }

    /**
     * Ties go to the incoming findings.
     */
    public boolean incomingWins() {
        return incoming >= original;
    }
}
