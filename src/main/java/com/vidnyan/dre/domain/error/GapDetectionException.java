package com.vidnyan.dre.domain.error;

/**
 * Malformed execution trace. Recovered by the detector, never surfaced to callers.
 */
public class GapDetectionException extends DynamicRequestException {

    public GapDetectionException(String message) {
        super(message);
    }
}
