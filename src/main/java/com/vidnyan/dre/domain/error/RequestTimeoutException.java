package com.vidnyan.dre.domain.error;

import java.time.Instant;

/**
 * A request passed its deadline before the helper finished.
 */
public class RequestTimeoutException extends DynamicRequestException {

    public RequestTimeoutException(String requestId, Instant timeoutAt) {
        super("Request " + requestId + " timed out at " + timeoutAt);
    }
}
