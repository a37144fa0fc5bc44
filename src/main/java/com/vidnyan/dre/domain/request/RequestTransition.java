package com.vidnyan.dre.domain.request;

import java.time.Instant;

/**
 * A single state change of a request.
 */
public record RequestTransition(
    String requestId,
    RequestStatus from,
    RequestStatus to,
    Instant timestamp
) {
}
