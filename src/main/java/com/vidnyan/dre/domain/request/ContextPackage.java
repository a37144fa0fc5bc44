package com.vidnyan.dre.domain.request;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded bundle of information handed to a helper agent.
 * Immutable once generated.
 */
public record ContextPackage(
    String packageId,
    Map<String, Object> content,
    int tokenBudget,
    int estimatedTokens,
    String createdForRequestId,
    Instant createdAt
) {

    public ContextPackage {
        content = Collections.unmodifiableMap(new LinkedHashMap<>(content));
    }
}
