package com.vidnyan.dre.domain.integration;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Keys touched by an integration, in the order they were touched.
 */
public record IntegrationChanges(
    Set<String> added,
    Set<String> updated,
    Set<String> conflictsResolved,
    Set<String> dropped
) {

    public IntegrationChanges {
        added = ordered(added);
        updated = ordered(updated);
        conflictsResolved = ordered(conflictsResolved);
        dropped = ordered(dropped);
    }

    private static Set<String> ordered(Set<String> keys) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(keys));
    }
}
