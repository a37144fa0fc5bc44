package com.vidnyan.dre.domain.error;

import java.util.Set;

/**
 * No registered agent offers any of the required capabilities.
 */
public class NoCapableAgentException extends DynamicRequestException {

    private final Set<String> requiredCapabilities;

    public NoCapableAgentException(Set<String> requiredCapabilities) {
        super("No capable agent for capabilities " + requiredCapabilities);
        this.requiredCapabilities = Set.copyOf(requiredCapabilities);
    }

    public Set<String> getRequiredCapabilities() {
        return requiredCapabilities;
    }
}
