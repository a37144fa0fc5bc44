package com.vidnyan.dre.domain.error;

import java.util.Set;

/**
 * An integration finished with conflicting keys that no strategy resolved.
 */
public class IntegrationConflictException extends DynamicRequestException {

    private final Set<String> unresolvedKeys;

    public IntegrationConflictException(Set<String> unresolvedKeys) {
        super("Unresolved integration conflicts: " + unresolvedKeys);
        this.unresolvedKeys = Set.copyOf(unresolvedKeys);
    }

    public Set<String> getUnresolvedKeys() {
        return unresolvedKeys;
    }
}
