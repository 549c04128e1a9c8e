package com.quikdb.api.access;

import com.quikdb.api.error.RewardException;
import com.quikdb.core.domain.Capability;

/**
 * Capability check injected into every mutating component.
 */
public interface AccessPolicy {

    boolean hasCapability(String caller, Capability capability);

    default void require(String caller, Capability capability) {
        if (caller == null || caller.isBlank()) {
            throw RewardException.unauthorized("Caller identity is required");
        }
        if (!hasCapability(caller, capability)) {
            throw RewardException.unauthorized(caller + " lacks capability " + capability);
        }
    }
}
