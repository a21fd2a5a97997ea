package com.contact.resolution.api;

import com.contact.resolution.core.model.ResolutionSource;

import java.util.Objects;

/**
 * Outcome of a lookup.
 *
 * @param canonicalId canonical entity id, null on a miss
 * @param entityId    secondary entity id, may be null even on a hit
 * @param version     authoritative version of the mapping, 0 on a miss. When a system of record
 *                    answer could not be stored it is the highest version already returned for
 *                    the key, or 0 if there is none
 * @param source      the tier that answered
 */
public record ResolutionResult(String canonicalId, String entityId, long version, ResolutionSource source) {

    private static final ResolutionResult MISS = new ResolutionResult(null, null, 0, ResolutionSource.MISS);

    public ResolutionResult {
        Objects.requireNonNull(source, "source is required");
    }

    public static ResolutionResult miss() {
        return MISS;
    }

    public boolean isHit() {
        return canonicalId != null;
    }
}
