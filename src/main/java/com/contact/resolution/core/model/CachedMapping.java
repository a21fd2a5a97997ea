package com.contact.resolution.core.model;

import java.util.Objects;

/**
 * The value every cache tier stores for a key: the canonical identifier, the optional
 * secondary entity identifier, and the authoritative version it was copied from.
 *
 * @param canonicalId canonical entity identifier
 * @param entityId    secondary entity identifier, may be null
 * @param version     authoritative version, at least 1
 */
public record CachedMapping(String canonicalId, String entityId, long version) {

    public CachedMapping {
        Objects.requireNonNull(canonicalId, "canonicalId is required");
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1");
        }
    }
}
