package com.contact.resolution.api;

import com.contact.resolution.core.model.LookupType;

import java.util.Objects;

/**
 * A known mapping to pre-load into the cache tiers.
 *
 * @param type        the lookup type
 * @param lookup      raw phone number or email address
 * @param canonicalId canonical entity id
 * @param entityId    secondary entity id, may be null
 */
public record WarmUpMapping(LookupType type, String lookup, String canonicalId, String entityId) {

    public WarmUpMapping {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(canonicalId, "canonicalId is required");
    }
}
