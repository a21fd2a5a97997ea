package com.contact.resolution.invalidation;

import com.contact.resolution.core.model.CacheKey;

/**
 * Result of an invalidation request.
 *
 * @param key           the normalized key, the empty sentinel when rejected
 * @param invalidated   true if the request was accepted and the tiers were cleared
 * @param recordExisted true if the authoritative store held a record for the key
 * @param reason        the reason given by the caller
 */
public record InvalidationOutcome(CacheKey key, boolean invalidated, boolean recordExisted, String reason) {

    public static InvalidationOutcome rejected(CacheKey key, String reason) {
        return new InvalidationOutcome(key, false, false, reason);
    }
}
