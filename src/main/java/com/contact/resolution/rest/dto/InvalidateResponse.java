package com.contact.resolution.rest.dto;

import com.contact.resolution.invalidation.InvalidationOutcome;

/**
 * Invalidation answer.
 *
 * @param invalidated   always true on a 200
 * @param key           the normalized key, {@code type:value}
 * @param recordExisted whether the authoritative store had a record for the key
 */
public record InvalidateResponse(boolean invalidated, String key, boolean recordExisted) {

    public static InvalidateResponse from(InvalidationOutcome outcome) {
        return new InvalidateResponse(outcome.invalidated(), outcome.key().asString(), outcome.recordExisted());
    }
}
