package com.contact.resolution.rest.dto;

import com.contact.resolution.api.ResolutionResult;

/**
 * Resolution answer. {@code canonicalId} is null on a miss.
 */
public record ResolveResponse(String canonicalId, String entityId, long version, String source) {

    public static ResolveResponse from(ResolutionResult result) {
        return new ResolveResponse(result.canonicalId(), result.entityId(), result.version(),
                result.source().getLabel());
    }
}
