package com.contact.resolution.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A recently edited entity reported by the system of record.
 *
 * @param canonicalId  canonical entity identifier
 * @param lastEditedAt when the system of record last changed the entity
 */
public record SourceEdit(String canonicalId, Instant lastEditedAt) {

    public SourceEdit {
        Objects.requireNonNull(canonicalId, "canonicalId is required");
    }
}
