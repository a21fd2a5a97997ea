package com.contact.resolution.core.model;

/**
 * Descriptive data the system of record holds for a canonical entity.
 *
 * @param entityId    secondary entity identifier, may be null when the source has none
 * @param displayName human readable name, may be null
 */
public record EntityMetadata(String entityId, String displayName) {

    public static EntityMetadata empty() {
        return new EntityMetadata(null, null);
    }

    public boolean hasEntityId() {
        return entityId != null && !entityId.isBlank();
    }
}
