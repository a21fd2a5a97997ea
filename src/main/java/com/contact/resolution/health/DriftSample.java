package com.contact.resolution.health;

import java.time.Duration;
import java.time.Instant;

/**
 * One entity compared between the system of record and the authoritative store.
 *
 * @param canonicalId          the sampled entity
 * @param sourceEditedAt       when the system of record last changed it
 * @param lastVerifiedAt       latest verification among the store's live records for it, null if none
 * @param tolerance            allowed lag
 */
public record DriftSample(String canonicalId, Instant sourceEditedAt, Instant lastVerifiedAt, Duration tolerance) {

    /**
     * True if the store holds nothing live for the entity, or last verified it more
     * than the tolerance before the source edit.
     */
    public boolean isOutOfSync() {
        if (lastVerifiedAt == null) {
            return true;
        }
        if (sourceEditedAt == null) {
            return false;
        }
        return lastVerifiedAt.plus(tolerance).isBefore(sourceEditedAt);
    }
}
