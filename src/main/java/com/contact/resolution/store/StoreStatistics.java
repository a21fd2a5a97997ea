package com.contact.resolution.store;

/**
 * Aggregate counts over the authoritative store.
 *
 * @param total           all records, including invalidated ones
 * @param active          records that are not invalidated
 * @param invalidated     records carrying an invalidation mark
 * @param missingEntityId active records without a secondary entity id
 * @param staleMirror     active records whose distributed cache mirror is missing, behind or expired
 */
public record StoreStatistics(long total, long active, long invalidated, long missingEntityId, long staleMirror) {

    public static StoreStatistics empty() {
        return new StoreStatistics(0, 0, 0, 0, 0);
    }

    public double missingEntityIdRatio() {
        return active == 0 ? 0.0 : (double) missingEntityId / active;
    }

    public double staleMirrorRatio() {
        return active == 0 ? 0.0 : (double) staleMirror / active;
    }
}
