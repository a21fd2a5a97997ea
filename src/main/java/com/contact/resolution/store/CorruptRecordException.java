package com.contact.resolution.store;

import com.contact.resolution.core.model.CacheKey;

/**
 * A stored record violates its own invariants (e.g. a version below 1).
 * Not transient: lookups surface it instead of falling through.
 */
public class CorruptRecordException extends RuntimeException {

    private final CacheKey key;

    public CorruptRecordException(CacheKey key, String message) {
        super("Corrupt record " + key + ": " + message);
        this.key = key;
    }

    public CacheKey getKey() {
        return key;
    }
}
