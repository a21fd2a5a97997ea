package com.contact.resolution.store;

import com.contact.resolution.core.model.CacheKey;

/**
 * Signals that a compare-and-swap on a record lost to a concurrent writer.
 * Retried internally; callers of the store never see it.
 */
public class ConcurrentUpdateException extends StorageException {

    private final CacheKey key;

    public ConcurrentUpdateException(CacheKey key) {
        super("Concurrent update on " + key);
        this.key = key;
    }

    public CacheKey getKey() {
        return key;
    }
}
