package com.contact.resolution.store;

import com.contact.resolution.core.model.CacheRecord;

import java.util.Objects;

/**
 * Result of {@link AuthoritativeStore#upsert}.
 *
 * @param record  the record as stored after the upsert
 * @param outcome what changed
 */
public record UpsertResult(CacheRecord record, UpsertOutcome outcome) {

    public UpsertResult {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(outcome, "outcome is required");
    }

    public boolean versionChanged() {
        return outcome == UpsertOutcome.CREATED || outcome == UpsertOutcome.VERSION_BUMPED;
    }
}
