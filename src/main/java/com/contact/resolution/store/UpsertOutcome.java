package com.contact.resolution.store;

/**
 * What an upsert did to the stored record.
 */
public enum UpsertOutcome {
    /** No record existed; one was created at version 1. */
    CREATED,
    /** Same canonical id on a live record; only verification metadata moved. */
    UNCHANGED,
    /** The canonical id changed; the version was incremented. */
    VERSION_BUMPED,
    /** An invalidated record was confirmed with the same id and revived. */
    REFRESHED
}
