package com.contact.resolution.core.model;

/**
 * Origin of the mapping held by an authoritative record.
 */
public enum RecordSource {
    /** Resolved directly against the system of record. */
    SYSTEM_OF_RECORD,
    /** Loaded from a known mapping (warm-up or bulk replication) rather than a live lookup. */
    REPLICATED
}
