package com.contact.resolution.core.model;

/**
 * Tier that produced a resolution result.
 */
public enum ResolutionSource {
    EDGE("edge"),
    DISTRIBUTED("distributed"),
    AUTHORITATIVE("authoritative"),
    SYSTEM_OF_RECORD("system-of-record"),
    MISS("miss");

    private final String label;

    ResolutionSource(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
