package com.contact.resolution.core.model;

/**
 * Kinds of contact identifiers that can be resolved to a canonical entity.
 */
public enum LookupType {
    PHONE("phone"),
    EMAIL("email");

    private final String prefix;

    LookupType(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Returns the lower-case prefix used in cache keys, e.g. {@code phone}.
     */
    public String getPrefix() {
        return prefix;
    }

    /**
     * Parses a lookup type from string, case-insensitive.
     *
     * @param value the type name ({@code phone} or {@code email})
     * @return the matching LookupType
     * @throws IllegalArgumentException if the value doesn't match any type
     */
    public static LookupType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Lookup type must not be null or blank");
        }
        String trimmed = value.trim();
        for (LookupType type : values()) {
            if (type.prefix.equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown lookup type: " + value);
    }
}
