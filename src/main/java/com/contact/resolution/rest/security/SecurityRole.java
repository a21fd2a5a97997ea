package com.contact.resolution.rest.security;

import java.util.Locale;

/**
 * Roles for the admin API, ordered by privilege: {@code OPERATOR > VIEWER}.
 */
public enum SecurityRole {

    /** Read-only: resolve lookups and read health. */
    VIEWER,

    /** Everything a viewer can do, plus cache invalidation. */
    OPERATOR;

    public boolean hasPermission(SecurityRole required) {
        return this.ordinal() >= required.ordinal();
    }

    /**
     * Parses a role name, ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException if the value is blank or names no role
     */
    public static SecurityRole fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Security role must not be null or blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
