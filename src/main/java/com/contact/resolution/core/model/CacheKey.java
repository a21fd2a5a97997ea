package com.contact.resolution.core.model;

import java.util.Objects;

/**
 * Normalized lookup key shared by every storage tier.
 *
 * <p>A key with an empty {@code normalizedValue} is the "skip" sentinel produced
 * when raw input normalizes to nothing. It is never a valid key and callers must
 * not pass it to any tier.</p>
 *
 * @param type            the lookup type
 * @param normalizedValue the canonical form of the phone number or email address
 */
public record CacheKey(LookupType type, String normalizedValue) {

    public CacheKey {
        Objects.requireNonNull(type, "type is required");
        normalizedValue = normalizedValue != null ? normalizedValue : "";
    }

    /**
     * Returns the empty sentinel for the given type.
     */
    public static CacheKey empty(LookupType type) {
        return new CacheKey(type, "");
    }

    public static CacheKey phone(String normalizedValue) {
        return new CacheKey(LookupType.PHONE, normalizedValue);
    }

    public static CacheKey email(String normalizedValue) {
        return new CacheKey(LookupType.EMAIL, normalizedValue);
    }

    /**
     * Parses the {@code type:value} form produced by {@link #asString()}.
     */
    public static CacheKey parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Cache key must not be null");
        }
        int separator = value.indexOf(':');
        if (separator <= 0) {
            throw new IllegalArgumentException("Malformed cache key: " + value);
        }
        return new CacheKey(LookupType.fromString(value.substring(0, separator)),
                value.substring(separator + 1));
    }

    public boolean isEmpty() {
        return normalizedValue.isEmpty();
    }

    /**
     * Returns the {@code type:value} form, e.g. {@code phone:+13365185544}.
     */
    public String asString() {
        return type.getPrefix() + ":" + normalizedValue;
    }

    @Override
    public String toString() {
        return asString();
    }
}
