package com.contact.resolution.cache;

/**
 * Thrown when a cache tier cannot be reached. Transient: callers fall through
 * to the next tier instead of failing the lookup.
 */
public class TierUnavailableException extends RuntimeException {

    private final String tier;

    public TierUnavailableException(String tier, String message) {
        super(message);
        this.tier = tier;
    }

    public TierUnavailableException(String tier, String message, Throwable cause) {
        super(message, cause);
        this.tier = tier;
    }

    public String getTier() {
        return tier;
    }
}
