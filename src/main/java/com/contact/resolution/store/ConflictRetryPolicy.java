package com.contact.resolution.store;

import java.time.Duration;

/**
 * Bounded retry for compare-and-swap conflicts on a single record.
 * After {@code maxRetries} lost races the store falls back to last-writer-wins.
 *
 * @param maxRetries maximum CAS attempts
 * @param backoff    base delay, multiplied by the attempt number
 */
public record ConflictRetryPolicy(int maxRetries, Duration backoff) {

    public ConflictRetryPolicy {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1");
        }
        if (backoff == null || backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must be >= 0");
        }
    }

    public static ConflictRetryPolicy defaults() {
        return new ConflictRetryPolicy(3, Duration.ofMillis(10));
    }

    /**
     * Sleeps {@code backoff * attempt}. Restores the interrupt flag and returns
     * false if interrupted, so the caller can stop retrying.
     */
    public boolean pause(int attempt) {
        long millis = backoff.toMillis() * attempt;
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
