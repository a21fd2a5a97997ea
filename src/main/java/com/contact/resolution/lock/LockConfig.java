package com.contact.resolution.lock;

/**
 * Configuration for distributed lock implementations.
 *
 * @param timeoutMs      maximum time to wait for an in-process lock
 * @param maxRetries     extra attempts after the first for graph leases
 * @param retryDelayMs   delay between graph lease attempts
 * @param lockTtlSeconds lease lifetime, after which a crashed holder's lock is reclaimed
 */
public record LockConfig(long timeoutMs, int maxRetries, long retryDelayMs, int lockTtlSeconds) {

    public LockConfig {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be >= 0");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (retryDelayMs <= 0) {
            throw new IllegalArgumentException("retryDelayMs must be > 0");
        }
        if (lockTtlSeconds <= 0) {
            throw new IllegalArgumentException("lockTtlSeconds must be > 0");
        }
    }

    /**
     * Default configuration: 5s timeout, 3 retries, 100ms delay, 30s TTL.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000, 3, 100, 30);
    }

    /**
     * Single attempt, no waiting. Used for job leases, where an overlapping run
     * should be skipped rather than queued.
     *
     * @param leaseSeconds how long a lease survives a crashed holder
     */
    public static LockConfig singleFlight(int leaseSeconds) {
        return new LockConfig(0, 0, 100, leaseSeconds);
    }
}
