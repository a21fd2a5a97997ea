package com.contact.resolution.lock;

/**
 * Thrown when waiting for a job lease is interrupted or the lease store cannot be reached.
 * A lease that is simply held elsewhere is not an error; {@link DistributedLock#tryLock}
 * returns false for that.
 */
public class LockAcquisitionException extends RuntimeException {

    private final String lockKey;

    public LockAcquisitionException(String lockKey, String message, Throwable cause) {
        super(message + " [lock=" + lockKey + "]", cause);
        this.lockKey = lockKey;
    }

    public String getLockKey() {
        return lockKey;
    }
}
