package com.contact.resolution.lock;

/**
 * Lease used to keep periodic jobs single-flight, within one JVM or across nodes.
 */
public interface DistributedLock {

    /**
     * Attempts to acquire the lock, waiting at most as long as the implementation's
     * {@link LockConfig} allows.
     *
     * @param key the lock key, e.g. {@code job:replication}
     * @return true if acquired, false if another holder kept it
     * @throws LockAcquisitionException if interrupted while waiting
     */
    boolean tryLock(String key);

    /**
     * Releases a lock held by this owner. Releasing a lock not held is a no-op.
     */
    void unlock(String key);
}
