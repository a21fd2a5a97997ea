package com.contact.resolution.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process lock using {@link ReentrantLock}. Suitable for single-JVM deployments.
 * The lock must be released by the thread that acquired it.
 */
public class LocalDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalDistributedLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalDistributedLock() {
        this(LockConfig.defaults());
    }

    public LocalDistributedLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String key) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        try {
            boolean acquired = lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS);
            if (acquired) {
                log.debug("lock.acquired key={}", key);
            } else {
                log.debug("lock.busy key={} waitedMs={}", key, config.timeoutMs());
            }
            return acquired;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException(key, "Interrupted while waiting for lease", e);
        }
    }

    @Override
    public void unlock(String key) {
        ReentrantLock lock = locks.get(key);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("lock.released key={}", key);
        }
    }
}
