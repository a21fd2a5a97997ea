package com.contact.resolution.lock;

import com.contact.resolution.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * FalkorDB MERGE-based lease for multi-node single-flight jobs.
 *
 * <p>Uses a {@code :Lock} node with atomic MERGE for check-and-set semantics.
 * An expired lease (epoch millis in {@code expiresAt}) is taken over by the next caller,
 * so a node that dies mid-run blocks others for at most the configured TTL.</p>
 *
 * <p>Each acquisition writes its own lease token, so two threads on the same node
 * exclude each other as well.</p>
 */
public class GraphDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(GraphDistributedLock.class);

    private final GraphConnection connection;
    private final LockConfig config;
    private final Clock clock;
    private final String ownerId;
    private final AtomicLong leaseCounter = new AtomicLong();
    private final Map<String, String> heldLeases = new ConcurrentHashMap<>();

    public GraphDistributedLock(GraphConnection connection) {
        this(connection, LockConfig.defaults(), Clock.systemUTC());
    }

    public GraphDistributedLock(GraphConnection connection, LockConfig config, Clock clock) {
        this.connection = connection;
        this.config = config;
        this.clock = clock;
        this.ownerId = generateOwnerId();
    }

    @Override
    public boolean tryLock(String key) {
        String token = ownerId + ":" + leaseCounter.incrementAndGet();
        for (int attempt = 0; attempt <= config.maxRetries(); attempt++) {
            if (!heldLeases.containsKey(key) && attemptLock(key, token)) {
                heldLeases.put(key, token);
                log.debug("lock.acquired key={} owner={} attempt={}", key, token, attempt + 1);
                return true;
            }
            if (attempt < config.maxRetries()) {
                try {
                    Thread.sleep(config.retryDelayMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new LockAcquisitionException(key, "Interrupted while waiting for lease", e);
                }
            }
        }
        log.debug("lock.busy key={} attempts={}", key, config.maxRetries() + 1);
        return false;
    }

    @Override
    public void unlock(String key) {
        String token = heldLeases.remove(key);
        if (token == null) {
            return;
        }
        String query = """
                MATCH (l:Lock {key: $key, owner: $owner})
                DELETE l
                """;
        try {
            connection.execute(query, Map.of("key", key, "owner", token));
            log.debug("lock.released key={}", key);
        } catch (Exception e) {
            log.warn("lock.release.failed key={} error={}", key, e.getMessage());
        }
    }

    private boolean attemptLock(String key, String token) {
        long now = clock.millis();
        long expiresAt = now + config.lockTtlSeconds() * 1000L;

        String query = """
                MERGE (l:Lock {key: $key})
                ON CREATE SET l.owner = $owner, l.acquiredAt = $now, l.expiresAt = $expiresAt
                ON MATCH SET l.owner = CASE
                    WHEN l.expiresAt < $now THEN $owner
                    ELSE l.owner
                END,
                l.acquiredAt = CASE
                    WHEN l.expiresAt < $now THEN $now
                    ELSE l.acquiredAt
                END,
                l.expiresAt = CASE
                    WHEN l.expiresAt < $now THEN $expiresAt
                    ELSE l.expiresAt
                END
                RETURN l.owner AS owner
                """;

        try {
            List<Map<String, Object>> results = connection.query(query, Map.of(
                    "key", key,
                    "owner", token,
                    "now", now,
                    "expiresAt", expiresAt
            ));
            return !results.isEmpty() && token.equals(results.get(0).get("owner"));
        } catch (Exception e) {
            log.warn("lock.attempt.failed key={} error={}", key, e.getMessage());
            return false;
        }
    }

    public String getOwnerId() {
        return ownerId;
    }

    private static String generateOwnerId() {
        return ProcessHandle.current().pid() + "-" + Thread.currentThread().getId()
                + "-" + System.nanoTime();
    }
}
