package com.contact.resolution.lock;

import com.contact.resolution.graph.GraphConnection;
import com.contact.resolution.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DistributedLockTest {

    @Nested
    @DisplayName("LocalDistributedLock")
    class LocalLockTests {

        @Test
        @DisplayName("Should acquire and release lock")
        void testAcquireRelease() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertTrue(lock.tryLock("job:replication"));
            assertDoesNotThrow(() -> lock.unlock("job:replication"));
        }

        @Test
        @DisplayName("Should allow different keys concurrently")
        void testDifferentKeys() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertTrue(lock.tryLock("job:replication"));
            assertTrue(lock.tryLock("job:drift"));
            lock.unlock("job:replication");
            lock.unlock("job:drift");
        }

        @Test
        @DisplayName("Single-flight config fails fast when another thread holds the key")
        void testSingleFlight() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock(LockConfig.singleFlight(60));
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Thread holder = new Thread(() -> {
                lock.tryLock("job:drift");
                held.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    lock.unlock("job:drift");
                }
            });
            holder.start();
            assertTrue(held.await(5, TimeUnit.SECONDS));

            long start = System.nanoTime();
            assertFalse(lock.tryLock("job:drift"));
            assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 1_000);

            release.countDown();
            holder.join(5_000);
            assertTrue(lock.tryLock("job:drift"));
            lock.unlock("job:drift");
        }

        @Test
        @DisplayName("Should block concurrent access to same key")
        void testConcurrentBlocking() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock(new LockConfig(2000, 0, 100, 30));
            AtomicInteger concurrentCount = new AtomicInteger(0);
            AtomicInteger maxConcurrent = new AtomicInteger(0);

            int threadCount = 5;
            ExecutorService pool = Executors.newFixedThreadPool(threadCount);
            CountDownLatch startLatch = new CountDownLatch(1);
            CountDownLatch doneLatch = new CountDownLatch(threadCount);

            for (int i = 0; i < threadCount; i++) {
                pool.execute(() -> {
                    try {
                        startLatch.await();
                        if (lock.tryLock("job:replication")) {
                            try {
                                int current = concurrentCount.incrementAndGet();
                                maxConcurrent.accumulateAndGet(current, Math::max);
                                Thread.sleep(10);
                                concurrentCount.decrementAndGet();
                            } finally {
                                lock.unlock("job:replication");
                            }
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        doneLatch.countDown();
                    }
                });
            }

            startLatch.countDown();
            assertTrue(doneLatch.await(10, TimeUnit.SECONDS));
            pool.shutdownNow();
            assertEquals(1, maxConcurrent.get());
        }

        @Test
        @DisplayName("An interrupted wait fails with the lease key")
        void testInterruptedWait() {
            LocalDistributedLock lock = new LocalDistributedLock();
            Thread.currentThread().interrupt();
            try {
                LockAcquisitionException e = assertThrows(LockAcquisitionException.class,
                        () -> lock.tryLock("job:drift"));
                assertEquals("job:drift", e.getLockKey());
                assertTrue(Thread.currentThread().isInterrupted());
            } finally {
                Thread.interrupted();
            }
        }

        @Test
        @DisplayName("Unlocking a key not held is a no-op")
        void testUnlockNotHeld() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertDoesNotThrow(() -> lock.unlock("never-locked"));
        }
    }

    @Nested
    @DisplayName("GraphDistributedLock")
    class GraphLockTests {

        private final MutableClock clock = MutableClock.startingAt("2024-03-01T12:00:00Z");

        /**
         * Answers lease queries the way the MERGE does: the first owner keeps the node.
         */
        private GraphConnection leaseGraph() {
            GraphConnection connection = mock(GraphConnection.class);
            ConcurrentHashMap<String, String> owners = new ConcurrentHashMap<>();
            when(connection.query(contains("MERGE (l:Lock"), anyMap())).thenAnswer(invocation -> {
                Map<String, Object> params = invocation.getArgument(1);
                String owner = owners.computeIfAbsent((String) params.get("key"),
                        k -> (String) params.get("owner"));
                return List.of(Map.of("owner", owner));
            });
            doAnswer(invocation -> {
                Map<String, Object> params = invocation.getArgument(1);
                owners.remove((String) params.get("key"), (String) params.get("owner"));
                return null;
            }).when(connection).execute(contains("DELETE l"), anyMap());
            return connection;
        }

        @Test
        @DisplayName("Acquires, refuses a second holder, and releases with its own token")
        void acquireAndRelease() {
            GraphConnection connection = leaseGraph();
            GraphDistributedLock nodeA = new GraphDistributedLock(connection, LockConfig.singleFlight(600), clock);
            GraphDistributedLock nodeB = new GraphDistributedLock(connection, LockConfig.singleFlight(600), clock);

            assertTrue(nodeA.tryLock("job:replication"));
            assertFalse(nodeB.tryLock("job:replication"));
            assertFalse(nodeA.tryLock("job:replication"), "a second acquisition on the same node is refused");

            nodeA.unlock("job:replication");
            assertTrue(nodeB.tryLock("job:replication"));
        }

        @Test
        @DisplayName("Writes a lease that expires after the configured TTL")
        void leaseExpiry() {
            GraphConnection connection = leaseGraph();
            GraphDistributedLock lock = new GraphDistributedLock(connection, LockConfig.singleFlight(600), clock);

            lock.tryLock("job:drift");

            @SuppressWarnings("unchecked")
            ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
            verify(connection).query(contains("MERGE (l:Lock"), params.capture());
            assertEquals(clock.millis(), params.getValue().get("now"));
            assertEquals(clock.millis() + 600_000L, params.getValue().get("expiresAt"));
            assertTrue(((String) params.getValue().get("owner")).startsWith(lock.getOwnerId() + ":"));
        }

        @Test
        @DisplayName("A failing graph is treated as a busy lease")
        void graphFailure() {
            GraphConnection connection = mock(GraphConnection.class);
            when(connection.query(anyString(), anyMap())).thenThrow(new IllegalStateException("down"));
            GraphDistributedLock lock = new GraphDistributedLock(connection, LockConfig.singleFlight(600), clock);

            assertFalse(lock.tryLock("job:drift"));
            lock.unlock("job:drift");
            verify(connection, never()).execute(anyString(), anyMap());
        }
    }

    @Test
    @DisplayName("LockConfig validates its fields")
    void configValidation() {
        assertThrows(IllegalArgumentException.class, () -> new LockConfig(-1, 0, 100, 30));
        assertThrows(IllegalArgumentException.class, () -> new LockConfig(0, 0, 0, 30));
        assertThrows(IllegalArgumentException.class, () -> LockConfig.singleFlight(0));
        assertEquals(0, LockConfig.singleFlight(600).maxRetries());
    }
}
