package com.contact.resolution.store;

import com.contact.resolution.core.model.CacheKey;
import com.contact.resolution.core.model.CacheRecord;
import com.contact.resolution.core.model.EntityMetadata;
import com.contact.resolution.core.model.LookupType;
import com.contact.resolution.core.model.RecordSource;
import com.contact.resolution.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryAuthoritativeStore")
class InMemoryAuthoritativeStoreTest {

    private static final CacheKey PHONE = CacheKey.phone("+13365185544");
    private static final CacheKey EMAIL = CacheKey.email("foo@bar.com");

    private MutableClock clock;
    private InMemoryAuthoritativeStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
        store = new InMemoryAuthoritativeStore(clock);
    }

    private UpsertResult upsert(CacheKey key, String canonicalId) {
        return store.upsert(key, canonicalId, new EntityMetadata("m-" + canonicalId, null),
                RecordSource.SYSTEM_OF_RECORD);
    }

    @Nested
    @DisplayName("Upsert")
    class UpsertTests {

        @Test
        @DisplayName("Version only moves when the canonical id changes")
        void versionMonotonic() {
            assertEquals(1, upsert(PHONE, "entity-1").record().getVersion());
            assertEquals(1, upsert(PHONE, "entity-1").record().getVersion());
            assertEquals(2, upsert(PHONE, "entity-2").record().getVersion());
            assertEquals(3, upsert(PHONE, "entity-1").record().getVersion());
        }

        @Test
        @DisplayName("Empty key is rejected")
        void emptyKeyRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> upsert(CacheKey.empty(LookupType.PHONE), "entity-1"));
        }

        @Test
        @DisplayName("Concurrent first writes of the same id leave one record at version 1")
        void concurrentFirstWrites() throws Exception {
            int writers = 8;
            ExecutorService pool = Executors.newFixedThreadPool(writers);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<UpsertResult>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < writers; i++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        return upsert(PHONE, "entity-1");
                    }));
                }
                start.countDown();
                long created = 0;
                for (Future<UpsertResult> future : futures) {
                    if (future.get(5, TimeUnit.SECONDS).outcome() == UpsertOutcome.CREATED) {
                        created++;
                    }
                }
                assertEquals(1, created);
            } finally {
                pool.shutdownNow();
            }

            assertEquals(1, store.size());
            CacheRecord record = store.find(PHONE).orElseThrow();
            assertEquals(1, record.getVersion());
            assertEquals(writers, record.getHitCount());
        }
    }

    @Nested
    @DisplayName("Invalidation")
    class InvalidationTests {

        @Test
        @DisplayName("Invalidated records are hidden from valid reads but kept")
        void hiddenButKept() {
            upsert(PHONE, "entity-1");

            assertTrue(store.invalidate(PHONE, "test"));

            assertTrue(store.findValid(PHONE).isEmpty());
            assertTrue(store.get(PHONE).isEmpty());
            CacheRecord record = store.find(PHONE).orElseThrow();
            assertTrue(record.isInvalidated());
            assertEquals(0, record.getReplicatedVersion());
        }

        @Test
        @DisplayName("Invalidating an unknown key reports no record")
        void unknownKey() {
            assertFalse(store.invalidate(EMAIL, "test"));
        }

        @Test
        @DisplayName("A later upsert revives the record")
        void upsertRevives() {
            upsert(PHONE, "entity-1");
            store.invalidate(PHONE, "test");

            UpsertResult result = upsert(PHONE, "entity-1");

            assertEquals(UpsertOutcome.REFRESHED, result.outcome());
            assertTrue(store.findValid(PHONE).isPresent());
        }
    }

    @Nested
    @DisplayName("Replication bookkeeping")
    class ReplicationTests {

        @Test
        @DisplayName("New records are stale; marked records are not until their TTL lapses")
        void staleness() {
            upsert(PHONE, "entity-1");
            assertEquals(1, store.findStaleForReplication(clock.instant(), 10).size());

            assertTrue(store.markReplicated(PHONE, 1, clock.instant(), Duration.ofHours(1)));
            assertTrue(store.findStaleForReplication(clock.instant(), 10).isEmpty());

            clock.advance(Duration.ofHours(2));
            assertEquals(1, store.findStaleForReplication(clock.instant(), 10).size());
        }

        @Test
        @DisplayName("A version bump makes the mirror stale again")
        void bumpMakesStale() {
            upsert(PHONE, "entity-1");
            store.markReplicated(PHONE, 1, clock.instant(), Duration.ofHours(1));

            upsert(PHONE, "entity-2");

            List<CacheRecord> stale = store.findStaleForReplication(clock.instant(), 10);
            assertEquals(1, stale.size());
            assertEquals(2, stale.get(0).getVersion());
        }

        @Test
        @DisplayName("Marking is refused for invalidated records and future versions")
        void markRefused() {
            upsert(PHONE, "entity-1");
            assertFalse(store.markReplicated(PHONE, 2, clock.instant(), Duration.ofHours(1)));

            store.invalidate(PHONE, "test");
            assertFalse(store.markReplicated(PHONE, 1, clock.instant(), Duration.ofHours(1)));
            assertFalse(store.markReplicated(EMAIL, 1, clock.instant(), Duration.ofHours(1)));
        }

        @Test
        @DisplayName("Stale rows come back most recently verified first, bounded by the limit")
        void orderingAndLimit() {
            upsert(PHONE, "entity-1");
            clock.advance(Duration.ofMinutes(1));
            upsert(EMAIL, "entity-2");

            List<CacheRecord> stale = store.findStaleForReplication(clock.instant(), 1);

            assertEquals(1, stale.size());
            assertEquals(EMAIL, stale.get(0).getKey());
        }
    }

    @Nested
    @DisplayName("Queries")
    class QueryTests {

        @Test
        @DisplayName("Finds every key pointing at a canonical id")
        void findByCanonicalId() {
            upsert(PHONE, "entity-1");
            upsert(EMAIL, "entity-1");
            upsert(CacheKey.phone("+15550000000"), "entity-2");

            assertEquals(2, store.findByCanonicalId("entity-1").size());
        }

        @Test
        @DisplayName("Statistics count active, invalidated and missing entity ids")
        void statistics() {
            upsert(PHONE, "entity-1");
            store.upsert(EMAIL, "entity-2", EntityMetadata.empty(), RecordSource.SYSTEM_OF_RECORD);
            store.upsert(CacheKey.phone("+15550000000"), "entity-3", EntityMetadata.empty(),
                    RecordSource.SYSTEM_OF_RECORD);
            store.invalidate(CacheKey.phone("+15550000000"), "test");

            StoreStatistics stats = store.statistics(clock.instant());

            assertEquals(3, stats.total());
            assertEquals(2, stats.active());
            assertEquals(1, stats.invalidated());
            assertEquals(1, stats.missingEntityId());
            assertEquals(2, stats.staleMirror());
            assertEquals(0.5, stats.missingEntityIdRatio(), 1e-9);
        }

        @Test
        @DisplayName("Recording a hit bumps the counter and verification time")
        void recordHit() {
            upsert(PHONE, "entity-1");
            clock.advance(Duration.ofMinutes(5));

            assertTrue(store.recordHit(PHONE));

            CacheRecord record = store.find(PHONE).orElseThrow();
            assertEquals(2, record.getHitCount());
            assertEquals(clock.instant(), record.getLastVerifiedAt());
            assertFalse(store.recordHit(EMAIL));
        }
    }
}
