package com.contact.resolution.invalidation;

import com.contact.resolution.cache.CacheConfig;
import com.contact.resolution.cache.EdgeCache;
import com.contact.resolution.cache.InMemoryDistributedCache;
import com.contact.resolution.core.model.CacheKey;
import com.contact.resolution.core.model.CachedMapping;
import com.contact.resolution.core.model.EntityMetadata;
import com.contact.resolution.core.model.LookupType;
import com.contact.resolution.core.model.RecordSource;
import com.contact.resolution.lock.LocalDistributedLock;
import com.contact.resolution.lock.LockConfig;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.metrics.NoOpMetricsService;
import com.contact.resolution.replication.ReplicationConfig;
import com.contact.resolution.replication.ReplicationJob;
import com.contact.resolution.rules.LookupKeyNormalizer;
import com.contact.resolution.store.AuthoritativeStore;
import com.contact.resolution.store.InMemoryAuthoritativeStore;
import com.contact.resolution.store.StorageException;
import com.contact.resolution.support.MutableClock;
import com.contact.resolution.tracing.NoOpTracingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("InvalidationService")
class InvalidationServiceTest {

    private static final CacheKey PHONE = CacheKey.phone("+13365185544");
    private static final CacheKey EMAIL = CacheKey.email("foo@bar.com");

    @Mock
    private MetricsService metrics;

    private final LookupKeyNormalizer normalizer = new LookupKeyNormalizer();
    private final MutableClock clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
    private EdgeCache edge;
    private InMemoryDistributedCache distributed;
    private InMemoryAuthoritativeStore store;
    private InvalidationService service;

    @BeforeEach
    void setUp() {
        edge = new EdgeCache(CacheConfig.defaults());
        distributed = new InMemoryDistributedCache(clock, Duration.ofHours(6));
        store = new InMemoryAuthoritativeStore(clock);
        service = new InvalidationService(normalizer, edge, distributed, store, metrics);
    }

    private void seed(CacheKey key, String canonicalId) {
        store.upsert(key, canonicalId, EntityMetadata.empty(), RecordSource.SYSTEM_OF_RECORD);
        CachedMapping mapping = new CachedMapping(canonicalId, null, 1);
        edge.put(key, mapping);
        distributed.put(key, mapping);
    }

    @Nested
    @DisplayName("Single key")
    class SingleKeyTests {

        @Test
        @DisplayName("Clears every tier and marks the record")
        void clearsEveryTier() {
            seed(PHONE, "entity-1");

            InvalidationOutcome outcome = service.invalidate(LookupType.PHONE, "(336) 518-5544", "merged");

            assertTrue(outcome.invalidated());
            assertTrue(outcome.recordExisted());
            assertEquals(PHONE, outcome.key());
            assertEquals("merged", outcome.reason());
            assertTrue(edge.get(PHONE).isEmpty());
            assertTrue(distributed.get(PHONE).isEmpty());
            assertTrue(store.find(PHONE).orElseThrow().isInvalidated());
            verify(metrics).incrementInvalidation(LookupType.PHONE);
        }

        @Test
        @DisplayName("An unknown key is still cleared and reports no record")
        void unknownKey() {
            InvalidationOutcome outcome = service.invalidate(LookupType.EMAIL, "Foo@Bar.com", null);

            assertTrue(outcome.invalidated());
            assertFalse(outcome.recordExisted());
            assertEquals("unspecified", outcome.reason());
        }

        @Test
        @DisplayName("Input that normalizes to nothing is rejected without touching any tier")
        void emptyKeyRejected() {
            InvalidationOutcome outcome = service.invalidate(LookupType.PHONE, "n/a", "typo");

            assertFalse(outcome.invalidated());
            verifyNoInteractions(metrics);
        }

        @Test
        @DisplayName("A store failure propagates before any cache is touched")
        void storeFailure() {
            AuthoritativeStore failing = mock(AuthoritativeStore.class);
            when(failing.invalidate(eq(PHONE), anyString())).thenThrow(new StorageException("graph down"));
            InvalidationService broken = new InvalidationService(normalizer, edge, distributed, failing, metrics);
            edge.put(PHONE, new CachedMapping("entity-1", null, 1));
            distributed.put(PHONE, new CachedMapping("entity-1", null, 1));

            assertThrows(StorageException.class, () -> broken.invalidate(LookupType.PHONE, "+13365185544", "x"));
            assertTrue(edge.get(PHONE).isPresent());
            assertTrue(distributed.get(PHONE).isPresent());
            verifyNoInteractions(metrics);
        }
    }

    @Nested
    @DisplayName("Racing replication")
    class RacingReplicationTests {

        private ReplicationJob replication;
        private InMemoryAuthoritativeStore racing;

        @BeforeEach
        void setUp() {
            racing = new InMemoryAuthoritativeStore(clock) {
                @Override
                public boolean invalidate(CacheKey key, String reason) {
                    replication.runOnce();
                    return super.invalidate(key, reason);
                }
            };
            replication = new ReplicationJob(racing, distributed, new LocalDistributedLock(LockConfig.singleFlight(600)),
                    ReplicationConfig.defaults(), new NoOpMetricsService(), new NoOpTracingService(), clock);
        }

        @Test
        @DisplayName("A mirror republished just before the record is marked is still cleared")
        void republishedMirrorCleared() {
            racing.upsert(PHONE, "entity-1", EntityMetadata.empty(), RecordSource.SYSTEM_OF_RECORD);
            replication.runOnce();
            clock.advance(Duration.ofHours(7));
            InvalidationService service = new InvalidationService(normalizer, edge, distributed, racing, metrics);

            service.invalidate(LookupType.PHONE, "+13365185544", "merged");

            assertTrue(distributed.get(PHONE).isEmpty());
            assertTrue(racing.findValid(PHONE).isEmpty());
            assertEquals(0, replication.runOnce().orElseThrow().written());
            assertTrue(distributed.get(PHONE).isEmpty());
        }
    }

    @Test
    @DisplayName("Invalidating a canonical id clears every key pointing at it")
    void byCanonicalId() {
        seed(PHONE, "entity-1");
        seed(EMAIL, "entity-1");
        seed(CacheKey.phone("+15550000000"), "entity-2");

        List<InvalidationOutcome> outcomes = service.invalidateCanonicalId("entity-1", "drift-detected");

        assertEquals(2, outcomes.size());
        assertTrue(store.findValid(PHONE).isEmpty());
        assertTrue(store.findValid(EMAIL).isEmpty());
        assertTrue(store.findValid(CacheKey.phone("+15550000000")).isPresent());
    }
}
