package com.contact.resolution.api;

import com.contact.resolution.alert.AlertDispatcher;
import com.contact.resolution.alert.AlertSeverity;
import com.contact.resolution.cache.InMemoryDistributedCache;
import com.contact.resolution.core.model.CacheKey;
import com.contact.resolution.core.model.EntityMetadata;
import com.contact.resolution.core.model.LookupType;
import com.contact.resolution.core.model.RecordSource;
import com.contact.resolution.core.model.ResolutionSource;
import com.contact.resolution.core.model.SourceEdit;
import com.contact.resolution.health.HealthCheckResult;
import com.contact.resolution.health.HealthSnapshot;
import com.contact.resolution.health.HealthStatus;
import com.contact.resolution.invalidation.InvalidationOutcome;
import com.contact.resolution.replication.ReplicationStats;
import com.contact.resolution.store.InMemoryAuthoritativeStore;
import com.contact.resolution.support.FakeSystemOfRecord;
import com.contact.resolution.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("ContactResolver")
class ContactResolverTest {

    private static final CacheKey PHONE = CacheKey.phone("+13365185544");

    private final MutableClock clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
    private FakeSystemOfRecord sor;
    private InMemoryAuthoritativeStore store;
    private InMemoryDistributedCache distributed;
    private AlertDispatcher alerts;
    private ContactResolver resolver;

    @BeforeEach
    void setUp() {
        sor = new FakeSystemOfRecord()
                .phone("+13365185544", "entity-123")
                .email("foo@bar.com", "entity-123")
                .metadata("entity-123", "m-123", "Ada Lovelace");
        store = new InMemoryAuthoritativeStore(clock);
        distributed = new InMemoryDistributedCache(clock, Duration.ofHours(6));
        alerts = mock(AlertDispatcher.class);
        resolver = ContactResolver.builder()
                .systemOfRecord(sor)
                .authoritativeStore(store)
                .distributedCache(distributed)
                .alertDispatcher(alerts)
                .clock(clock)
                .build();
    }

    @AfterEach
    void tearDown() {
        resolver.close();
    }

    private void awaitMirrored(CacheKey key) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (store.find(key).map(record -> record.getReplicatedVersion() < 1).orElse(true)) {
            assertTrue(System.nanoTime() < deadline, "propagation did not complete for " + key);
            Thread.sleep(5);
        }
    }

    @Test
    @DisplayName("Requires a system of record")
    void requiresSystemOfRecord() {
        assertThrows(IllegalStateException.class, () -> ContactResolver.builder().build());
    }

    @Nested
    @DisplayName("Lookups")
    class LookupTests {

        @Test
        @DisplayName("Resolves through the system of record, then from cache")
        void resolves() {
            ResolutionResult first = resolver.resolve("+1 (336) 518-5544", LookupType.PHONE);
            ResolutionResult second = resolver.resolve("3365185544", LookupType.PHONE);

            assertEquals("entity-123", first.canonicalId());
            assertEquals(ResolutionSource.SYSTEM_OF_RECORD, first.source());
            assertEquals(ResolutionSource.EDGE, second.source());
            assertEquals(1, sor.lookupCount());
            assertEquals(1, resolver.statistics().count(ResolutionSource.EDGE));
        }

        @Test
        @DisplayName("Invalidation sends the next lookup back to the system of record")
        void invalidate() throws Exception {
            resolver.resolve("foo@bar.com", LookupType.EMAIL);
            awaitMirrored(CacheKey.email("foo@bar.com"));

            InvalidationOutcome outcome = resolver.invalidate(LookupType.EMAIL, " FOO@bar.com", "merged");

            assertTrue(outcome.recordExisted());
            assertEquals(ResolutionSource.SYSTEM_OF_RECORD,
                    resolver.resolve("foo@bar.com", LookupType.EMAIL).source());
            assertEquals(2, sor.lookupCount());
        }

        @Test
        @DisplayName("Invalidating a canonical id covers phone and email keys")
        void invalidateCanonicalId() throws Exception {
            resolver.resolve("+13365185544", LookupType.PHONE);
            resolver.resolve("foo@bar.com", LookupType.EMAIL);
            awaitMirrored(PHONE);
            awaitMirrored(CacheKey.email("foo@bar.com"));

            List<InvalidationOutcome> outcomes = resolver.invalidateCanonicalId("entity-123", "merged");

            assertEquals(2, outcomes.size());
            assertTrue(store.findValid(PHONE).isEmpty());
        }

        @Test
        @DisplayName("Warm-up makes lookups hit without the system of record")
        void warmUp() {
            assertEquals(1, resolver.warmUp(List.of(
                    new WarmUpMapping(LookupType.PHONE, "+1 555 000 0000", "entity-9", "m-9"))));

            assertEquals("entity-9", resolver.resolve("5550000000", LookupType.PHONE).canonicalId());
            assertEquals(0, sor.lookupCount());
        }
    }

    @Nested
    @DisplayName("Jobs")
    class JobTests {

        @Test
        @DisplayName("Replication publishes unmirrored records once")
        void replicate() {
            store.upsert(PHONE, "entity-123", EntityMetadata.empty(), RecordSource.REPLICATED);

            ReplicationStats first = resolver.replicate().orElseThrow();
            ReplicationStats second = resolver.replicate().orElseThrow();

            assertEquals(1, first.written());
            assertEquals(0, second.selected());
            assertEquals("entity-123", distributed.get(PHONE).orElseThrow().canonicalId());
        }

        @Test
        @DisplayName("Health checks alert on drift and keep history")
        void healthChecks() {
            store.upsert(PHONE, "entity-123", new EntityMetadata("m-123", null), RecordSource.SYSTEM_OF_RECORD);
            resolver.replicate();
            sor.edited(new SourceEdit("entity-123", Instant.parse("2024-03-01T13:00:00Z")));

            HealthSnapshot snapshot = resolver.runHealthChecks().orElseThrow();

            assertEquals(HealthStatus.Status.CRITICAL, snapshot.status());
            assertEquals(List.of("source-drift", "identity-coverage", "tier-staleness"),
                    snapshot.checks().stream().map(HealthCheckResult::name).toList());
            assertNotNull(snapshot.performance());
            assertEquals(1, snapshot.performance().store().active());
            assertEquals(1, snapshot.performance().lastReplication().written());
            verify(alerts).send(eq(AlertSeverity.CRITICAL), contains("source-drift"), anyMap());
            assertEquals(snapshot, resolver.getHealthSnapshot());
            assertEquals(1, resolver.healthHistory().size());
        }

        @Test
        @DisplayName("Snapshot before the first run is evaluated once without alerting")
        void snapshotBeforeFirstRun() {
            HealthSnapshot snapshot = resolver.getHealthSnapshot();

            assertEquals(HealthStatus.Status.OK, snapshot.status());
            assertSame(snapshot, resolver.getHealthSnapshot());
            assertTrue(resolver.healthHistory().isEmpty());
            verifyNoInteractions(alerts);
        }

        @Test
        @DisplayName("start() is idempotent and close() stops the jobs")
        void startAndClose() {
            resolver.start();
            resolver.start();
            resolver.close();

            assertDoesNotThrow(resolver::close);
        }
    }
}
