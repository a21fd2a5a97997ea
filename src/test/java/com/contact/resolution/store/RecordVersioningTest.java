package com.contact.resolution.store;

import com.contact.resolution.core.model.CacheKey;
import com.contact.resolution.core.model.CacheRecord;
import com.contact.resolution.core.model.EntityMetadata;
import com.contact.resolution.core.model.RecordSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecordVersioning")
class RecordVersioningTest {

    private static final CacheKey KEY = CacheKey.phone("+13365185544");
    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");
    private static final Instant T1 = Instant.parse("2024-03-01T13:00:00Z");

    private static CacheRecord created() {
        return RecordVersioning.next(null, KEY, "entity-1", new EntityMetadata("m-1", "Ada"),
                RecordSource.SYSTEM_OF_RECORD, T0).record();
    }

    @Nested
    @DisplayName("Creation")
    class CreationTests {

        @Test
        @DisplayName("First write creates version 1 with verification set")
        void firstWrite() {
            UpsertResult result = RecordVersioning.next(null, KEY, "entity-1",
                    new EntityMetadata("m-1", "Ada"), RecordSource.SYSTEM_OF_RECORD, T0);

            assertEquals(UpsertOutcome.CREATED, result.outcome());
            assertTrue(result.versionChanged());
            CacheRecord record = result.record();
            assertEquals(1, record.getVersion());
            assertEquals("m-1", record.getEntityId());
            assertEquals(T0, record.getCachedAt());
            assertEquals(T0, record.getLastVerifiedAt());
            assertEquals(0, record.getReplicatedVersion());
            assertTrue(record.isMirrorStale(T0));
        }

        @Test
        @DisplayName("Blank canonical id is rejected")
        void blankCanonicalId() {
            assertThrows(IllegalArgumentException.class, () -> RecordVersioning.next(null, KEY, " ",
                    EntityMetadata.empty(), RecordSource.SYSTEM_OF_RECORD, T0));
        }
    }

    @Nested
    @DisplayName("Updates")
    class UpdateTests {

        @Test
        @DisplayName("Same canonical id keeps the version and refreshes verification")
        void sameIdKeepsVersion() {
            UpsertResult result = RecordVersioning.next(created(), KEY, "entity-1",
                    EntityMetadata.empty(), RecordSource.SYSTEM_OF_RECORD, T1);

            assertEquals(UpsertOutcome.UNCHANGED, result.outcome());
            assertFalse(result.versionChanged());
            assertEquals(1, result.record().getVersion());
            assertEquals(T1, result.record().getLastVerifiedAt());
            assertEquals(T0, result.record().getCachedAt());
            assertEquals("m-1", result.record().getEntityId(), "known entity id survives empty metadata");
            assertEquals(2, result.record().getHitCount());
        }

        @Test
        @DisplayName("A different canonical id increments the version by exactly one")
        void differentIdBumps() {
            UpsertResult result = RecordVersioning.next(created(), KEY, "entity-2",
                    new EntityMetadata(null, null), RecordSource.SYSTEM_OF_RECORD, T1);

            assertEquals(UpsertOutcome.VERSION_BUMPED, result.outcome());
            assertEquals(2, result.record().getVersion());
            assertEquals("entity-2", result.record().getCanonicalId());
            assertNull(result.record().getEntityId());
        }

        @Test
        @DisplayName("Confirming an invalidated record revives it without a version change")
        void revivesInvalidated() {
            CacheRecord invalidated = created().toBuilder().invalidatedAt(T0).clearReplication().build();

            UpsertResult result = RecordVersioning.next(invalidated, KEY, "entity-1",
                    EntityMetadata.empty(), RecordSource.SYSTEM_OF_RECORD, T1);

            assertEquals(UpsertOutcome.REFRESHED, result.outcome());
            assertFalse(result.record().isInvalidated());
            assertEquals(1, result.record().getVersion());
        }

        @Test
        @DisplayName("A changed id on an invalidated record bumps and revives")
        void bumpsInvalidated() {
            CacheRecord invalidated = created().toBuilder().invalidatedAt(T0).build();

            UpsertResult result = RecordVersioning.next(invalidated, KEY, "entity-9",
                    EntityMetadata.empty(), RecordSource.SYSTEM_OF_RECORD, T1);

            assertEquals(UpsertOutcome.VERSION_BUMPED, result.outcome());
            assertEquals(2, result.record().getVersion());
            assertFalse(result.record().isInvalidated());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("A stored version below 1 is corrupt")
        void versionZeroIsCorrupt() {
            CacheRecord corrupt = created().toBuilder().version(0).build();

            CorruptRecordException e = assertThrows(CorruptRecordException.class,
                    () -> RecordVersioning.next(corrupt, KEY, "entity-1", EntityMetadata.empty(),
                            RecordSource.SYSTEM_OF_RECORD, T1));
            assertEquals(KEY, e.getKey());
        }

        @Test
        @DisplayName("A blank stored canonical id is corrupt")
        void blankStoredIdIsCorrupt() {
            CacheRecord corrupt = created().toBuilder().canonicalId("").build();

            assertThrows(CorruptRecordException.class, () -> RecordVersioning.requireValid(corrupt));
        }
    }
}
