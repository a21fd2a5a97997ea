package com.contact.resolution.support;

import com.contact.resolution.core.model.EntityMetadata;
import com.contact.resolution.core.model.SourceEdit;
import com.contact.resolution.source.SystemOfRecord;
import com.contact.resolution.source.SystemOfRecordException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable in-memory system of record that counts lookups.
 */
public class FakeSystemOfRecord implements SystemOfRecord {

    private final Map<String, String> phones = new ConcurrentHashMap<>();
    private final Map<String, String> emails = new ConcurrentHashMap<>();
    private final Map<String, EntityMetadata> metadata = new ConcurrentHashMap<>();
    private final List<SourceEdit> recentEdits = new ArrayList<>();
    private final AtomicInteger lookups = new AtomicInteger();
    private final AtomicInteger recentCalls = new AtomicInteger();
    private volatile Duration delay = Duration.ZERO;
    private volatile RuntimeException failure;
    private volatile RuntimeException metadataFailure;
    private volatile RuntimeException recentFailure;
    private volatile CountDownLatch gate;

    public FakeSystemOfRecord phone(String normalizedPhone, String canonicalId) {
        phones.put(normalizedPhone, canonicalId);
        return this;
    }

    public FakeSystemOfRecord email(String normalizedEmail, String canonicalId) {
        emails.put(normalizedEmail, canonicalId);
        return this;
    }

    public FakeSystemOfRecord metadata(String canonicalId, String entityId, String displayName) {
        metadata.put(canonicalId, new EntityMetadata(entityId, displayName));
        return this;
    }

    public synchronized FakeSystemOfRecord edited(SourceEdit edit) {
        recentEdits.add(edit);
        return this;
    }

    public FakeSystemOfRecord delay(Duration delay) {
        this.delay = delay;
        return this;
    }

    public FakeSystemOfRecord failWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    public FakeSystemOfRecord failMetadataWith(RuntimeException failure) {
        this.metadataFailure = failure;
        return this;
    }

    public FakeSystemOfRecord failRecentWith(RuntimeException failure) {
        this.recentFailure = failure;
        return this;
    }

    /**
     * Holds every lookup until the latch opens.
     */
    public FakeSystemOfRecord gate(CountDownLatch gate) {
        this.gate = gate;
        return this;
    }

    public int lookupCount() {
        return lookups.get();
    }

    public int recentlyEditedCount() {
        return recentCalls.get();
    }

    @Override
    public Optional<String> lookupByPhone(String normalizedPhone) {
        return lookup(phones, normalizedPhone);
    }

    @Override
    public Optional<String> lookupByEmail(String normalizedEmail) {
        return lookup(emails, normalizedEmail);
    }

    private Optional<String> lookup(Map<String, String> mappings, String value) {
        lookups.incrementAndGet();
        awaitGate();
        pause();
        if (failure != null) {
            throw failure;
        }
        return Optional.ofNullable(mappings.get(value));
    }

    @Override
    public EntityMetadata getEntityMetadata(String canonicalId) {
        if (metadataFailure != null) {
            throw metadataFailure;
        }
        return metadata.getOrDefault(canonicalId, EntityMetadata.empty());
    }

    @Override
    public synchronized List<SourceEdit> recentlyEdited(int limit) {
        recentCalls.incrementAndGet();
        if (recentFailure != null) {
            throw recentFailure;
        }
        return List.copyOf(recentEdits.subList(0, Math.min(limit, recentEdits.size())));
    }

    @Override
    public String getName() {
        return "fake";
    }

    private void awaitGate() {
        CountDownLatch current = gate;
        if (current == null) {
            return;
        }
        try {
            if (!current.await(5, TimeUnit.SECONDS)) {
                throw new SystemOfRecordException("gate never opened");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SystemOfRecordException("interrupted at gate", e);
        }
    }

    private void pause() {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SystemOfRecordException("interrupted", e);
        }
    }
}
