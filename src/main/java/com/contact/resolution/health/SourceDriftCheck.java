package com.contact.resolution.health;

import com.contact.resolution.core.model.CacheRecord;
import com.contact.resolution.core.model.SourceEdit;
import com.contact.resolution.source.SystemOfRecord;
import com.contact.resolution.store.AuthoritativeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compares recently edited entities in the system of record with the authoritative store.
 *
 * <p>If sampling itself fails the check reports WARNING, since drift could not be verified.
 * The check keeps no state between runs: the drift ratio and the out-of-sync canonical ids
 * travel in the returned status and are read back with {@link #ratioOf} and
 * {@link #outOfSyncOf}.</p>
 */
public class SourceDriftCheck implements HealthCheck {
    private static final Logger log = LoggerFactory.getLogger(SourceDriftCheck.class);

    static final String NAME = "source-drift";
    static final String RATIO = "ratio";
    static final String OUT_OF_SYNC_IDS = "outOfSyncIds";
    private static final int REPORTED_SAMPLES = 5;

    private final SystemOfRecord systemOfRecord;
    private final AuthoritativeStore store;
    private final DriftConfig config;

    public SourceDriftCheck(SystemOfRecord systemOfRecord, AuthoritativeStore store, DriftConfig config) {
        this.systemOfRecord = systemOfRecord;
        this.store = store;
        this.config = config;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public HealthStatus check() {
        List<DriftSample> samples;
        try {
            samples = sample();
        } catch (RuntimeException e) {
            log.warn("drift.sample.failed error={}", e.getMessage());
            return HealthStatus.warning("Unable to verify store against " + systemOfRecord.getName())
                    .withDetail("error", String.valueOf(e.getMessage()));
        }

        List<DriftSample> drifted = samples.stream().filter(DriftSample::isOutOfSync).toList();
        double ratio = samples.isEmpty() ? 0.0 : (double) drifted.size() / samples.size();
        HealthStatus.Status status = classify(ratio);

        String message = drifted.isEmpty()
                ? "Store is in sync with the system of record"
                : drifted.size() + " of " + samples.size() + " sampled entities out of sync";
        log.info("drift.evaluated sampled={} outOfSync={} ratio={}", samples.size(), drifted.size(), ratio);

        return new HealthStatus(status, message, Map.of())
                .withDetail("sampled", samples.size())
                .withDetail("outOfSync", drifted.size())
                .withDetail(RATIO, ratio)
                .withDetail("samples", describe(drifted))
                .withDetail(OUT_OF_SYNC_IDS, drifted.stream().map(DriftSample::canonicalId).toList());
    }

    /**
     * Drift ratio carried by a status this check returned, 0 if nothing was sampled.
     */
    public static double ratioOf(HealthStatus status) {
        Object ratio = status.details().get(RATIO);
        return ratio instanceof Number number ? number.doubleValue() : 0.0;
    }

    /**
     * Canonical ids found out of sync, carried by a status this check returned.
     */
    public static List<String> outOfSyncOf(HealthStatus status) {
        Object ids = status.details().get(OUT_OF_SYNC_IDS);
        if (!(ids instanceof List<?> list)) {
            return List.of();
        }
        return list.stream().map(String::valueOf).toList();
    }

    HealthStatus.Status classify(double ratio) {
        if (ratio <= config.warningRatio()) {
            return HealthStatus.Status.OK;
        }
        if (ratio >= config.criticalRatio()) {
            return HealthStatus.Status.CRITICAL;
        }
        return HealthStatus.Status.WARNING;
    }

    private List<DriftSample> sample() {
        List<SourceEdit> edits = systemOfRecord.recentlyEdited(config.sampleSize());
        List<DriftSample> samples = new ArrayList<>(edits.size());
        for (SourceEdit edit : edits) {
            samples.add(new DriftSample(edit.canonicalId(), edit.lastEditedAt(),
                    latestVerification(edit.canonicalId()), config.tolerance()));
        }
        return samples;
    }

    private Instant latestVerification(String canonicalId) {
        Instant latest = null;
        for (CacheRecord record : store.findByCanonicalId(canonicalId)) {
            if (record.isInvalidated()) {
                continue;
            }
            if (latest == null || record.getLastVerifiedAt().isAfter(latest)) {
                latest = record.getLastVerifiedAt();
            }
        }
        return latest;
    }

    private static List<Map<String, String>> describe(List<DriftSample> drifted) {
        return drifted.stream()
                .limit(REPORTED_SAMPLES)
                .map(sample -> Map.of(
                        "canonicalId", sample.canonicalId(),
                        "sourceEditedAt", String.valueOf(sample.sourceEditedAt()),
                        "lastVerifiedAt", String.valueOf(sample.lastVerifiedAt())))
                .toList();
    }
}
