package com.contact.resolution.cdi;

import com.contact.resolution.alert.AlertDispatcher;
import com.contact.resolution.alert.LoggingAlertDispatcher;
import com.contact.resolution.alert.WebhookAlertDispatcher;
import com.contact.resolution.api.ContactResolver;
import com.contact.resolution.api.ResolutionOptions;
import com.contact.resolution.cache.CacheConfig;
import com.contact.resolution.health.DriftConfig;
import com.contact.resolution.metrics.MicrometerMetricsService;
import com.contact.resolution.replication.ReplicationConfig;
import com.contact.resolution.rest.security.ApiKeyAuthFilter;
import com.contact.resolution.rest.security.RoleAuthorizationFilter;
import com.contact.resolution.rest.security.SecurityConfig;
import com.contact.resolution.rest.security.SecurityRole;
import com.contact.resolution.source.HttpSystemOfRecord;
import com.contact.resolution.tracing.OpenTelemetryTracingService;
import io.micrometer.core.instrument.Metrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * CDI producer that wires {@link ContactResolver} from MicroProfile Config.
 *
 * <p>Defaults live in {@code META-INF/microprofile-config.properties}. The minimum a
 * deployment has to set is the system of record endpoint:</p>
 * <pre>
 * contact-resolution.source.base-url=https://crm.internal/api
 * contact-resolution.source.api-token=...
 * </pre>
 * <p>{@code store.backend=graph} moves the authoritative store and job leases to FalkorDB;
 * {@code distributed.backend=redis} puts the distributed cache in Redis.</p>
 */
@ApplicationScoped
public class ContactResolutionProducer {
    private static final Logger log = LoggerFactory.getLogger(ContactResolutionProducer.class);

    // ── System of record ──────────────────────────────────────

    @Inject
    @ConfigProperty(name = "contact-resolution.source.base-url")
    String sourceBaseUrl;

    @Inject
    @ConfigProperty(name = "contact-resolution.source.api-token")
    Optional<String> sourceApiToken;

    @Inject
    @ConfigProperty(name = "contact-resolution.source.timeout-seconds", defaultValue = "5")
    int sourceTimeoutSeconds;

    // ── Authoritative store ───────────────────────────────────

    @Inject
    @ConfigProperty(name = "contact-resolution.store.backend", defaultValue = "memory")
    String storeBackend;

    @Inject
    @ConfigProperty(name = "contact-resolution.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "contact-resolution.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "contact-resolution.falkordb.graph-name", defaultValue = "contact-resolution")
    String falkordbGraphName;

    // ── Caches ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "contact-resolution.distributed.backend", defaultValue = "memory")
    String distributedBackend;

    @Inject
    @ConfigProperty(name = "contact-resolution.redis.address", defaultValue = "redis://localhost:6379")
    String redisAddress;

    @Inject
    @ConfigProperty(name = "contact-resolution.distributed.ttl-minutes", defaultValue = "360")
    long distributedTtlMinutes;

    @Inject
    @ConfigProperty(name = "contact-resolution.edge.enabled", defaultValue = "true")
    boolean edgeEnabled;

    @Inject
    @ConfigProperty(name = "contact-resolution.edge.max-size", defaultValue = "10000")
    int edgeMaxSize;

    @Inject
    @ConfigProperty(name = "contact-resolution.edge.ttl-seconds", defaultValue = "3600")
    long edgeTtlSeconds;

    // ── Background work ───────────────────────────────────────

    @Inject
    @ConfigProperty(name = "contact-resolution.background.threads", defaultValue = "4")
    int backgroundThreads;

    @Inject
    @ConfigProperty(name = "contact-resolution.background.queue-capacity", defaultValue = "1000")
    int backgroundQueueCapacity;

    @Inject
    @ConfigProperty(name = "contact-resolution.replication.batch-size", defaultValue = "200")
    int replicationBatchSize;

    @Inject
    @ConfigProperty(name = "contact-resolution.replication.interval-minutes", defaultValue = "5")
    long replicationIntervalMinutes;

    // ── Drift monitor ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "contact-resolution.drift.interval-minutes", defaultValue = "15")
    long driftIntervalMinutes;

    @Inject
    @ConfigProperty(name = "contact-resolution.drift.warning-ratio", defaultValue = "0.0")
    double driftWarningRatio;

    @Inject
    @ConfigProperty(name = "contact-resolution.drift.critical-ratio", defaultValue = "0.70")
    double driftCriticalRatio;

    @Inject
    @ConfigProperty(name = "contact-resolution.drift.invalidate-on-drift", defaultValue = "false")
    boolean invalidateOnDrift;

    @Inject
    @ConfigProperty(name = "contact-resolution.alert.webhook-url")
    Optional<String> alertWebhookUrl;

    // ── Observability ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "contact-resolution.metrics.enabled", defaultValue = "true")
    boolean metricsEnabled;

    @Inject
    @ConfigProperty(name = "contact-resolution.tracing.enabled", defaultValue = "false")
    boolean tracingEnabled;

    // ── Security ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "contact-resolution.security.enabled", defaultValue = "true")
    boolean securityEnabled;

    @Inject
    @ConfigProperty(name = "contact-resolution.security.api-key-header", defaultValue = "X-API-Key")
    String apiKeyHeader;

    @Inject
    @ConfigProperty(name = "contact-resolution.security.operator-keys")
    Optional<List<String>> operatorKeys;

    @Inject
    @ConfigProperty(name = "contact-resolution.security.viewer-keys")
    Optional<List<String>> viewerKeys;

    private RedissonClient redisson;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ContactResolver contactResolver() {
        log.info("Producing ContactResolver: source={} store={} distributed={}",
                sourceBaseUrl, storeBackend, distributedBackend);

        HttpSystemOfRecord source = HttpSystemOfRecord.builder()
                .baseUrl(sourceBaseUrl)
                .apiToken(sourceApiToken.orElse(null))
                .timeout(Duration.ofSeconds(sourceTimeoutSeconds))
                .build();

        ResolutionOptions options = ResolutionOptions.builder()
                .sorTimeout(Duration.ofSeconds(sourceTimeoutSeconds))
                .distributedTtl(Duration.ofMinutes(distributedTtlMinutes))
                .backgroundThreads(backgroundThreads)
                .backgroundQueueCapacity(backgroundQueueCapacity)
                .build();

        CacheConfig edge = edgeEnabled
                ? new CacheConfig(edgeMaxSize, Duration.ofSeconds(edgeTtlSeconds), true)
                : CacheConfig.disabled();

        DriftConfig drift = DriftConfig.defaults()
                .withInterval(Duration.ofMinutes(driftIntervalMinutes))
                .withThresholds(driftWarningRatio, driftCriticalRatio)
                .withInvalidateOnDrift(invalidateOnDrift);

        ContactResolver.Builder builder = ContactResolver.builder()
                .systemOfRecord(source)
                .options(options)
                .edgeCache(edge)
                .replication(new ReplicationConfig(replicationBatchSize,
                        Duration.ofMinutes(distributedTtlMinutes), Duration.ofMinutes(replicationIntervalMinutes)))
                .drift(drift)
                .alertDispatcher(createAlertDispatcher());

        if (metricsEnabled) {
            builder.metricsService(new MicrometerMetricsService(Metrics.globalRegistry));
        }
        if (tracingEnabled) {
            builder.tracingService(OpenTelemetryTracingService.fromGlobal());
        }
        if ("graph".equalsIgnoreCase(storeBackend)) {
            builder.falkorDB(falkordbHost, falkordbPort, falkordbGraphName);
        }
        if ("redis".equalsIgnoreCase(distributedBackend)) {
            redisson = redissonClient();
            builder.redisson(redisson);
        }

        ContactResolver resolver = builder.build();
        resolver.start();
        return resolver;
    }

    public void closeResolver(@Disposes ContactResolver resolver) {
        log.info("Closing ContactResolver");
        resolver.close();
        if (redisson != null) {
            redisson.shutdown();
        }
    }

    @Produces
    @ApplicationScoped
    public SecurityConfig securityConfig() {
        SecurityConfig.Builder builder = SecurityConfig.builder()
                .enabled(securityEnabled)
                .apiKeyHeader(apiKeyHeader);
        viewerKeys.ifPresent(keys -> builder.addKeys(keys, SecurityRole.VIEWER));
        operatorKeys.ifPresent(keys -> builder.addKeys(keys, SecurityRole.OPERATOR));

        SecurityConfig config = builder.build();
        if (config.isEnabled() && config.keyCount() == 0) {
            log.warn("Security is enabled but no API keys are configured; every request will be rejected");
        }
        log.info("Security config: enabled={} keyCount={}", config.isEnabled(), config.keyCount());
        return config;
    }

    @Produces
    @ApplicationScoped
    public ApiKeyAuthFilter apiKeyAuthFilter(SecurityConfig config) {
        return new ApiKeyAuthFilter(config);
    }

    @Produces
    @ApplicationScoped
    public RoleAuthorizationFilter roleAuthorizationFilter(SecurityConfig config) {
        return new RoleAuthorizationFilter(config);
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    private RedissonClient redissonClient() {
        Config config = new Config();
        config.useSingleServer().setAddress(redisAddress);
        log.info("Connecting to Redis at {}", redisAddress);
        return Redisson.create(config);
    }

    private AlertDispatcher createAlertDispatcher() {
        if (alertWebhookUrl.isPresent() && !alertWebhookUrl.get().isBlank()) {
            log.info("Health alerts will be posted to a webhook");
            return new WebhookAlertDispatcher(alertWebhookUrl.get());
        }
        log.info("No alert webhook configured, health alerts go to the log");
        return new LoggingAlertDispatcher();
    }
}
