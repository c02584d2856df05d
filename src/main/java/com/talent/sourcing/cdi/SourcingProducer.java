package com.talent.sourcing.cdi;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.talent.sourcing.cache.CacheConfig;
import com.talent.sourcing.cache.CacheTier;
import com.talent.sourcing.cache.NoOpCacheTier;
import com.talent.sourcing.cache.TieredCacheTier;
import com.talent.sourcing.graph.FalkorDBConnection;
import com.talent.sourcing.graph.GraphConnection;
import com.talent.sourcing.lock.DistributedLock;
import com.talent.sourcing.lock.LocalDistributedLock;
import com.talent.sourcing.lock.LockConfig;
import com.talent.sourcing.metrics.MetricsService;
import com.talent.sourcing.metrics.MicrometerMetricsService;
import com.talent.sourcing.metrics.NoOpMetricsService;
import com.talent.sourcing.pipeline.EnrichmentPolicy;
import com.talent.sourcing.pipeline.PipelineOptions;
import com.talent.sourcing.pipeline.StageOrchestrator;
import com.talent.sourcing.provider.CandidateSearchProvider;
import com.talent.sourcing.provider.EntitySearchProvider;
import com.talent.sourcing.provider.ScoringCollaborator;
import com.talent.sourcing.provider.http.HttpCandidateSearchProvider;
import com.talent.sourcing.provider.http.HttpEntitySearchProvider;
import com.talent.sourcing.provider.http.HttpScoringCollaborator;
import com.talent.sourcing.resolver.CachingEntitySearchProvider;
import com.talent.sourcing.resolver.EntityResolver;
import com.talent.sourcing.resolver.ResolutionOptions;
import com.talent.sourcing.retention.RetentionPolicy;
import com.talent.sourcing.retention.RetentionService;
import com.talent.sourcing.review.InMemoryManualResolutionQueue;
import com.talent.sourcing.review.ManualResolutionQueue;
import com.talent.sourcing.session.GraphSessionStateStore;
import com.talent.sourcing.session.InMemorySessionStateStore;
import com.talent.sourcing.session.SessionStateStore;
import com.talent.sourcing.store.CacheStore;
import com.talent.sourcing.store.GraphCacheStore;
import com.talent.sourcing.store.InMemoryCacheStore;
import com.talent.sourcing.tracing.NoOpTracingService;
import com.talent.sourcing.tracing.OpenTelemetryTracingService;
import com.talent.sourcing.tracing.TracingService;
import io.micrometer.core.instrument.Metrics;
import io.opentelemetry.api.GlobalOpenTelemetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the sourcing pipeline from MicroProfile Config properties.
 *
 * <p>All properties live under the {@code sourcing.} prefix; defaults are in
 * {@code application.properties}. With {@code sourcing.store.backend=falkordb} cache
 * entries and sessions are persisted in FalkorDB, otherwise they are kept in memory.</p>
 *
 * <pre>
 * sourcing.store.backend=falkordb
 * sourcing.falkordb.host=localhost
 * sourcing.provider.candidates.base-url=https://api.example.com/v2
 * sourcing.provider.candidates.api-key=...
 * </pre>
 */
@ApplicationScoped
public class SourcingProducer {

    private static final Logger log = LoggerFactory.getLogger(SourcingProducer.class);

    // ── Store ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "sourcing.store.backend", defaultValue = "memory")
    String storeBackend;

    @Inject
    @ConfigProperty(name = "sourcing.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "sourcing.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "sourcing.falkordb.graph-name", defaultValue = "talent-sourcing")
    String falkordbGraphName;

    @Inject
    @ConfigProperty(name = "sourcing.lock.timeout-ms", defaultValue = "5000")
    long lockTimeoutMs;

    @Inject
    @ConfigProperty(name = "sourcing.session.candidate-id-cap", defaultValue = "1000")
    int candidateIdCap;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "sourcing.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "sourcing.cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "sourcing.cache.ttl-seconds", defaultValue = "300")
    int cacheTtlSeconds;

    // ── Resolution ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "sourcing.resolution.confidence-threshold", defaultValue = "0.85")
    double confidenceThreshold;

    @Inject
    @ConfigProperty(name = "sourcing.resolution.search-limit", defaultValue = "5")
    int searchLimit;

    @Inject
    @ConfigProperty(name = "sourcing.resolution.parallelism", defaultValue = "5")
    int resolutionParallelism;

    @Inject
    @ConfigProperty(name = "sourcing.resolution.submit-unresolved", defaultValue = "true")
    boolean submitUnresolved;

    // ── Pipeline ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "sourcing.pipeline.preview-cap", defaultValue = "100")
    int previewCap;

    @Inject
    @ConfigProperty(name = "sourcing.pipeline.concurrency", defaultValue = "5")
    int concurrency;

    @Inject
    @ConfigProperty(name = "sourcing.pipeline.organization-batch-size", defaultValue = "5")
    int organizationBatchSize;

    @Inject
    @ConfigProperty(name = "sourcing.pipeline.max-attempts", defaultValue = "2")
    int maxAttempts;

    @Inject
    @ConfigProperty(name = "sourcing.pipeline.enrichment.enabled", defaultValue = "true")
    boolean enrichmentEnabled;

    @Inject
    @ConfigProperty(name = "sourcing.pipeline.enrichment.min-year", defaultValue = "2020")
    int enrichmentMinYear;

    // ── Providers ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "sourcing.provider.candidates.base-url", defaultValue = "https://api.coresignal.com/cdapi/v2")
    String candidatesBaseUrl;

    @Inject
    @ConfigProperty(name = "sourcing.provider.candidates.api-key")
    Optional<String> candidatesApiKey;

    @Inject
    @ConfigProperty(name = "sourcing.provider.candidates.timeout-seconds", defaultValue = "30")
    int candidatesTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "sourcing.provider.organizations.base-url", defaultValue = "https://api.coresignal.com/cdapi/v2")
    String organizationsBaseUrl;

    @Inject
    @ConfigProperty(name = "sourcing.provider.organizations.api-key")
    Optional<String> organizationsApiKey;

    @Inject
    @ConfigProperty(name = "sourcing.provider.organizations.timeout-seconds", defaultValue = "10")
    int organizationsTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "sourcing.provider.scoring.base-url", defaultValue = "http://localhost:8090")
    String scoringBaseUrl;

    @Inject
    @ConfigProperty(name = "sourcing.provider.scoring.api-key")
    Optional<String> scoringApiKey;

    @Inject
    @ConfigProperty(name = "sourcing.provider.scoring.timeout-seconds", defaultValue = "60")
    int scoringTimeoutSeconds;

    // ── Retention ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "sourcing.retention.session-days", defaultValue = "90")
    int sessionRetentionDays;

    @Inject
    @ConfigProperty(name = "sourcing.retention.cache-entry-days", defaultValue = "90")
    int cacheEntryRetentionDays;

    // ── Observability ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "sourcing.metrics.enabled", defaultValue = "false")
    boolean metricsEnabled;

    @Inject
    @ConfigProperty(name = "sourcing.tracing.enabled", defaultValue = "false")
    boolean tracingEnabled;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private GraphConnection graphConnection;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (metricsEnabled) {
            log.info("Producing MicrometerMetricsService on the global registry");
            return new MicrometerMetricsService(Metrics.globalRegistry);
        }
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public TracingService tracingService() {
        if (tracingEnabled) {
            log.info("Producing OpenTelemetryTracingService");
            return new OpenTelemetryTracingService(GlobalOpenTelemetry.getTracer("talent-sourcing"));
        }
        return new NoOpTracingService();
    }

    @Produces
    @ApplicationScoped
    public CacheStore cacheStore() {
        if (usesGraph()) {
            log.info("Producing GraphCacheStore: falkordb={}:{}/{}", falkordbHost, falkordbPort, falkordbGraphName);
            return new GraphCacheStore(graphConnection(), objectMapper);
        }
        log.info("Producing InMemoryCacheStore");
        return new InMemoryCacheStore();
    }

    @Produces
    @ApplicationScoped
    public CacheTier cacheTier(CacheStore store, MetricsService metrics) {
        if (!cacheEnabled) {
            log.info("Cache disabled");
            return new NoOpCacheTier();
        }
        return new TieredCacheTier("sourcing", store, new CacheConfig(cacheMaxSize, cacheTtlSeconds, true),
                Clock.systemUTC(), metrics);
    }

    @Produces
    @ApplicationScoped
    public SessionStateStore sessionStateStore() {
        DistributedLock lock = new LocalDistributedLock(new LockConfig(lockTimeoutMs));
        if (usesGraph()) {
            return new GraphSessionStateStore(graphConnection(), objectMapper, lock, Clock.systemUTC(), candidateIdCap);
        }
        return new InMemorySessionStateStore(lock, Clock.systemUTC(), candidateIdCap);
    }

    public void closeSessionStateStore(@Disposes SessionStateStore store) {
        closeGraphConnection();
    }

    @Produces
    @ApplicationScoped
    public ManualResolutionQueue manualResolutionQueue() {
        return new InMemoryManualResolutionQueue();
    }

    @Produces
    @ApplicationScoped
    public EntityResolver entityResolver(CacheTier cacheTier, ManualResolutionQueue queue, MetricsService metrics) {
        EntitySearchProvider provider = HttpEntitySearchProvider.builder()
                .baseUrl(organizationsBaseUrl)
                .apiKey(organizationsApiKey.orElse(null))
                .timeout(Duration.ofSeconds(organizationsTimeoutSeconds))
                .objectMapper(objectMapper)
                .build();

        ResolutionOptions options = ResolutionOptions.builder()
                .confidenceThreshold(confidenceThreshold)
                .searchLimit(searchLimit)
                .parallelism(resolutionParallelism)
                .submitUnresolvedForReview(submitUnresolved)
                .build();

        log.info("Producing EntityResolver: threshold={} searchLimit={}", confidenceThreshold, searchLimit);
        return EntityResolver.builder()
                .searchProvider(new CachingEntitySearchProvider(provider, cacheTier))
                .options(options)
                .reviewQueue(queue)
                .metrics(metrics)
                .build();
    }

    public void closeResolver(@Disposes EntityResolver resolver) {
        log.info("Closing EntityResolver");
        resolver.close();
    }

    @Produces
    @ApplicationScoped
    public StageOrchestrator stageOrchestrator(SessionStateStore sessionStore, EntityResolver resolver,
                                               CacheTier cacheTier, MetricsService metrics,
                                               TracingService tracing) {
        CandidateSearchProvider candidates = HttpCandidateSearchProvider.builder()
                .baseUrl(candidatesBaseUrl)
                .apiKey(candidatesApiKey.orElse(null))
                .timeout(Duration.ofSeconds(candidatesTimeoutSeconds))
                .objectMapper(objectMapper)
                .build();
        ScoringCollaborator scoring = HttpScoringCollaborator.builder()
                .baseUrl(scoringBaseUrl)
                .apiKey(scoringApiKey.orElse(null))
                .timeout(Duration.ofSeconds(scoringTimeoutSeconds))
                .objectMapper(objectMapper)
                .build();

        PipelineOptions options = PipelineOptions.builder()
                .previewCap(previewCap)
                .idCap(candidateIdCap)
                .concurrency(concurrency)
                .organizationBatchSize(organizationBatchSize)
                .maxAttempts(maxAttempts)
                .enrichmentPolicy(enrichmentEnabled
                        ? EnrichmentPolicy.yearCutoff(enrichmentMinYear) : EnrichmentPolicy.never())
                .build();

        log.info("Producing StageOrchestrator: concurrency={} previewCap={} idCap={} enrichment={}",
                concurrency, previewCap, candidateIdCap, enrichmentEnabled ? enrichmentMinYear : "off");
        return StageOrchestrator.builder()
                .sessionStore(sessionStore)
                .resolver(resolver)
                .candidateProvider(candidates)
                .scoring(scoring)
                .cacheTier(cacheTier)
                .options(options)
                .metrics(metrics)
                .tracing(tracing)
                .objectMapper(objectMapper)
                .build();
    }

    public void closeOrchestrator(@Disposes StageOrchestrator orchestrator) {
        log.info("Closing StageOrchestrator");
        orchestrator.close();
    }

    @Produces
    @ApplicationScoped
    public RetentionService retentionService(SessionStateStore sessionStore, CacheStore cacheStore) {
        return new RetentionService(sessionStore, cacheStore);
    }

    @Produces
    @ApplicationScoped
    public RetentionPolicy retentionPolicy() {
        return new RetentionPolicy(Duration.ofDays(sessionRetentionDays), Duration.ofDays(cacheEntryRetentionDays));
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    private boolean usesGraph() {
        if ("falkordb".equalsIgnoreCase(storeBackend)) {
            return true;
        }
        if (!"memory".equalsIgnoreCase(storeBackend)) {
            log.warn("Unknown store backend '{}', falling back to memory", storeBackend);
        }
        return false;
    }

    private synchronized GraphConnection graphConnection() {
        if (graphConnection == null) {
            graphConnection = new FalkorDBConnection(falkordbHost, falkordbPort, falkordbGraphName);
            graphConnection.createIndexes();
        }
        return graphConnection;
    }

    private synchronized void closeGraphConnection() {
        if (graphConnection != null) {
            log.info("Closing graph connection");
            graphConnection.close();
            graphConnection = null;
        }
    }
}
