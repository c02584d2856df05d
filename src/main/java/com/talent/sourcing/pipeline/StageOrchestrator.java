package com.talent.sourcing.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.talent.sourcing.SourcingException;
import com.talent.sourcing.cache.CacheLookup;
import com.talent.sourcing.cache.CacheTier;
import com.talent.sourcing.cache.CacheUnavailableException;
import com.talent.sourcing.cache.FreshnessPolicy;
import com.talent.sourcing.cache.WriteThroughOnlyCacheTier;
import com.talent.sourcing.logging.LogContext;
import com.talent.sourcing.metrics.MetricsService;
import com.talent.sourcing.metrics.NoOpMetricsService;
import com.talent.sourcing.provider.CandidateScore;
import com.talent.sourcing.provider.CandidateSearchProvider;
import com.talent.sourcing.provider.ScoringCollaborator;
import com.talent.sourcing.query.FilterSet;
import com.talent.sourcing.query.QueryBuilder;
import com.talent.sourcing.query.StructuredQuery;
import com.talent.sourcing.resolver.EntityResolver;
import com.talent.sourcing.resolver.ResolutionRequest;
import com.talent.sourcing.resolver.ResolvedEntity;
import com.talent.sourcing.session.PipelineStage;
import com.talent.sourcing.session.SessionNotFoundException;
import com.talent.sourcing.session.SessionPatch;
import com.talent.sourcing.session.SessionState;
import com.talent.sourcing.session.SessionStateCorruptionException;
import com.talent.sourcing.session.SessionStateStore;
import com.talent.sourcing.tracing.NoOpTracingService;
import com.talent.sourcing.tracing.StageCounter;
import com.talent.sourcing.tracing.StageSpan;
import com.talent.sourcing.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Drives a sourcing run through its four stages: organization discovery, free
 * candidate preview, paid record collection and scored evaluation.
 *
 * <p>Every stage reads and writes the session through the {@link SessionStateStore},
 * so a run can be resumed from another process. Collection consults the cache tier
 * before every paid fetch and advances the session's pagination offset
 * monotonically. Per-item external failures are retried once and then reported
 * as {@link ItemFailure}s; any other failure marks the session {@link PipelineStage#FAILED}
 * and is rethrown.</p>
 *
 * <pre>
 * try (StageOrchestrator orchestrator = StageOrchestrator.builder()
 *         .sessionStore(store)
 *         .resolver(resolver)
 *         .candidateProvider(provider)
 *         .scoring(scoring)
 *         .cacheTier(cacheTier)
 *         .build()) {
 *     DiscoveryResult discovery = orchestrator.startRun(request);
 *     orchestrator.preview(discovery.sessionId(), criteria);
 *     CollectionResult page = orchestrator.collect(CollectRequest.of(discovery.sessionId(), 0, 20));
 * }
 * </pre>
 */
public class StageOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StageOrchestrator.class);

    static final String SEARCH_KEY_PREFIX = "search:";
    static final String PREVIEW_KEY_PREFIX = "candidate-preview:";
    static final String CANDIDATE_KEY_PREFIX = "candidate:";
    static final String ORGANIZATION_KEY_PREFIX = "org-record:";

    static final String META_BYPASS_CACHE = "bypassCache";
    static final String META_BATCH_INDEX = "batchIndex";

    private final SessionStateStore sessionStore;
    private final EntityResolver resolver;
    private final CandidateSearchProvider candidateProvider;
    private final ScoringCollaborator scoring;
    private final CacheTier cacheTier;
    private final QueryBuilder queryBuilder;
    private final PipelineOptions options;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final BoundedExecutor executor;

    private StageOrchestrator(Builder builder) {
        this.sessionStore = builder.sessionStore;
        this.resolver = builder.resolver;
        this.candidateProvider = builder.candidateProvider;
        this.scoring = builder.scoring;
        this.cacheTier = builder.cacheTier;
        this.queryBuilder = builder.queryBuilder;
        this.options = builder.options;
        this.metrics = builder.metrics;
        this.tracing = builder.tracing;
        this.objectMapper = builder.objectMapper;
        this.clock = builder.clock;
        this.executor = new BoundedExecutor(options.getConcurrency(), "sourcing-worker");
    }

    // ---- discovery ----

    /**
     * Creates a session and runs discovery for the request's seed organizations.
     */
    public DiscoveryResult startRun(RunRequest request) {
        Objects.requireNonNull(request, "request is required");
        String sessionId = request.getSessionId() != null ? request.getSessionId() : newSessionId();
        sessionStore.create(sessionId);
        if (request.isBypassCache()) {
            sessionStore.mergeUpdate(sessionId, SessionPatch.builder().metadata(META_BYPASS_CACHE, true).build());
        }
        try (LogContext logCtx = LogContext.forRun(sessionId)) {
            log.info("run.started sessionId={} seeds={} bypassCache={}",
                    sessionId, request.getSeeds().size(), request.isBypassCache());
        }
        return discover(sessionId, request.getSeeds());
    }

    /**
     * Resolves the seed organizations of a session in {@link PipelineStage#DISCOVERY}.
     * Unresolved seeds are kept in the session with confidence 0.
     */
    public DiscoveryResult discover(String sessionId, List<ResolutionRequest> seeds) {
        Objects.requireNonNull(seeds, "seeds are required");
        return inStage(sessionId, PipelineStage.DISCOVERY, () -> {
            requireStage(sessionStore.read(sessionId), EnumSet.of(PipelineStage.DISCOVERY));

            List<ResolvedEntity> entities = resolver.resolveAll(seeds, sessionId);
            DiscoveryResult result = new DiscoveryResult(sessionId, entities);

            Map<String, Object> discovery = new LinkedHashMap<>();
            discovery.put("seeds", seeds.size());
            discovery.put("resolved", result.resolvedCount());
            discovery.put("unresolved", result.unresolved().size());
            sessionStore.mergeUpdate(sessionId, SessionPatch.builder()
                    .stage(PipelineStage.PREVIEW)
                    .discoveredEntities(entities)
                    .metadata("discovery", discovery)
                    .build());

            log.info("discovery.completed sessionId={} resolved={} unresolved={}",
                    sessionId, result.resolvedCount(), result.unresolved().size());
            return result;
        });
    }

    // ---- preview ----

    /**
     * Searches candidates at the first batch of discovered organizations, stores their ids
     * in the session and returns the free preview records. Moves the session to
     * {@link PipelineStage#COLLECTION}.
     */
    public PreviewResult preview(String sessionId, SearchCriteria criteria) {
        Objects.requireNonNull(criteria, "criteria are required");
        return inStage(sessionId, PipelineStage.PREVIEW, () -> {
            SessionState state = sessionStore.read(sessionId);
            requireStage(state, EnumSet.of(PipelineStage.PREVIEW));
            return previewBatch(state, criteria, 0);
        });
    }

    /**
     * Searches candidates at the next batch of discovered organizations and appends the
     * new ids to the session.
     *
     * @throws IllegalArgumentException if every organization batch has already been searched
     */
    public PreviewResult previewNextBatch(String sessionId, SearchCriteria criteria) {
        Objects.requireNonNull(criteria, "criteria are required");
        return inStage(sessionId, PipelineStage.PREVIEW, () -> {
            SessionState state = sessionStore.read(sessionId);
            requireStage(state, EnumSet.of(PipelineStage.COLLECTION));
            int next = intMetadata(state, META_BATCH_INDEX, 0) + 1;
            if (next >= organizationBatches(state).size()) {
                throw new IllegalArgumentException("No further organization batches for session " + sessionId);
            }
            return previewBatch(state, criteria, next);
        });
    }

    private PreviewResult previewBatch(SessionState state, SearchCriteria criteria, int batchIndex) {
        String sessionId = state.sessionId();
        List<List<ResolvedEntity>> batches = organizationBatches(state);
        List<ResolvedEntity> batch = batchIndex < batches.size() ? batches.get(batchIndex) : List.of();
        if (batch.isEmpty() && !hasOrganizations(criteria)) {
            throw new IllegalArgumentException("Session " + sessionId + " has no usable organizations to search");
        }
        CacheTier tier = tierFor(state, false);

        StructuredQuery query = queryBuilder.build(withBatch(criteria.required(), batch),
                criteria.optional(), criteria.strategy());

        List<String> ids = searchIds(tier, query);
        List<JsonNode> previewPayloads = withRetry("preview", sessionId,
                () -> candidateProvider.preview(query, options.getPreviewCap()));

        List<CandidateRecord> previews = new ArrayList<>();
        List<String> previewIds = new ArrayList<>();
        for (JsonNode payload : previewPayloads) {
            String id = payload.path("id").asText("");
            if (id.isEmpty()) {
                log.warn("preview.record.skipped sessionId={} reason=missing-id", sessionId);
                continue;
            }
            tier.set(PREVIEW_KEY_PREFIX + id, payload);
            previews.add(new CandidateRecord(id, payload, 0, CandidateRecord.Source.PREVIEW, Map.of()));
            previewIds.add(id);
        }

        List<String> allIds = new ArrayList<>(ids);
        allIds.addAll(previewIds);
        int added = sessionStore.appendCandidateIds(sessionId, allIds);

        Map<String, Object> preview = new LinkedHashMap<>();
        preview.put("strategy", criteria.strategy().name());
        preview.put("organizations", batch.size());
        preview.put("idsFound", ids.size());
        preview.put("idsAdded", added);
        preview.put("previewCount", previews.size());
        SessionState updated = sessionStore.mergeUpdate(sessionId, SessionPatch.builder()
                .stage(PipelineStage.COLLECTION)
                .metadata("preview", preview)
                .metadata(META_BATCH_INDEX, batchIndex)
                .build());

        boolean hasMore = batchIndex + 1 < batches.size();
        log.info("preview.completed sessionId={} batch={} idsFound={} idsAdded={} totalIds={} hasMoreBatches={}",
                sessionId, batchIndex, ids.size(), added, updated.candidateIds().size(), hasMore);
        return new PreviewResult(sessionId, batchIndex, ids.size(), added, updated.candidateIds().size(),
                previews, hasMore);
    }

    private List<String> searchIds(CacheTier tier, StructuredQuery query) {
        String key = SEARCH_KEY_PREFIX + fingerprint(query, options.getIdCap());
        CacheLookup lookup = tier.get(key, FreshnessPolicy.searchResults());
        if (lookup.isHit()) {
            List<String> cached = new ArrayList<>();
            lookup.payload().path("ids").forEach(node -> cached.add(node.asText()));
            log.debug("preview.search.cached key={} ids={}", key, cached.size());
            return cached;
        }
        List<String> ids = withRetry("searchIds", key, () -> candidateProvider.searchIds(query, options.getIdCap()));
        List<String> capped = ids.size() > options.getIdCap() ? ids.subList(0, options.getIdCap()) : ids;
        ObjectNode payload = objectMapper.createObjectNode();
        ArrayNode array = payload.putArray("ids");
        capped.forEach(array::add);
        tier.set(key, payload);
        return capped;
    }

    private List<List<ResolvedEntity>> organizationBatches(SessionState state) {
        List<ResolvedEntity> usable = state.discoveredEntities().stream()
                .filter(e -> e.isResolved() || !e.queryName().isEmpty())
                .toList();
        List<List<ResolvedEntity>> batches = new ArrayList<>();
        int size = options.getOrganizationBatchSize();
        for (int i = 0; i < usable.size(); i += size) {
            batches.add(usable.subList(i, Math.min(i + size, usable.size())));
        }
        return batches;
    }

    private static boolean hasOrganizations(SearchCriteria criteria) {
        return !criteria.required().getOrganizationIds().isEmpty()
                || !criteria.required().getOrganizationNames().isEmpty()
                || !criteria.optional().getOrganizationIds().isEmpty()
                || !criteria.optional().getOrganizationNames().isEmpty();
    }

    private static FilterSet withBatch(FilterSet filters, List<ResolvedEntity> batch) {
        Set<String> ids = new LinkedHashSet<>(filters.getOrganizationIds());
        Set<String> names = new LinkedHashSet<>(filters.getOrganizationNames());
        for (ResolvedEntity entity : batch) {
            if (entity.isResolved()) {
                ids.add(entity.canonicalId());
            } else {
                names.add(entity.queryName());
            }
        }
        return filters.withOrganizations(List.copyOf(ids), List.copyOf(names));
    }

    // ---- collection ----

    public CollectionResult collect(CollectRequest request) {
        return collect(request, CancellationToken.none());
    }

    /**
     * Collects full records for one page of the session's candidate ids.
     *
     * <p>Ids are processed in waves of {@link PipelineOptions#getConcurrency()}. Each id is
     * served from cache when a fresh or stale entry exists; otherwise the record is fetched
     * (one credit) and written to the cache. The page may be shorter than requested when it
     * runs past the last id. The session offset moves to {@code max(offset, start + processed)}.</p>
     *
     * @throws InvalidPaginationRequestException if the page starts at or beyond the last id
     */
    public CollectionResult collect(CollectRequest request, CancellationToken cancellation) {
        Objects.requireNonNull(request, "request is required");
        Objects.requireNonNull(cancellation, "cancellation is required");
        String sessionId = request.sessionId();
        return inStage(sessionId, PipelineStage.COLLECTION, () -> {
            SessionState state = sessionStore.read(sessionId);
            requireStage(state, EnumSet.of(PipelineStage.COLLECTION));

            List<String> allIds = state.candidateIds();
            if (request.count() <= 0 || request.startIndex() < 0 || request.startIndex() >= allIds.size()) {
                throw new InvalidPaginationRequestException(request.startIndex(), request.count(), allIds.size());
            }
            int end = request.startIndex() + Math.min(request.count(), allIds.size() - request.startIndex());
            List<String> page = allIds.subList(request.startIndex(), end);
            CacheTier tier = tierFor(state, request.bypassCache());
            CreditLedger ledger = new CreditLedger();
            metrics.recordPageSize(page.size());

            try (LogContext logCtx = LogContext.forCollection(sessionId, request.startIndex(), page.size())) {
                List<CollectedItem> items = new ArrayList<>();
                boolean cancelled = false;
                for (int waveStart = 0; waveStart < page.size(); waveStart += options.getConcurrency()) {
                    if (cancellation.isCancelled()) {
                        cancelled = true;
                        log.info("collect.cancelled sessionId={} processed={} of {}",
                                sessionId, items.size(), page.size());
                        break;
                    }
                    int waveEnd = Math.min(waveStart + options.getConcurrency(), page.size());
                    List<Integer> indexes = new ArrayList<>();
                    for (int i = request.startIndex() + waveStart; i < request.startIndex() + waveEnd; i++) {
                        indexes.add(i);
                    }
                    items.addAll(executor.mapOrdered(indexes,
                            index -> collectOne(sessionId, allIds.get(index), index, tier, ledger)));
                }

                List<CandidateRecord> records = new ArrayList<>();
                List<ItemFailure> failures = new ArrayList<>();
                for (CollectedItem item : items) {
                    if (item.record() != null) {
                        records.add(item.record());
                    } else {
                        failures.add(item.failure());
                    }
                }

                SessionState advanced = sessionStore.advanceOffsetTo(sessionId, request.startIndex() + items.size());
                Map<String, Object> collection = new LinkedHashMap<>();
                collection.put("lastStart", request.startIndex());
                collection.put("lastProcessed", items.size());
                collection.put("fetched", ledger.getFetched());
                collection.put("cached", ledger.getCached());
                collection.put("skipped", ledger.getSkipped());
                collection.put("failed", ledger.getFailed());
                collection.put("creditsSpent", ledger.creditsSpent());
                sessionStore.mergeUpdate(sessionId, SessionPatch.builder()
                        .stage(PipelineStage.COLLECTION)
                        .metadata("collection", collection)
                        .build());

                CollectionResult result = new CollectionResult(sessionId, request.startIndex(), page.size(),
                        records, failures, ledger, advanced.paginationOffset(), cancelled);
                log.info("collect.completed sessionId={} summary='{}' credits={} offset={}",
                        sessionId, result.summary(), ledger.creditsSpent(), advanced.paginationOffset());
                return result;
            }
        });
    }

    private CollectedItem collectOne(String sessionId, String candidateId, int index, CacheTier tier,
                                     CreditLedger ledger) {
        CandidateRecord record;
        try {
            record = loadRecord(candidateId, tier, ledger);
        } catch (RuntimeException e) {
            ledger.recordFailed();
            metrics.recordItemFailure(PipelineStage.COLLECTION);
            log.warn("collect.item.failed sessionId={} candidateId={} index={} error={}",
                    sessionId, candidateId, index, e.getMessage());
            return new CollectedItem(null, ItemFailure.of(candidateId, index, e));
        }
        return new CollectedItem(record.withEnrichedOrganizations(enrich(sessionId, record, tier, ledger)), null);
    }

    private CandidateRecord loadRecord(String candidateId, CacheTier tier, CreditLedger ledger) {
        String key = CANDIDATE_KEY_PREFIX + candidateId;
        CacheLookup lookup = tier.get(key, FreshnessPolicy.candidateRecords());
        if (lookup.isHit()) {
            ledger.recordCached();
            return new CandidateRecord(candidateId, lookup.payload(), lookup.ageDays(),
                    CandidateRecord.Source.CACHE, Map.of());
        }
        JsonNode payload = withRetry("fetchRecord", candidateId, () -> candidateProvider.fetchRecord(candidateId));
        ledger.recordFetched();
        metrics.recordCreditSpent("candidate");
        tier.set(key, payload);
        return new CandidateRecord(candidateId, payload, 0, CandidateRecord.Source.FRESH, Map.of());
    }

    private Map<String, JsonNode> enrich(String sessionId, CandidateRecord record, CacheTier tier,
                                         CreditLedger ledger) {
        Map<String, JsonNode> organizations = new LinkedHashMap<>();
        for (JsonNode experience : record.coreFields().path("experience")) {
            String organizationId = experience.path("company_id").asText("");
            if (organizationId.isEmpty() || organizations.containsKey(organizationId)) {
                continue;
            }
            if (!options.getEnrichmentPolicy().shouldEnrich(experience)) {
                ledger.recordSkipped();
                continue;
            }
            String key = ORGANIZATION_KEY_PREFIX + organizationId;
            CacheLookup lookup = tier.get(key, FreshnessPolicy.organizations());
            if (lookup.isHit()) {
                ledger.recordOrganizationCached();
                organizations.put(organizationId, lookup.payload());
                continue;
            }
            try {
                JsonNode organization = withRetry("fetchOrganization", organizationId,
                        () -> candidateProvider.fetchOrganization(organizationId));
                ledger.recordOrganizationFetched();
                metrics.recordCreditSpent("organization");
                tier.set(key, organization);
                organizations.put(organizationId, organization);
            } catch (RuntimeException e) {
                log.warn("collect.enrich.failed sessionId={} candidateId={} organizationId={} error={}",
                        sessionId, record.id(), organizationId, e.getMessage());
            }
        }
        return organizations;
    }

    private record CollectedItem(CandidateRecord record, ItemFailure failure) {
    }

    // ---- evaluation ----

    /**
     * Scores the given records and ranks them by weighted score, highest first.
     * Moves the session through {@link PipelineStage#EVALUATION} to {@link PipelineStage#COMPLETED}.
     */
    public EvaluationResult evaluate(String sessionId, List<CandidateRecord> records, Requirements requirements) {
        Objects.requireNonNull(records, "records are required");
        Objects.requireNonNull(requirements, "requirements are required");
        return inStage(sessionId, PipelineStage.EVALUATION, () -> {
            requireStage(sessionStore.read(sessionId), EnumSet.of(PipelineStage.COLLECTION));
            sessionStore.mergeUpdate(sessionId, SessionPatch.stage(PipelineStage.EVALUATION));
            return score(sessionId, records, List.of(), requirements);
        });
    }

    /**
     * Scores every candidate collected so far in the session, reading the records from cache.
     * Candidates whose record is no longer cached are reported as failures.
     */
    public EvaluationResult evaluateCollected(String sessionId, Requirements requirements) {
        Objects.requireNonNull(requirements, "requirements are required");
        return inStage(sessionId, PipelineStage.EVALUATION, () -> {
            SessionState state = sessionStore.read(sessionId);
            requireStage(state, EnumSet.of(PipelineStage.COLLECTION));
            List<CandidateRecord> records = new ArrayList<>();
            List<ItemFailure> missing = new ArrayList<>();
            for (int i = 0; i < state.paginationOffset(); i++) {
                String id = state.candidateIds().get(i);
                CacheLookup lookup = cacheTier.get(CANDIDATE_KEY_PREFIX + id, FreshnessPolicy.candidateRecords());
                if (lookup.isHit()) {
                    records.add(new CandidateRecord(id, lookup.payload(), lookup.ageDays(),
                            CandidateRecord.Source.CACHE, Map.of()));
                } else {
                    missing.add(new ItemFailure(id, i, "NotCollected", "Record is not cached"));
                }
            }
            sessionStore.mergeUpdate(sessionId, SessionPatch.stage(PipelineStage.EVALUATION));
            return score(sessionId, records, missing, requirements);
        });
    }

    private EvaluationResult score(String sessionId, List<CandidateRecord> records, List<ItemFailure> priorFailures,
                                   Requirements requirements) {
        List<Integer> indexes = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            indexes.add(i);
        }
        List<ScoreOutcome> outcomes = executor.mapOrdered(indexes, i -> {
            CandidateRecord record = records.get(i);
            try {
                CandidateScore score = withRetry("score", record.id(), () -> scoring.score(record, requirements));
                return new ScoreOutcome(new ScoredCandidate(record, score, weightedScore(score, requirements)), null);
            } catch (RuntimeException e) {
                metrics.recordItemFailure(PipelineStage.EVALUATION);
                log.warn("evaluate.item.failed sessionId={} candidateId={} error={}",
                        sessionId, record.id(), e.getMessage());
                return new ScoreOutcome(null, ItemFailure.of(record.id(), i, e));
            }
        });

        List<ScoredCandidate> ranked = new ArrayList<>();
        List<ItemFailure> failures = new ArrayList<>(priorFailures);
        for (ScoreOutcome outcome : outcomes) {
            if (outcome.scored() != null) {
                ranked.add(outcome.scored());
            } else {
                failures.add(outcome.failure());
            }
        }
        ranked.sort(Comparator.comparingDouble(ScoredCandidate::weightedScore).reversed());

        Map<String, Object> evaluation = new LinkedHashMap<>();
        evaluation.put("evaluated", ranked.size());
        evaluation.put("failed", failures.size());
        evaluation.put("topScore", ranked.isEmpty() ? 0.0 : ranked.get(0).weightedScore());
        sessionStore.mergeUpdate(sessionId, SessionPatch.builder()
                .stage(PipelineStage.COMPLETED)
                .metadata("evaluation", evaluation)
                .build());

        EvaluationResult result = new EvaluationResult(sessionId, ranked, failures);
        log.info("evaluate.completed sessionId={} summary='{}'", sessionId, result.summary());
        return result;
    }

    /**
     * Combines per-criterion scores by requirement weight, with the remaining weight applied
     * to the overall score. A criterion the collaborator did not score counts at the overall score.
     */
    static double weightedScore(CandidateScore score, Requirements requirements) {
        double total = score.overallScore() * requirements.generalFitWeight();
        for (WeightedRequirement requirement : requirements.getCriteria()) {
            double criterion = score.criterionScores().getOrDefault(requirement.name(), score.overallScore());
            total += criterion * requirement.weight();
        }
        return total / 100.0;
    }

    private record ScoreOutcome(ScoredCandidate scored, ItemFailure failure) {
    }

    // ---- whole run ----

    /**
     * Runs discovery, preview, one collection page of {@code pageSize} and evaluation.
     * A run whose preview found no candidates completes with empty results.
     */
    public RunResult runToCompletion(RunRequest request, int pageSize) {
        DiscoveryResult discovery = startRun(request);
        String sessionId = discovery.sessionId();
        PreviewResult preview = preview(sessionId, request.getCriteria());
        Requirements requirements = request.getRequirements() != null
                ? request.getRequirements() : Requirements.generalFitOnly("");

        CollectionResult collection;
        if (preview.totalIds() == 0) {
            collection = new CollectionResult(sessionId, 0, 0, List.of(), List.of(), new CreditLedger(), 0, false);
        } else {
            collection = collect(new CollectRequest(sessionId, 0, pageSize, request.isBypassCache()));
        }
        EvaluationResult evaluation = evaluate(sessionId, collection.records(), requirements);
        return new RunResult(discovery, preview, collection, evaluation);
    }

    // ---- support ----

    public SessionState getSession(String sessionId) {
        return sessionStore.read(sessionId);
    }

    public SessionStateStore getSessionStore() {
        return sessionStore;
    }

    @Override
    public void close() {
        executor.close();
    }

    private <T> T inStage(String sessionId, PipelineStage stage, Supplier<T> body) {
        Objects.requireNonNull(sessionId, "sessionId is required");
        String stageName = stage.name().toLowerCase();
        long started = System.nanoTime();
        StageSpan span = tracing.startStage(stage, sessionId);
        try (LogContext logCtx = LogContext.forStage(sessionId, stageName)) {
            log.debug("stage.started sessionId={} stage={}", sessionId, stageName);
            T result = body.get();
            recordCounts(span, result);
            span.succeed();
            return result;
        } catch (RuntimeException e) {
            boolean rejected = isCallerError(e);
            span.fail(e, rejected);
            if (rejected) {
                log.debug("stage.rejected sessionId={} stage={} error={}", sessionId, stageName, e.getMessage());
            } else {
                log.error("stage.failed sessionId={} stage={} error={}", sessionId, stageName, e.getMessage(), e);
                markFailed(sessionId, stage, e);
            }
            throw e;
        } finally {
            span.close();
            metrics.recordStageDuration(stage, Duration.ofNanos(System.nanoTime() - started));
        }
    }

    private static void recordCounts(StageSpan span, Object result) {
        if (result instanceof DiscoveryResult discovery) {
            span.recordCount(StageCounter.ENTITIES_RESOLVED, discovery.resolvedCount());
            span.recordCount(StageCounter.ENTITIES_UNRESOLVED, discovery.unresolved().size());
        } else if (result instanceof PreviewResult preview) {
            span.recordCount(StageCounter.IDS_FOUND, preview.idsFound());
            span.recordCount(StageCounter.IDS_ADDED, preview.idsAdded());
        } else if (result instanceof CollectionResult collection) {
            span.recordCount(StageCounter.PROCESSED, collection.processed());
            span.recordCount(StageCounter.FAILED, collection.failures().size());
            span.recordCount(StageCounter.CREDITS, collection.ledger().creditsSpent());
        } else if (result instanceof EvaluationResult evaluation) {
            span.recordCount(StageCounter.PROCESSED, evaluation.ranked().size() + evaluation.failures().size());
            span.recordCount(StageCounter.FAILED, evaluation.failures().size());
            span.recordCount(StageCounter.RANKED, evaluation.ranked().size());
        }
    }

    private static boolean isCallerError(RuntimeException e) {
        return e instanceof InvalidPaginationRequestException
                || e instanceof SessionNotFoundException
                || e instanceof StageConflictException
                || e instanceof SessionInactiveException
                || e instanceof IllegalArgumentException;
    }

    private void markFailed(String sessionId, PipelineStage stage, RuntimeException cause) {
        if (cause instanceof SessionStateCorruptionException) {
            return;
        }
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("stage", stage.name());
        error.put("type", cause.getClass().getSimpleName());
        error.put("message", String.valueOf(cause.getMessage()));
        try {
            sessionStore.mergeUpdate(sessionId, SessionPatch.builder()
                    .stage(PipelineStage.FAILED)
                    .metadata("error", error)
                    .build());
        } catch (RuntimeException e) {
            log.error("stage.fail-mark.failed sessionId={} error={}", sessionId, e.getMessage());
            cause.addSuppressed(e);
        }
    }

    private static void requireStage(SessionState state, Set<PipelineStage> allowed) {
        if (!state.active()) {
            throw new SessionInactiveException(state.sessionId());
        }
        if (!allowed.contains(state.stage())) {
            throw new StageConflictException(state.sessionId(), state.stage(), allowed);
        }
    }

    private CacheTier tierFor(SessionState state, boolean bypassRequested) {
        boolean bypass = bypassRequested || Boolean.TRUE.equals(state.stageMetadata().get(META_BYPASS_CACHE));
        return bypass ? new WriteThroughOnlyCacheTier(cacheTier) : cacheTier;
    }

    private <T> T withRetry(String operation, String subject, Supplier<T> call) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= options.getMaxAttempts(); attempt++) {
            try {
                return call.get();
            } catch (CacheUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                last = e;
                if (attempt < options.getMaxAttempts()) {
                    log.debug("external.retry operation={} subject={} attempt={} error={}",
                            operation, subject, attempt, e.getMessage());
                }
            }
        }
        throw last;
    }

    private static int intMetadata(SessionState state, String key, int defaultValue) {
        Object value = state.stageMetadata().get(key);
        return value instanceof Number number ? number.intValue() : defaultValue;
    }

    private String newSessionId() {
        return "search_" + clock.instant().getEpochSecond() + "_"
                + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    private String fingerprint(StructuredQuery query, int limit) {
        try {
            String json = objectMapper.writeValueAsString(query) + "#" + limit;
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(json.getBytes(StandardCharsets.UTF_8)));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new SourcingException("Failed to fingerprint query", e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SessionStateStore sessionStore;
        private EntityResolver resolver;
        private CandidateSearchProvider candidateProvider;
        private ScoringCollaborator scoring;
        private CacheTier cacheTier;
        private QueryBuilder queryBuilder = new QueryBuilder();
        private PipelineOptions options = PipelineOptions.defaults();
        private MetricsService metrics = new NoOpMetricsService();
        private TracingService tracing = new NoOpTracingService();
        private ObjectMapper objectMapper = new ObjectMapper();
        private Clock clock = Clock.systemUTC();

        public Builder sessionStore(SessionStateStore sessionStore) {
            this.sessionStore = sessionStore;
            return this;
        }

        public Builder resolver(EntityResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder candidateProvider(CandidateSearchProvider candidateProvider) {
            this.candidateProvider = candidateProvider;
            return this;
        }

        public Builder scoring(ScoringCollaborator scoring) {
            this.scoring = scoring;
            return this;
        }

        public Builder cacheTier(CacheTier cacheTier) {
            this.cacheTier = cacheTier;
            return this;
        }

        public Builder queryBuilder(QueryBuilder queryBuilder) {
            this.queryBuilder = queryBuilder;
            return this;
        }

        public Builder options(PipelineOptions options) {
            this.options = options;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder tracing(TracingService tracing) {
            this.tracing = tracing;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public StageOrchestrator build() {
            Objects.requireNonNull(sessionStore, "sessionStore is required");
            Objects.requireNonNull(resolver, "resolver is required");
            Objects.requireNonNull(candidateProvider, "candidateProvider is required");
            Objects.requireNonNull(scoring, "scoring is required");
            Objects.requireNonNull(cacheTier, "cacheTier is required");
            Objects.requireNonNull(queryBuilder, "queryBuilder is required");
            Objects.requireNonNull(options, "options is required");
            Objects.requireNonNull(metrics, "metrics is required");
            Objects.requireNonNull(tracing, "tracing is required");
            Objects.requireNonNull(objectMapper, "objectMapper is required");
            Objects.requireNonNull(clock, "clock is required");
            return new StageOrchestrator(this);
        }
    }
}
