package com.signalloop.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalloop.config.SignalLoopProperties;
import com.signalloop.model.CachedMetrics;
import com.signalloop.model.CollectionPhase;
import com.signalloop.model.DecisionOutcome;
import com.signalloop.model.MeasurementContext;
import com.signalloop.model.MetricSnapshot;
import com.signalloop.model.ScrapeMetadata;
import com.signalloop.model.ScrapeOutcome;
import com.signalloop.model.ScrapedMetrics;
import com.signalloop.model.StrategyKey;
import com.signalloop.model.ValidationResult;
import com.signalloop.repository.DecisionOutcomeRepository;
import com.signalloop.repository.MetricSnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one ingestion pass for a post: cache lookup, scrape, validate, then
 * conditionally alert, persist and cache. Per-post failures are reported in the
 * returned outcome and never thrown.
 * <p>
 * Persistence happens before the cache write and before any reward feedback,
 * so a failed write leaves both untouched.
 */
@Service
public class ScrapingOrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(ScrapingOrchestratorService.class);
    private static final ScrapedMetrics EMPTY_METRICS = new ScrapedMetrics(null, null, null, null, null, null, null);

    private final MetricScraperClient metricScraperClient;
    private final ScrapeRetryPolicy scrapeRetryPolicy;
    private final EngagementValidator engagementValidator;
    private final MetricSnapshotCache metricSnapshotCache;
    private final MetricSnapshotRepository metricSnapshotRepository;
    private final DecisionOutcomeRepository decisionOutcomeRepository;
    private final StrategyRewardTracker strategyRewardTracker;
    private final RewardCalculator rewardCalculator;
    private final DiagnosticAlertService diagnosticAlertService;
    private final IngestionHealthService ingestionHealthService;
    private final SignalLoopProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ScrapingOrchestratorService(
            MetricScraperClient metricScraperClient,
            ScrapeRetryPolicy scrapeRetryPolicy,
            EngagementValidator engagementValidator,
            MetricSnapshotCache metricSnapshotCache,
            MetricSnapshotRepository metricSnapshotRepository,
            DecisionOutcomeRepository decisionOutcomeRepository,
            StrategyRewardTracker strategyRewardTracker,
            RewardCalculator rewardCalculator,
            DiagnosticAlertService diagnosticAlertService,
            IngestionHealthService ingestionHealthService,
            SignalLoopProperties properties,
            TransactionTemplate transactionTemplate,
            ObjectMapper objectMapper,
            Clock clock) {
        this.metricScraperClient = metricScraperClient;
        this.scrapeRetryPolicy = scrapeRetryPolicy;
        this.engagementValidator = engagementValidator;
        this.metricSnapshotCache = metricSnapshotCache;
        this.metricSnapshotRepository = metricSnapshotRepository;
        this.decisionOutcomeRepository = decisionOutcomeRepository;
        this.strategyRewardTracker = strategyRewardTracker;
        this.rewardCalculator = rewardCalculator;
        this.diagnosticAlertService = diagnosticAlertService;
        this.ingestionHealthService = ingestionHealthService;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Scrapes, validates and conditionally stores metrics for one post.
     *
     * @param postId Platform post identifier
     * @param metadata Collection phase plus optional account context and decision tags
     * @return Outcome of the pass; {@code success=false} on scrape or persistence failure
     */
    public ScrapeOutcome scrapeAndStore(String postId, ScrapeMetadata metadata) {
        if (postId == null || postId.isBlank()) {
            throw new IllegalArgumentException("postId is required");
        }
        ScrapeMetadata resolvedMetadata = metadata == null
                ? ScrapeMetadata.forPhase(CollectionPhase.SCHEDULED)
                : metadata;
        OffsetDateTime now = OffsetDateTime.now(clock);

        Optional<CachedMetrics> cached = lookupCache(postId, now);
        if (cached.isPresent()) {
            ingestionHealthService.recordCacheHit();
            log.debug("Metrics for post {} served from cache (hour bucket {})",
                    postId, MetricSnapshotCache.hourBucket(now));
            return ScrapeOutcome.cacheHit(postId, cached.get().metrics());
        }

        ScrapedMetrics metrics;
        try {
            metrics = scrapeRetryPolicy.execute(postId, () -> metricScraperClient.scrape(postId));
            ingestionHealthService.recordScrapeAttempt(true);
        } catch (ScrapeFailureException ex) {
            ingestionHealthService.recordScrapeAttempt(false);
            log.warn("Scrape failed for post {} ({}): {}", postId, ex.getReason(), ex.getMessage());
            return ScrapeOutcome.failure(postId, "scrape_failed[" + ex.getReason() + "]: " + ex.getMessage());
        }
        if (metrics == null) {
            metrics = EMPTY_METRICS;
        }

        MeasurementContext context = buildContext(postId, resolvedMetadata, now);
        ValidationResult validation = engagementValidator.validate(metrics, context);
        ingestionHealthService.recordValidation(validation.valid());
        log.debug("Validated metrics for post {}: valid={} confidence={} anomalies={}",
                postId, validation.valid(), validation.confidence(), validation.anomalies());

        if (validation.shouldAlert()) {
            raiseAlert(postId, metrics, validation);
        }

        MetricSnapshot snapshot = null;
        if (validation.shouldStore()) {
            try {
                snapshot = persistSnapshot(postId, resolvedMetadata, metrics, validation, context, now);
                ingestionHealthService.recordStore();
            } catch (PersistenceFailureException ex) {
                ingestionHealthService.recordPersistenceFailure();
                log.error("Failed to persist metrics for post {} (phase {})",
                        postId, resolvedMetadata.phase(), ex);
                return ScrapeOutcome.failure(postId, metrics, validation,
                        "persistence_failed: " + ex.getMessage());
            }
        } else {
            log.info("Skipping storage for post {}: confidence {} below store threshold, anomalies={}",
                    postId, String.format("%.2f", validation.confidence()), validation.anomalies());
        }

        if (validation.valid() && validation.confidence() >= properties.getValidation().getCacheConfidence()) {
            writeCache(new CachedMetrics(postId, metrics, validation.confidence(), now), now);
        }

        if (snapshot != null && snapshot.isVerified()) {
            recordRewardFeedback(postId, resolvedMetadata, snapshot, now);
        }

        return ScrapeOutcome.completed(postId, metrics, validation, snapshot != null);
    }

    MeasurementContext buildContext(String postId, ScrapeMetadata metadata, OffsetDateTime now) {
        Long followers = metadata.accountFollowerCount() != null
                ? metadata.accountFollowerCount()
                : properties.getAccount().getFollowerCount();
        Double hoursSincePost = metadata.postedAt() == null
                ? null
                : Duration.between(metadata.postedAt(), now).toMinutes() / 60.0;

        MetricSnapshot previous = null;
        Double accountAverage = null;
        try {
            previous = metricSnapshotRepository.findFirstByPostIdOrderByCollectedAtDesc(postId).orElse(null);
            accountAverage = metricSnapshotRepository.averageVerifiedEngagementSince(
                    now.minusDays(properties.getAccount().getAverageEngagementWindowDays()));
        } catch (DataAccessException ex) {
            log.warn("Historical context unavailable for post {}, validating without it: {}",
                    postId, ex.getMessage());
        }
        return new MeasurementContext(followers, accountAverage, previous, hoursSincePost, now);
    }

    private Optional<CachedMetrics> lookupCache(String postId, OffsetDateTime now) {
        try {
            return metricSnapshotCache.get(postId, now);
        } catch (RuntimeException ex) {
            log.warn("Metrics cache lookup failed for post {}, scraping: {}", postId, ex.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(CachedMetrics entry, OffsetDateTime now) {
        try {
            metricSnapshotCache.put(entry, now);
        } catch (RuntimeException ex) {
            log.warn("Metrics cache write failed for post {}: {}", entry.postId(), ex.getMessage());
        }
    }

    private void raiseAlert(String postId, ScrapedMetrics metrics, ValidationResult validation) {
        ingestionHealthService.recordAlert();
        try {
            diagnosticAlertService.raise(postId, metrics, validation);
        } catch (RuntimeException ex) {
            log.warn("Diagnostic alert failed for post {}: {}", postId, ex.getMessage());
        }
    }

    private MetricSnapshot persistSnapshot(
            String postId,
            ScrapeMetadata metadata,
            ScrapedMetrics metrics,
            ValidationResult validation,
            MeasurementContext context,
            OffsetDateTime now) {
        MetricSnapshot snapshot = new MetricSnapshot();
        snapshot.setPostId(postId);
        snapshot.setCollectionPhase(metadata.phase());
        snapshot.setCollectedAt(now);
        snapshot.setLikes(metrics.likes());
        snapshot.setRetweets(metrics.retweets());
        snapshot.setQuoteTweets(metrics.quoteTweets());
        snapshot.setReplies(metrics.replies());
        snapshot.setBookmarks(metrics.bookmarks());
        snapshot.setViews(metrics.views());
        snapshot.setProfileClicks(metrics.profileClicks());
        snapshot.setEngagementRate(metrics.engagementRate());
        snapshot.setConfidence(validation.confidence());
        snapshot.setAnomalies(validation.anomalies());
        snapshot.setVerified(validation.valid()
                && validation.confidence() >= properties.getValidation().getCacheConfidence());
        snapshot.setMetadata(snapshotMetadata(metadata, validation, context));
        snapshot.setCreatedAt(now);
        snapshot.setUpdatedAt(now);

        try {
            String anomaliesJson = objectMapper.writeValueAsString(snapshot.getAnomalies());
            String metadataJson = objectMapper.writeValueAsString(snapshot.getMetadata());
            transactionTemplate.executeWithoutResult(status -> metricSnapshotRepository.upsertSnapshot(
                    postId,
                    snapshot.getCollectionPhase().name(),
                    now,
                    snapshot.getLikes(),
                    snapshot.getRetweets(),
                    snapshot.getQuoteTweets(),
                    snapshot.getReplies(),
                    snapshot.getBookmarks(),
                    snapshot.getViews(),
                    snapshot.getProfileClicks(),
                    snapshot.getEngagementRate(),
                    snapshot.getConfidence(),
                    anomaliesJson,
                    snapshot.isVerified(),
                    metadataJson));
        } catch (JsonProcessingException ex) {
            throw new PersistenceFailureException("Could not serialize snapshot for post " + postId, ex);
        } catch (DataAccessException | TransactionException ex) {
            throw new PersistenceFailureException("Snapshot upsert failed for post " + postId, ex);
        }
        log.debug("Stored {} snapshot for post {} (verified={}, confidence={})",
                metadata.phase(), postId, snapshot.isVerified(), snapshot.getConfidence());
        return snapshot;
    }

    private Map<String, Object> snapshotMetadata(
            ScrapeMetadata metadata,
            ValidationResult validation,
            MeasurementContext context) {
        Map<String, Object> values = new LinkedHashMap<>(metadata.attributes());
        values.put("collectionPhase", metadata.phase().name());
        putIfPresent(values, "postedAt", metadata.postedAt() == null ? null : metadata.postedAt().toString());
        putIfPresent(values, "hoursSincePost", context.hoursSincePost());
        putIfPresent(values, "accountFollowerCount", context.accountFollowerCount());
        putIfPresent(values, "templateId", metadata.templateId());
        putIfPresent(values, "promptVersion", metadata.promptVersion());
        putIfPresent(values, "strategyId", metadata.strategyId());
        putIfPresent(values, "strategyVersion", metadata.strategyVersion());
        if (!validation.warnings().isEmpty()) {
            values.put("warnings", validation.warnings());
        }
        return values;
    }

    /**
     * Feeds a verified lifecycle snapshot back into the learning loop. Only the
     * configured reward phase counts, and each post contributes one reward
     * sample; later passes refresh the stored outcome without re-counting it.
     */
    private void recordRewardFeedback(
            String postId,
            ScrapeMetadata metadata,
            MetricSnapshot snapshot,
            OffsetDateTime now) {
        if (!metadata.hasDecisionTags() || !isRewardPhase(metadata.phase())) {
            return;
        }
        double reward = rewardCalculator.compute(snapshot);
        boolean firstReward;
        try {
            DecisionOutcome outcome = decisionOutcomeRepository.findByPostId(postId).orElseGet(DecisionOutcome::new);
            firstReward = outcome.getReward() == null;
            outcome.setPostId(postId);
            outcome.setStrategyId(metadata.strategyId());
            outcome.setStrategyVersion(metadata.strategyVersion());
            outcome.setTemplateId(metadata.templateId());
            outcome.setPromptVersion(metadata.promptVersion());
            if (outcome.getDecidedAt() == null) {
                outcome.setDecidedAt(metadata.postedAt() == null ? now : metadata.postedAt());
            }
            outcome.setReward(reward);
            outcome.setRewardedAt(now);
            decisionOutcomeRepository.save(outcome);
        } catch (RuntimeException ex) {
            log.warn("Failed to record decision outcome for post {}: {}", postId, ex.getMessage());
            return;
        }

        if (firstReward) {
            StrategyKey strategy = StrategyKey.of(metadata.strategyId(), metadata.strategyVersion());
            strategyRewardTracker.recordReward(strategy.strategyId(), strategy.strategyVersion(), reward);
            log.info("Recorded reward {} for post {} under strategy {}",
                    String.format("%.3f", reward), postId, strategy);
        }
    }

    private boolean isRewardPhase(CollectionPhase phase) {
        String configured = properties.getIngestion().getRewardPhase();
        return configured != null && configured.trim().equalsIgnoreCase(phase.name());
    }

    private static void putIfPresent(Map<String, Object> values, String key, Object value) {
        if (value != null) {
            values.put(key, value);
        }
    }
}
