package com.signalloop.service;

import com.signalloop.config.SignalLoopProperties;
import com.signalloop.model.CollectionPhase;
import com.signalloop.model.PublishedPost;
import com.signalloop.model.ScrapeMetadata;
import com.signalloop.model.ScrapeOutcome;
import com.signalloop.repository.MetricSnapshotRepository;
import com.signalloop.repository.PublishedPostRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically collects metrics for recently published posts plus a small
 * sample of older ones, skipping posts collected within the last hour.
 */
@Service
public class MetricsCollectionScheduler {

    private static final Logger log = LoggerFactory.getLogger(MetricsCollectionScheduler.class);
    private static final int CANDIDATE_OVERFETCH = 4;

    private final ScrapingOrchestratorService scrapingOrchestratorService;
    private final PublishedPostRepository publishedPostRepository;
    private final MetricSnapshotRepository metricSnapshotRepository;
    private final SignalLoopProperties properties;
    private final ExecutorService ingestionExecutor;
    private final Clock clock;
    private final AtomicBoolean cycleRunning = new AtomicBoolean(false);

    public MetricsCollectionScheduler(
            ScrapingOrchestratorService scrapingOrchestratorService,
            PublishedPostRepository publishedPostRepository,
            MetricSnapshotRepository metricSnapshotRepository,
            SignalLoopProperties properties,
            @Qualifier("ingestionExecutor") ExecutorService ingestionExecutor,
            Clock clock) {
        this.scrapingOrchestratorService = scrapingOrchestratorService;
        this.publishedPostRepository = publishedPostRepository;
        this.metricSnapshotRepository = metricSnapshotRepository;
        this.properties = properties;
        this.ingestionExecutor = ingestionExecutor;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        SignalLoopProperties.Ingestion ingestion = properties.getIngestion();
        if (!ingestion.isEnabled() || !ingestion.isRunOnStartup()) {
            log.debug("Startup metrics collection skipped (enabled={}, runOnStartup={})",
                    ingestion.isEnabled(), ingestion.isRunOnStartup());
            return;
        }
        runCollectionCycle("startup");
    }

    @Scheduled(
            fixedDelayString = "${signalloop.ingestion.interval-ms:600000}",
            initialDelayString = "${signalloop.ingestion.initial-delay-ms:60000}")
    public void scheduledCollection() {
        runCollectionCycle("scheduler");
    }

    /**
     * Runs one collection cycle.
     *
     * @param source Source label for logging (startup/scheduler/manual)
     * @return Tally of the cycle's outcomes
     */
    public CycleSummary runCollectionCycle(String source) {
        if (!properties.getIngestion().isEnabled()) {
            log.debug("Metrics collection ({}) skipped: ingestion disabled", source);
            return CycleSummary.EMPTY;
        }
        if (!cycleRunning.compareAndSet(false, true)) {
            log.info("Metrics collection ({}) skipped: previous cycle still running", source);
            return CycleSummary.EMPTY;
        }
        try {
            return collect(source);
        } finally {
            cycleRunning.set(false);
        }
    }

    private CycleSummary collect(String source) {
        SignalLoopProperties.Ingestion ingestion = properties.getIngestion();
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime recentCutoff = now.minusHours(ingestion.getRecentWindowHours());
        OffsetDateTime historicalCutoff = now.minusDays(ingestion.getHistoricalWindowDays());

        List<PublishedPost> due = new ArrayList<>();
        due.addAll(selectDue(
                publishedPostRepository.findByPublishedAtAfterOrderByPublishedAtDesc(
                        recentCutoff, PageRequest.of(0, overfetch(ingestion.getRecentBatchSize()))),
                ingestion.getRecentBatchSize(), now));
        due.addAll(selectDue(
                publishedPostRepository.findByPublishedAtBetweenOrderByPublishedAtAsc(
                        historicalCutoff, recentCutoff, PageRequest.of(0, overfetch(ingestion.getHistoricalBatchSize()))),
                ingestion.getHistoricalBatchSize(), now));

        if (due.isEmpty()) {
            log.debug("Metrics collection ({}) found no posts due", source);
            return CycleSummary.EMPTY;
        }

        Map<String, CompletableFuture<ScrapeOutcome>> futures = new LinkedHashMap<>();
        for (PublishedPost post : due) {
            CollectionPhase phase = CollectionPhase.forPostAge(Duration.between(post.getPublishedAt(), now));
            ScrapeMetadata metadata = ScrapeMetadata.forPublishedPost(post, phase);
            futures.put(post.getPostId(), CompletableFuture
                    .supplyAsync(() -> scrapingOrchestratorService.scrapeAndStore(post.getPostId(), metadata),
                            ingestionExecutor)
                    .exceptionally(ex -> {
                        log.error("Metrics collection ({}) failed for post {}", source, post.getPostId(), ex);
                        return ScrapeOutcome.failure(post.getPostId(), String.valueOf(ex.getMessage()));
                    }));
        }

        int updated = 0;
        int cached = 0;
        int failed = 0;
        for (CompletableFuture<ScrapeOutcome> future : futures.values()) {
            ScrapeOutcome outcome = future.join();
            if (!outcome.success()) {
                failed++;
            } else if (outcome.cached()) {
                cached++;
            } else {
                updated++;
            }
        }

        CycleSummary summary = new CycleSummary(due.size(), updated, cached, failed);
        log.info("Metrics collection ({}) complete: {} post(s), {} updated, {} cached, {} failed",
                source, summary.attempted(), summary.updated(), summary.cached(), summary.failed());
        return summary;
    }

    private List<PublishedPost> selectDue(List<PublishedPost> posts, int limit, OffsetDateTime now) {
        OffsetDateTime freshnessCutoff = now.minusHours(1);
        List<PublishedPost> due = new ArrayList<>();
        for (PublishedPost post : posts) {
            if (due.size() >= limit) {
                break;
            }
            if (metricSnapshotRepository.existsByPostIdAndCollectedAtAfter(post.getPostId(), freshnessCutoff)) {
                log.debug("Skipping post {}: collected within the last hour", post.getPostId());
                continue;
            }
            due.add(post);
        }
        return due;
    }

    private static int overfetch(int batchSize) {
        return Math.max(1, batchSize) * CANDIDATE_OVERFETCH;
    }

    public record CycleSummary(int attempted, int updated, int cached, int failed) {
        static final CycleSummary EMPTY = new CycleSummary(0, 0, 0, 0);
    }
}
