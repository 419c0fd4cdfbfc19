package com.signalloop.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalloop.config.SignalLoopProperties;
import com.signalloop.model.CollectionPhase;
import com.signalloop.model.DecisionOutcome;
import com.signalloop.model.MeasurementContext;
import com.signalloop.model.MetricSnapshot;
import com.signalloop.model.ScrapeMetadata;
import com.signalloop.model.ScrapeOutcome;
import com.signalloop.model.ScrapedMetrics;
import com.signalloop.repository.DecisionOutcomeRepository;
import com.signalloop.repository.MetricSnapshotRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.doubleThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScrapingOrchestratorServiceTest {

    private static final String POST_ID = "1800000000000000001";
    private static final Instant NOW = Instant.parse("2026-03-02T12:15:00Z");
    private static final ScrapedMetrics PLAUSIBLE = new ScrapedMetrics(120L, 18L, 3L, 9L, 14L, 5_400L, 31L);

    @Mock
    private MetricScraperClient metricScraperClient;

    @Mock
    private ScrapeRetryPolicy scrapeRetryPolicy;

    @Mock
    private MetricSnapshotRepository metricSnapshotRepository;

    @Mock
    private DecisionOutcomeRepository decisionOutcomeRepository;

    @Mock
    private StrategyRewardTracker strategyRewardTracker;

    @Mock
    private DiagnosticAlertService diagnosticAlertService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private SignalLoopProperties properties;
    private IngestionHealthService ingestionHealthService;
    private ScrapingOrchestratorService orchestrator;

    @BeforeEach
    void setUp() {
        properties = new SignalLoopProperties();
        ingestionHealthService = new IngestionHealthService();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        orchestrator = new ScrapingOrchestratorService(
                metricScraperClient,
                scrapeRetryPolicy,
                new EngagementValidator(properties),
                new InMemoryMetricSnapshotCache(properties),
                metricSnapshotRepository,
                decisionOutcomeRepository,
                strategyRewardTracker,
                new RewardCalculator(properties),
                diagnosticAlertService,
                ingestionHealthService,
                properties,
                new TransactionTemplate(transactionManager),
                new ObjectMapper().findAndRegisterModules(),
                clock);

        lenient().when(scrapeRetryPolicy.execute(anyString(), any())).thenAnswer(invocation -> {
            Supplier<?> attempt = invocation.getArgument(1);
            return attempt.get();
        });
    }

    @Test
    void scrapeAndStore_persistsVerifiedSnapshotAndServesRepeatFromCache() {
        when(metricScraperClient.scrape(POST_ID)).thenReturn(PLAUSIBLE);

        ScrapeOutcome first = orchestrator.scrapeAndStore(POST_ID, ScrapeMetadata.forPhase(CollectionPhase.SCHEDULED));
        ScrapeOutcome second = orchestrator.scrapeAndStore(POST_ID, ScrapeMetadata.forPhase(CollectionPhase.SCHEDULED));

        assertTrue(first.success());
        assertTrue(first.stored());
        assertFalse(first.cached());
        assertTrue(first.validation().valid());

        assertTrue(second.success());
        assertTrue(second.cached());
        assertEquals(PLAUSIBLE, second.metrics());

        verify(metricScraperClient, times(1)).scrape(POST_ID);
        verify(metricSnapshotRepository, times(1)).upsertSnapshot(
                eq(POST_ID), eq("SCHEDULED"), any(), eq(120L), eq(18L), eq(3L), eq(9L), eq(14L),
                eq(5_400L), eq(31L), anyDouble(), eq(1.0), anyString(), eq(true), anyString());
        verifyNoInteractions(decisionOutcomeRepository, strategyRewardTracker, diagnosticAlertService);
        assertEquals(1, ingestionHealthService.snapshot().cacheHits());
    }

    @Test
    void scrapeAndStore_dropsSpikeWithoutStoringOrCaching() {
        MetricSnapshot previous = new MetricSnapshot();
        previous.setPostId(POST_ID);
        previous.setLikes(100L);
        previous.setCollectedAt(OffsetDateTime.ofInstant(NOW.minusSeconds(60), ZoneOffset.UTC));
        when(metricSnapshotRepository.findFirstByPostIdOrderByCollectedAtDesc(POST_ID))
                .thenReturn(Optional.of(previous));
        when(metricScraperClient.scrape(POST_ID)).thenReturn(ScrapedMetrics.of(5_000L, null, null, null, null));

        ScrapeOutcome outcome = orchestrator.scrapeAndStore(POST_ID, null);
        orchestrator.scrapeAndStore(POST_ID, null);

        assertTrue(outcome.success());
        assertFalse(outcome.stored());
        assertFalse(outcome.validation().valid());
        verify(metricSnapshotRepository, never()).upsertSnapshot(
                any(), any(), any(), any(), any(), any(), any(), any(), any(), any(),
                anyDouble(), anyDouble(), any(), anyBoolean(), any());
        verify(metricScraperClient, times(2)).scrape(POST_ID);
        verifyNoInteractions(diagnosticAlertService);
    }

    @Test
    void scrapeAndStore_dropsSpikeWhenAccountAverageIsKnown() {
        MetricSnapshot previous = new MetricSnapshot();
        previous.setPostId(POST_ID);
        previous.setLikes(100L);
        previous.setCollectedAt(OffsetDateTime.ofInstant(NOW.minusSeconds(60), ZoneOffset.UTC));
        when(metricSnapshotRepository.findFirstByPostIdOrderByCollectedAtDesc(POST_ID))
                .thenReturn(Optional.of(previous));
        when(metricSnapshotRepository.averageVerifiedEngagementSince(any())).thenReturn(500.0);
        when(metricScraperClient.scrape(POST_ID)).thenReturn(ScrapedMetrics.of(5_000L, null, null, null, null));

        ScrapeOutcome outcome = orchestrator.scrapeAndStore(POST_ID, null);

        assertTrue(outcome.success());
        assertEquals(0.75, outcome.validation().confidence(), 1e-9);
        assertFalse(outcome.validation().shouldStore());
        assertFalse(outcome.stored());
        verify(metricSnapshotRepository, never()).upsertSnapshot(
                any(), any(), any(), any(), any(), any(), any(), any(), any(), any(),
                anyDouble(), anyDouble(), any(), anyBoolean(), any());
    }

    @Test
    void scrapeAndStore_raisesAlertForImplausibleMetrics() {
        when(metricScraperClient.scrape(POST_ID)).thenReturn(
                new ScrapedMetrics(3_000L, 10_000L, 30_000L, 10L, 9_000L, 4_000L, null));
        ScrapeMetadata metadata = new ScrapeMetadata(
                CollectionPhase.T_PLUS_1H, null, 100L, null, null, null, null, Map.of());

        ScrapeOutcome outcome = orchestrator.scrapeAndStore(POST_ID, metadata);

        assertTrue(outcome.success());
        assertFalse(outcome.stored());
        assertTrue(outcome.validation().shouldAlert());
        verify(diagnosticAlertService).raise(eq(POST_ID), any(ScrapedMetrics.class), eq(outcome.validation()));
        assertEquals(1, ingestionHealthService.snapshot().alerts());
    }

    @Test
    void scrapeAndStore_reportsScrapeFailureWithoutValidating() {
        doThrow(new ScrapeFailureException(POST_ID, ScrapeFailureReason.NOT_FOUND, "post deleted"))
                .when(scrapeRetryPolicy).execute(eq(POST_ID), any());

        ScrapeOutcome outcome = orchestrator.scrapeAndStore(POST_ID, null);

        assertFalse(outcome.success());
        assertNull(outcome.validation());
        assertEquals("scrape_failed[NOT_FOUND]: post deleted", outcome.error());
        assertEquals(0.0, ingestionHealthService.snapshot().scrapeSuccessRate(), 1e-9);
        verifyNoInteractions(metricSnapshotRepository);
    }

    @Test
    void scrapeAndStore_persistenceFailureSkipsCacheAndRewards() {
        when(metricScraperClient.scrape(POST_ID)).thenReturn(PLAUSIBLE);
        when(metricSnapshotRepository.upsertSnapshot(
                any(), any(), any(), any(), any(), any(), any(), any(), any(), any(),
                anyDouble(), anyDouble(), any(), anyBoolean(), any()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));
        ScrapeMetadata metadata = tagged(CollectionPhase.T_PLUS_24H);

        ScrapeOutcome first = orchestrator.scrapeAndStore(POST_ID, metadata);
        ScrapeOutcome second = orchestrator.scrapeAndStore(POST_ID, metadata);

        assertFalse(first.success());
        assertTrue(first.error().startsWith("persistence_failed"));
        assertFalse(second.cached());
        verify(metricScraperClient, times(2)).scrape(POST_ID);
        verifyNoInteractions(decisionOutcomeRepository, strategyRewardTracker);
        assertEquals(2, ingestionHealthService.snapshot().persistenceFailures());
    }

    @Test
    void scrapeAndStore_recordsRewardOnceAtRewardPhase() {
        when(metricScraperClient.scrape(POST_ID)).thenReturn(PLAUSIBLE);
        when(decisionOutcomeRepository.findByPostId(POST_ID)).thenReturn(Optional.empty());

        ScrapeOutcome outcome = orchestrator.scrapeAndStore(POST_ID, tagged(CollectionPhase.T_PLUS_24H));

        assertTrue(outcome.stored());
        ArgumentCaptor<DecisionOutcome> saved = ArgumentCaptor.forClass(DecisionOutcome.class);
        verify(decisionOutcomeRepository).save(saved.capture());
        assertEquals("hook-first", saved.getValue().getStrategyId());
        assertEquals("template-7", saved.getValue().getTemplateId());
        double expected = (120 + 2 * 18 + 3 * 9 + 2 * 14) / 5_400.0 * 100.0;
        assertEquals(expected, saved.getValue().getReward(), 1e-9);
        verify(strategyRewardTracker).recordReward(
                eq("hook-first"), eq("2"), doubleThat(reward -> Math.abs(reward - expected) < 1e-9));
    }

    @Test
    void scrapeAndStore_refreshesExistingOutcomeWithoutRecountingReward() {
        DecisionOutcome existing = new DecisionOutcome();
        existing.setPostId(POST_ID);
        existing.setReward(1.5);
        existing.setDecidedAt(OffsetDateTime.ofInstant(NOW.minusSeconds(86_400), ZoneOffset.UTC));
        when(metricScraperClient.scrape(POST_ID)).thenReturn(PLAUSIBLE);
        when(decisionOutcomeRepository.findByPostId(POST_ID)).thenReturn(Optional.of(existing));

        orchestrator.scrapeAndStore(POST_ID, tagged(CollectionPhase.T_PLUS_24H));

        verify(decisionOutcomeRepository).save(existing);
        verifyNoInteractions(strategyRewardTracker);
    }

    @Test
    void scrapeAndStore_ignoresRewardOutsideRewardPhase() {
        when(metricScraperClient.scrape(POST_ID)).thenReturn(PLAUSIBLE);

        ScrapeOutcome outcome = orchestrator.scrapeAndStore(POST_ID, tagged(CollectionPhase.T_PLUS_1H));

        assertTrue(outcome.stored());
        verifyNoInteractions(decisionOutcomeRepository, strategyRewardTracker);
    }

    @Test
    void scrapeAndStore_rejectsBlankPostId() {
        assertThrows(IllegalArgumentException.class, () -> orchestrator.scrapeAndStore(" ", null));
        verifyNoInteractions(metricScraperClient);
    }

    @Test
    void buildContext_toleratesUnavailableHistory() {
        properties.getAccount().setFollowerCount(42_000L);
        when(metricSnapshotRepository.findFirstByPostIdOrderByCollectedAtDesc(POST_ID))
                .thenThrow(new DataAccessResourceFailureException("timeout"));
        OffsetDateTime now = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);
        ScrapeMetadata metadata = new ScrapeMetadata(
                CollectionPhase.T_PLUS_6H, now.minusHours(3), null, null, null, null, null, Map.of());

        MeasurementContext context = orchestrator.buildContext(POST_ID, metadata, now);

        assertNull(context.previousSnapshot());
        assertNull(context.accountAvgEngagement());
        assertEquals(42_000L, context.accountFollowerCount());
        assertEquals(3.0, context.hoursSincePost(), 1e-9);
    }

    private static ScrapeMetadata tagged(CollectionPhase phase) {
        return new ScrapeMetadata(phase, null, null, "template-7", "v3", "hook-first", "2", Map.of());
    }
}
