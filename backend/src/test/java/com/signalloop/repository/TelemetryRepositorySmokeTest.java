package com.signalloop.repository;

import com.signalloop.model.CollectionPhase;
import com.signalloop.model.ControlPlaneState;
import com.signalloop.model.MetricSnapshot;
import com.signalloop.model.StrategyRewardStats;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE, properties = {
        "spring.jpa.hibernate.ddl-auto=validate",
        "spring.flyway.enabled=true",
        "spring.flyway.locations=classpath:db/migration",
        "signalloop.ingestion.enabled=false",
        "signalloop.ingestion.run-on-startup=false",
        "signalloop.policy.enabled=false",
        "signalloop.cache.mode=in_memory",
        "signalloop.rewards.mode=jpa"
})
@Testcontainers(disabledWithoutDocker = true)
@Transactional
class TelemetryRepositorySmokeTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 2, 12, 0, 0, 0, ZoneOffset.UTC);

    @DynamicPropertySource
    static void datasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private MetricSnapshotRepository metricSnapshotRepository;

    @Autowired
    private StrategyRewardRepository strategyRewardRepository;

    @Autowired
    private ControlPlaneStateRepository controlPlaneStateRepository;

    @Test
    void upsertSnapshot_overwritesSamePostAndPhase() {
        metricSnapshotRepository.upsertSnapshot("post-1", CollectionPhase.T_PLUS_1H.name(), NOW,
                10L, 2L, null, 1L, 0L, 400L, null, 3.25, 1.0, "[]", true, "{}");
        metricSnapshotRepository.upsertSnapshot("post-1", CollectionPhase.T_PLUS_1H.name(), NOW.plusMinutes(20),
                25L, 4L, null, 3L, 1L, 900L, null, 3.55, 0.9, "[\"reply_ratio_high\"]", true, "{\"source\":\"test\"}");
        metricSnapshotRepository.upsertSnapshot("post-1", CollectionPhase.T_PLUS_6H.name(), NOW.plusHours(5),
                60L, 9L, null, 7L, 2L, 2400L, null, 3.17, 1.0, "[]", true, "{}");

        Integer rows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM metric_snapshots WHERE post_id = 'post-1'", Integer.class);
        assertEquals(2, rows);

        MetricSnapshot firstHour = metricSnapshotRepository
                .findByPostIdAndCollectionPhase("post-1", CollectionPhase.T_PLUS_1H)
                .orElseThrow();
        assertEquals(25L, firstHour.getLikes());
        assertEquals(900L, firstHour.getViews());
        assertEquals(0.9, firstHour.getConfidence(), 1e-9);
        assertEquals(List.of("reply_ratio_high"), firstHour.getAnomalies());
        assertEquals(Map.of("source", "test"), firstHour.getMetadata());

        MetricSnapshot latest = metricSnapshotRepository.findFirstByPostIdOrderByCollectedAtDesc("post-1").orElseThrow();
        assertEquals(CollectionPhase.T_PLUS_6H, latest.getCollectionPhase());
    }

    @Test
    void averageVerifiedEngagementSince_ignoresUnverifiedSnapshots() {
        metricSnapshotRepository.upsertSnapshot("post-2", CollectionPhase.T_PLUS_24H.name(), NOW,
                100L, 20L, null, 10L, 0L, 5000L, null, 2.6, 1.0, "[]", true, "{}");
        metricSnapshotRepository.upsertSnapshot("post-3", CollectionPhase.T_PLUS_24H.name(), NOW,
                50L, 10L, null, null, 0L, 2000L, null, 3.0, 1.0, "[]", true, "{}");
        metricSnapshotRepository.upsertSnapshot("post-4", CollectionPhase.T_PLUS_24H.name(), NOW,
                9000L, 0L, null, 0L, 0L, 9000L, null, 100.0, 0.0, "[\"likes_exceed_views\"]", false, "{}");

        Double average = metricSnapshotRepository.averageVerifiedEngagementSince(NOW.minusDays(1));

        assertEquals(95.0, average, 1e-9);
    }

    @Test
    void upsertReward_accumulatesSamplesPerStrategyVersion() {
        strategyRewardRepository.upsertReward("reply_fast", "2", 4.0, NOW);
        strategyRewardRepository.upsertReward("reply_fast", "2", 8.0, NOW.plusMinutes(5));
        strategyRewardRepository.upsertReward("reply_fast", "3", 1.0, NOW);

        StrategyRewardStats stats = strategyRewardRepository
                .findByStrategyIdAndStrategyVersion("reply_fast", "2")
                .orElseThrow();
        assertEquals(2L, stats.getSampleCount());
        assertEquals(12.0, stats.getTotalReward(), 1e-9);
        assertEquals(6.0, stats.getMeanReward(), 1e-9);

        List<StrategyRewardStats> ranked = strategyRewardRepository
                .findBySampleCountGreaterThanEqualOrderByMeanRewardDesc(1);
        assertEquals("2", ranked.get(0).getStrategyVersion());
        assertEquals(2, ranked.stream().filter(s -> s.getStrategyId().equals("reply_fast")).count());
    }

    @Test
    void expireActive_leavesRoomForExactlyOneActiveRow() {
        controlPlaneStateRepository.expireActive(NOW);
        assertEquals(0L, controlPlaneStateRepository.countByExpiresAtIsNull());

        ControlPlaneState next = new ControlPlaneState();
        next.setEffectiveAt(NOW);
        next.setAcceptanceThreshold(0.65);
        next.setExplorationRate(0.12);
        next.setTemplateWeights(Map.of("hot_take", 1.2));
        next.setPromptVersionWeights(Map.of("hot_take", Map.of("v2", 1.0)));
        next.setUpdatedBy("smoke_test");
        controlPlaneStateRepository.saveAndFlush(next);

        assertEquals(1L, controlPlaneStateRepository.countByExpiresAtIsNull());
        ControlPlaneState active = controlPlaneStateRepository.findFirstByExpiresAtIsNullOrderByEffectiveAtDesc()
                .orElseThrow();
        assertEquals(next.getId(), active.getId());
        assertEquals(Map.of("v2", 1.0), active.getPromptVersionWeights().get("hot_take"));
        assertFalse(controlPlaneStateRepository.findAllByOrderByEffectiveAtDesc(
                PageRequest.of(0, 10)).isEmpty());
    }

    @Test
    void tryAdvisoryTransactionLock_isReentrantWithinTransaction() {
        assertTrue(controlPlaneStateRepository.tryAdvisoryTransactionLock(7340021L));
        assertTrue(controlPlaneStateRepository.tryAdvisoryTransactionLock(7340021L));
    }
}
