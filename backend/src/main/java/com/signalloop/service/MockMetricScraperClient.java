package com.signalloop.service;

import com.signalloop.model.ScrapedMetrics;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Deterministic scraper with fixture counters for local runs and demos.
 * Unknown post ids get plausible counters derived from the id.
 */
@Component
@ConditionalOnProperty(
        prefix = "signalloop.scraper",
        name = "mock",
        havingValue = "true",
        matchIfMissing = true
)
public class MockMetricScraperClient implements MetricScraperClient {

    static final String MISSING_PREFIX = "missing-";

    private static final Map<String, ScrapedMetrics> FIXTURES = Map.of(
            "1800000000000000001", new ScrapedMetrics(120L, 18L, 3L, 9L, 14L, 5_400L, 31L),
            "1800000000000000002", new ScrapedMetrics(42L, 5L, 0L, 6L, 3L, 2_100L, 8L),
            "1800000000000000003", new ScrapedMetrics(980L, 140L, 22L, 61L, 120L, 41_000L, 260L),
            "1800000000000000004", new ScrapedMetrics(7L, 0L, null, 1L, null, null, null)
    );

    @Override
    public ScrapedMetrics scrape(String postId) {
        if (postId == null || postId.isBlank() || postId.startsWith(MISSING_PREFIX)) {
            throw new ScrapeFailureException(postId, ScrapeFailureReason.NOT_FOUND,
                    "Post not found: " + postId);
        }
        ScrapedMetrics fixture = FIXTURES.get(postId);
        if (fixture != null) {
            return fixture;
        }
        long seed = Math.abs((long) postId.hashCode());
        long likes = 10 + seed % 400;
        long retweets = likes / 6;
        long replies = likes / 12;
        long bookmarks = likes / 9;
        long views = likes * 45 + seed % 1_000;
        return new ScrapedMetrics(likes, retweets, retweets / 4, replies, bookmarks, views, likes / 3);
    }

    @Override
    public Optional<String> captureEvidence(String postId) {
        return Optional.of("mock-evidence://" + postId);
    }
}
