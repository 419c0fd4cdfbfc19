package com.signalloop.model;

/**
 * Result of one {@code scrapeAndStore} invocation. {@code metrics} and
 * {@code validation} are null on scrape failure; {@code validation} is also
 * null on a cache hit.
 */
public record ScrapeOutcome(
        String postId,
        boolean success,
        ScrapedMetrics metrics,
        ValidationResult validation,
        String error,
        boolean cached,
        boolean stored
) {

    public static ScrapeOutcome cacheHit(String postId, ScrapedMetrics metrics) {
        return new ScrapeOutcome(postId, true, metrics, null, null, true, false);
    }

    public static ScrapeOutcome failure(String postId, String error) {
        return new ScrapeOutcome(postId, false, null, null, error, false, false);
    }

    public static ScrapeOutcome failure(String postId, ScrapedMetrics metrics, ValidationResult validation, String error) {
        return new ScrapeOutcome(postId, false, metrics, validation, error, false, false);
    }

    public static ScrapeOutcome completed(String postId, ScrapedMetrics metrics, ValidationResult validation, boolean stored) {
        return new ScrapeOutcome(postId, true, metrics, validation, null, false, stored);
    }
}
