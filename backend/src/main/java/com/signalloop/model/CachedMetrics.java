package com.signalloop.model;

import java.time.OffsetDateTime;

/**
 * Dedupe cache payload for a post within one UTC hour bucket.
 */
public record CachedMetrics(
        String postId,
        ScrapedMetrics metrics,
        double confidence,
        OffsetDateTime collectedAt
) {
}
