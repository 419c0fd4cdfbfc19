package com.signalloop.service;

import com.signalloop.model.ScrapedMetrics;

import java.util.Optional;

/**
 * Boundary to whatever actually renders a post and reads its counters.
 * Implementations own their page/session resources; callers share nothing
 * across invocations.
 */
public interface MetricScraperClient {

    /**
     * Reads the current counters for a post. Any field of the result may be null.
     *
     * @param postId Platform post identifier
     * @return Best-effort measurement
     * @throws ScrapeFailureException when nothing could be read
     */
    ScrapedMetrics scrape(String postId);

    /**
     * Captures evidence (for example a page screenshot) for a suspicious
     * measurement. Best effort.
     *
     * @param postId Platform post identifier
     * @return Reference to the stored evidence, if any was captured
     */
    default Optional<String> captureEvidence(String postId) {
        return Optional.empty();
    }
}
