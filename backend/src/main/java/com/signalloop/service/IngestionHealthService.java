package com.signalloop.service;

import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Aggregate ingestion counters since process start. Operators see rates, not
 * per-post failures.
 */
@Service
public class IngestionHealthService {

    private final AtomicLong scrapeAttempts = new AtomicLong();
    private final AtomicLong scrapeSuccesses = new AtomicLong();
    private final AtomicLong validations = new AtomicLong();
    private final AtomicLong validationPasses = new AtomicLong();
    private final AtomicLong stores = new AtomicLong();
    private final AtomicLong persistenceFailures = new AtomicLong();
    private final AtomicLong alerts = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();

    public void recordScrapeAttempt(boolean success) {
        scrapeAttempts.incrementAndGet();
        if (success) {
            scrapeSuccesses.incrementAndGet();
        }
    }

    public void recordValidation(boolean valid) {
        validations.incrementAndGet();
        if (valid) {
            validationPasses.incrementAndGet();
        }
    }

    public void recordStore() {
        stores.incrementAndGet();
    }

    public void recordPersistenceFailure() {
        persistenceFailures.incrementAndGet();
    }

    public void recordAlert() {
        alerts.incrementAndGet();
    }

    public void recordCacheHit() {
        cacheHits.incrementAndGet();
    }

    public HealthSnapshot snapshot() {
        long attempts = scrapeAttempts.get();
        long successes = scrapeSuccesses.get();
        long validated = validations.get();
        long passed = validationPasses.get();
        return new HealthSnapshot(
                attempts,
                successes,
                rate(successes, attempts),
                validated,
                passed,
                rate(passed, validated),
                stores.get(),
                persistenceFailures.get(),
                alerts.get(),
                cacheHits.get());
    }

    private static double rate(long numerator, long denominator) {
        return denominator == 0 ? 1.0 : (double) numerator / denominator;
    }

    public record HealthSnapshot(
            long scrapeAttempts,
            long scrapeSuccesses,
            double scrapeSuccessRate,
            long validations,
            long validationPasses,
            double validationPassRate,
            long stores,
            long persistenceFailures,
            long alerts,
            long cacheHits
    ) {
    }
}
