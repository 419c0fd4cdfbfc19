package com.signalloop.service;

import com.signalloop.config.SignalLoopProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Single retry policy for scraper calls: bounded attempts, exponential backoff
 * with random jitter, and a hard timeout per attempt. Non-retryable failures
 * (post not found) are surfaced immediately.
 */
@Component
public class ScrapeRetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(ScrapeRetryPolicy.class);

    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final ExecutorService attemptExecutor;

    public ScrapeRetryPolicy(
            SignalLoopProperties properties,
            @Qualifier("scrapeAttemptExecutor") ExecutorService attemptExecutor) {
        SignalLoopProperties.Retry retryProperties = properties.getRetry();
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, retryProperties.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        Duration.ofMillis(Math.max(1L, retryProperties.getBaseDelayMs())),
                        retryProperties.getMultiplier(),
                        retryProperties.getJitterFactor()))
                .retryOnException(ScrapeRetryPolicy::isRetryable)
                .build();
        this.retry = Retry.of("metric-scraper", retryConfig);
        this.retry.getEventPublisher().onRetry(event -> log.warn(
                "Scrape attempt {} failed, retrying in {} ms: {}",
                event.getNumberOfRetryAttempts(),
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().getMessage()));

        this.timeLimiter = TimeLimiter.of("metric-scraper", TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofSeconds(Math.max(1, properties.getIngestion().getScrapeTimeoutSeconds())))
                .cancelRunningFuture(true)
                .build());
        this.attemptExecutor = attemptExecutor;
    }

    /**
     * Runs a scrape under the retry and timeout policy.
     *
     * @param postId Post being scraped, for failure reporting
     * @param attempt One scrape attempt
     * @return The first successful attempt's result
     * @throws ScrapeFailureException after the last failed attempt
     */
    public <T> T execute(String postId, Supplier<T> attempt) {
        Supplier<T> timedAttempt = () -> runWithTimeout(postId, attempt);
        return Retry.decorateSupplier(retry, timedAttempt).get();
    }

    private <T> T runWithTimeout(String postId, Supplier<T> attempt) {
        try {
            return timeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(attempt, attemptExecutor));
        } catch (TimeoutException ex) {
            throw new ScrapeFailureException(postId, ScrapeFailureReason.TIMEOUT,
                    "Scrape timed out after " + timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toSeconds() + "s",
                    ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ScrapeFailureException(postId, ScrapeFailureReason.UNKNOWN, "Scrape interrupted", ex);
        } catch (Exception ex) {
            throw toScrapeFailure(postId, ex);
        }
    }

    private static ScrapeFailureException toScrapeFailure(String postId, Throwable ex) {
        Throwable cause = ex;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ScrapeFailureException) {
            return (ScrapeFailureException) cause;
        }
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new ScrapeFailureException(postId, ScrapeFailureReason.UNKNOWN, "Scrape failed: " + message, cause);
    }

    private static boolean isRetryable(Throwable ex) {
        if (ex instanceof ScrapeFailureException) {
            return ((ScrapeFailureException) ex).getReason().isRetryable();
        }
        return true;
    }
}
