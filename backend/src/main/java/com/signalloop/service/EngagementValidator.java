package com.signalloop.service;

import com.signalloop.config.SignalLoopProperties;
import com.signalloop.model.MeasurementContext;
import com.signalloop.model.MetricSnapshot;
import com.signalloop.model.ScrapedMetrics;
import com.signalloop.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Plausibility checks for scraped engagement metrics.
 * <p>
 * Four independent checks run over every measurement: impossible values,
 * suspicious spikes against the previous snapshot, metric ratios, and
 * consistency with the account's trailing average. Each check contributes a
 * confidence; checks skipped for lack of context do not. A failed spike check
 * always blocks storage. The validator never
 * throws: an internal error yields a fail-open result that still recommends
 * storing the data.
 */
@Service
public class EngagementValidator {

    private static final Logger log = LoggerFactory.getLogger(EngagementValidator.class);
    private static final double FAIL_OPEN_CONFIDENCE = 0.5;

    private final SignalLoopProperties properties;

    public EngagementValidator(SignalLoopProperties properties) {
        this.properties = properties;
    }

    /**
     * Validates one measurement against its historical context.
     *
     * @param metrics The raw scraped measurement
     * @param context Optional follower count, account average, previous snapshot
     * @return Validation result with store and alert recommendations
     */
    public ValidationResult validate(ScrapedMetrics metrics, MeasurementContext context) {
        try {
            Objects.requireNonNull(metrics, "metrics is required");
            Objects.requireNonNull(context, "context is required");
            return evaluate(metrics, context);
        } catch (RuntimeException ex) {
            log.warn("Metric validation failed internally, storing with neutral confidence: {}",
                    ex.toString());
            return new ValidationResult(
                    false,
                    FAIL_OPEN_CONFIDENCE,
                    List.of("Validation error: " + resolveSafeMessage(ex)),
                    List.of(),
                    true,
                    false);
        }
    }

    private ValidationResult evaluate(ScrapedMetrics metrics, MeasurementContext context) {
        SignalLoopProperties.Validation thresholds = properties.getValidation();
        CheckResult spikes = checkSuspiciousSpikes(metrics, context, thresholds);
        List<CheckResult> checks = List.of(
                checkImpossibleValues(metrics, context, thresholds),
                spikes,
                checkMetricRatios(metrics, thresholds),
                checkHistoricalConsistency(metrics, context, thresholds));

        boolean valid = true;
        double confidenceSum = 0.0;
        int scoredChecks = 0;
        List<String> hard = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (CheckResult check : checks) {
            if (check.skipped()) {
                continue;
            }
            valid &= check.passed();
            confidenceSum += check.confidence();
            scoredChecks++;
            hard.addAll(check.anomalies());
            warnings.addAll(check.warnings());
        }

        double confidence = scoredChecks == 0 ? 1.0 : confidenceSum / scoredChecks;
        List<String> anomalies = new ArrayList<>(hard);
        anomalies.addAll(warnings);

        // A spike or a shrinking counter never overwrites the stored observation.
        boolean spikeRejected = !spikes.skipped() && !spikes.passed();
        boolean shouldStore = !spikeRejected && (valid || confidence >= thresholds.getStoreConfidence());
        boolean shouldAlert = !valid && confidence < thresholds.getAlertConfidence();
        return new ValidationResult(valid, confidence, anomalies, warnings, shouldStore, shouldAlert);
    }

    CheckResult checkImpossibleValues(
            ScrapedMetrics metrics,
            MeasurementContext context,
            SignalLoopProperties.Validation thresholds) {
        List<String> anomalies = new ArrayList<>();
        Long likes = metrics.likes();
        Long views = metrics.views();
        Long followers = context.accountFollowerCount();

        if (likes != null && followers != null && followers > 0
                && likes > thresholds.getMaxLikesPerFollower() * followers) {
            anomalies.add(String.format(Locale.ROOT,
                    "Likes (%d) exceed %.0fx follower count (%d)",
                    likes, thresholds.getMaxLikesPerFollower(), followers));
        }

        if (likes != null && views != null && views > 0) {
            double likeRate = (double) likes / views;
            if (likeRate > thresholds.getMaxLikeViewRate()) {
                anomalies.add(String.format(Locale.ROOT,
                        "Like rate %.1f%% exceeds maximum plausible %.1f%% of views",
                        likeRate * 100, thresholds.getMaxLikeViewRate() * 100));
            }
        }

        if (views != null) {
            long total = metrics.totalInteractions();
            if (total > views) {
                anomalies.add(String.format(Locale.ROOT,
                        "Total engagement (%d) exceeds views (%d)", total, views));
            }
        }

        Long retweets = metrics.retweets();
        if (retweets != null && likes != null
                && retweets > thresholds.getMaxRetweetsPerLike() * likes) {
            anomalies.add(String.format(Locale.ROOT,
                    "Retweets (%d) exceed %.0fx likes (%d)",
                    retweets, thresholds.getMaxRetweetsPerLike(), likes));
        }

        return CheckResult.of(anomalies, List.of(), thresholds);
    }

    CheckResult checkSuspiciousSpikes(
            ScrapedMetrics metrics,
            MeasurementContext context,
            SignalLoopProperties.Validation thresholds) {
        MetricSnapshot previous = context.previousSnapshot();
        if (previous == null) {
            return CheckResult.SKIPPED;
        }
        List<String> anomalies = new ArrayList<>();

        if (metrics.likes() != null && previous.getLikes() != null
                && previous.getCollectedAt() != null && context.measuredAt() != null) {
            long growth = metrics.likes() - previous.getLikes();
            double elapsedMinutes = Math.max(1.0,
                    Duration.between(previous.getCollectedAt(), context.measuredAt()).toMillis() / 60_000.0);
            double allowed = thresholds.getMaxLikesPerMinute() * elapsedMinutes;
            if (growth > allowed) {
                anomalies.add(String.format(Locale.ROOT,
                        "Like growth of %d in %.1f minutes exceeds realistic rate of %.0f likes/minute",
                        growth, elapsedMinutes, thresholds.getMaxLikesPerMinute()));
            }
        }

        addDecrease(anomalies, "likes", previous.getLikes(), metrics.likes());
        addDecrease(anomalies, "retweets", previous.getRetweets(), metrics.retweets());
        addDecrease(anomalies, "quote tweets", previous.getQuoteTweets(), metrics.quoteTweets());
        addDecrease(anomalies, "replies", previous.getReplies(), metrics.replies());
        addDecrease(anomalies, "bookmarks", previous.getBookmarks(), metrics.bookmarks());
        addDecrease(anomalies, "views", previous.getViews(), metrics.views());

        return CheckResult.of(anomalies, List.of(), thresholds);
    }

    CheckResult checkMetricRatios(ScrapedMetrics metrics, SignalLoopProperties.Validation thresholds) {
        List<String> anomalies = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (metrics.quoteTweets() != null && metrics.retweets() != null
                && metrics.quoteTweets() > thresholds.getMaxQuotesPerRetweet() * metrics.retweets()) {
            anomalies.add(String.format(Locale.ROOT,
                    "Quote tweets (%d) exceed %.0fx retweets (%d)",
                    metrics.quoteTweets(), thresholds.getMaxQuotesPerRetweet(), metrics.retweets()));
        }

        if (metrics.bookmarks() != null && metrics.likes() != null
                && metrics.bookmarks() > thresholds.getMaxBookmarksPerLike() * metrics.likes()) {
            anomalies.add(String.format(Locale.ROOT,
                    "Bookmarks (%d) exceed %.0fx likes (%d)",
                    metrics.bookmarks(), thresholds.getMaxBookmarksPerLike(), metrics.likes()));
        }

        if (metrics.replies() != null && metrics.likes() != null
                && metrics.likes() > thresholds.getReplyRatioMinLikes()) {
            double replyRatio = (double) metrics.replies() / metrics.likes();
            if (replyRatio > thresholds.getReplyRatioWarning()) {
                warnings.add(String.format(Locale.ROOT,
                        "Unusually high reply ratio (%.0f%% of likes) may indicate a controversial post or scrape error",
                        replyRatio * 100));
            }
        }

        return CheckResult.of(anomalies, warnings, thresholds);
    }

    CheckResult checkHistoricalConsistency(
            ScrapedMetrics metrics,
            MeasurementContext context,
            SignalLoopProperties.Validation thresholds) {
        Double average = context.accountAvgEngagement();
        if (average == null || average <= 0) {
            return CheckResult.SKIPPED;
        }
        long current = orZero(metrics.likes()) + orZero(metrics.retweets()) + orZero(metrics.replies());
        double ceiling = thresholds.getHistoricalMultiplier() * average;
        if (current > ceiling) {
            return CheckResult.of(List.of(), List.of(String.format(Locale.ROOT,
                    "Engagement (%d) is unusually high at %.1fx the account average (%.1f); may indicate virality",
                    current, current / average, average)), thresholds);
        }
        return CheckResult.of(List.of(), List.of(), thresholds);
    }

    private static void addDecrease(List<String> anomalies, String counter, Long previous, Long current) {
        if (previous != null && current != null && current < previous) {
            anomalies.add(String.format(Locale.ROOT,
                    "Counter %s decreased from %d to %d since the previous snapshot", counter, previous, current));
        }
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }

    private static String resolveSafeMessage(RuntimeException ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Outcome of a single check. A skipped check has no confidence.
     */
    record CheckResult(boolean skipped, boolean passed, List<String> anomalies, List<String> warnings, double confidence) {

        static final CheckResult SKIPPED = new CheckResult(true, true, List.of(), List.of(), Double.NaN);

        static CheckResult of(List<String> anomalies, List<String> warnings, SignalLoopProperties.Validation thresholds) {
            if (!anomalies.isEmpty()) {
                return new CheckResult(false, false, List.copyOf(anomalies), List.copyOf(warnings),
                        thresholds.getFailedCheckConfidence());
            }
            if (!warnings.isEmpty()) {
                return new CheckResult(false, true, List.of(), List.copyOf(warnings),
                        thresholds.getWarningCheckConfidence());
            }
            return new CheckResult(false, true, List.of(), List.of(), 1.0);
        }
    }
}
