package com.signalloop.service;

import com.signalloop.config.SignalLoopProperties;
import com.signalloop.model.Candidate;
import com.signalloop.model.ScoredCandidate;
import com.signalloop.model.ScoringComponents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.regex.Pattern;

/**
 * Ranks engagement candidates by a weighted sum of four independent feature
 * scores. Each feature tolerates missing inputs with a fixed neutral default.
 * Candidates are scored in parallel because topic fit may call out to an
 * embedding service.
 */
@Service
public class CandidateScorer {

    static final String PASSED_ALL_FILTERS = "passed_all_filters";

    private static final Logger log = LoggerFactory.getLogger(CandidateScorer.class);

    private static final double VELOCITY_LIKES_PER_MINUTE_CEILING = 10.0;
    private static final double VELOCITY_ENGAGEMENT_RATE_CEILING = 0.05;
    private static final double VELOCITY_DEFAULT = 0.3;
    private static final double AUTHOR_FOLLOWER_LOG_CEILING = 6.0;
    private static final double AUTHOR_LIKES_LOG_CEILING = 4.0;
    private static final double AUTHOR_DEFAULT = 0.2;
    private static final double RECENCY_DEFAULT = 0.9;

    private static final List<String> PARODY_KEYWORDS = List.of("parody", "satire", "joke", "meme", "humor");
    private static final List<Pattern> SPAM_PATTERNS = List.of(
            Pattern.compile("buy now", Pattern.CASE_INSENSITIVE),
            Pattern.compile("click here", Pattern.CASE_INSENSITIVE),
            Pattern.compile("limited time", Pattern.CASE_INSENSITIVE),
            Pattern.compile("act now", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\$\\$\\$"),
            Pattern.compile("free money", Pattern.CASE_INSENSITIVE),
            Pattern.compile("guaranteed", Pattern.CASE_INSENSITIVE)
    );

    private final SignalLoopProperties properties;
    private final TopicFitScorer topicFitScorer;
    private final ExecutorService scoringExecutor;
    private final Clock clock;

    public CandidateScorer(
            SignalLoopProperties properties,
            TopicFitScorer topicFitScorer,
            @Qualifier("scoringExecutor") ExecutorService scoringExecutor,
            Clock clock) {
        properties.getScoring().validateWeights();
        this.properties = properties;
        this.topicFitScorer = topicFitScorer;
        this.scoringExecutor = scoringExecutor;
        this.clock = clock;
    }

    /**
     * Scores candidates and returns the eligible top-K, best first.
     *
     * @param candidates Candidates to rank
     * @return At most {@code scoring.top-k} eligible candidates sorted by total score
     */
    public List<ScoredCandidate> score(List<Candidate> candidates) {
        int topK = Math.max(0, properties.getScoring().getTopK());
        List<ScoredCandidate> ranked = scoreAll(candidates).stream()
                .filter(ScoredCandidate::eligible)
                .limit(topK)
                .toList();
        log.debug("Scored {} candidate(s), returning top {}", candidates.size(), ranked.size());
        return ranked;
    }

    /**
     * Scores every candidate, eligible or not, sorted by total score descending.
     */
    public List<ScoredCandidate> scoreAll(List<Candidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<CompletableFuture<ScoredCandidate>> futures = candidates.stream()
                .map(candidate -> CompletableFuture.supplyAsync(() -> scoreOne(candidate, now), scoringExecutor))
                .toList();
        List<ScoredCandidate> scored = new ArrayList<>(futures.size());
        for (CompletableFuture<ScoredCandidate> future : futures) {
            scored.add(future.join());
        }
        scored.sort(Comparator.comparingDouble(ScoredCandidate::totalScore).reversed()
                .thenComparing(sc -> sc.candidateId() == null ? "" : sc.candidateId()));
        return scored;
    }

    ScoredCandidate scoreOne(Candidate candidate, OffsetDateTime now) {
        Double ageMinutes = ageMinutes(candidate.postedAt(), now);
        long predictedViews = predict24hViews(candidate, ageMinutes);
        int tier = predictedTier(predictedViews);

        List<String> filterReasons = hardFilterReasons(candidate);
        if (!filterReasons.isEmpty()) {
            ScoringComponents zero = new ScoringComponents(0.0, 0.0, 0.0, 0.0, false);
            return new ScoredCandidate(candidate, zero, 0.0, false,
                    String.join(",", filterReasons), predictedViews, tier);
        }

        TopicFitScorer.TopicFit topicFit = topicFitScorer.score(candidate.text());
        ScoringComponents components = new ScoringComponents(
                topicFit.score(),
                engagementVelocity(candidate, ageMinutes),
                authorInfluence(candidate),
                recency(ageMinutes),
                topicFit.fallbackUsed());

        SignalLoopProperties.Weights weights = properties.getScoring().getWeights();
        double total = weights.getTopicFit() * components.topicFit()
                + weights.getEngagementVelocity() * components.engagementVelocity()
                + weights.getAuthorInfluence() * components.authorInfluence()
                + weights.getRecency() * components.recency();
        return new ScoredCandidate(candidate, components, clamp(total), true,
                PASSED_ALL_FILTERS, predictedViews, tier);
    }

    double engagementVelocity(Candidate candidate, Double ageMinutes) {
        if (ageMinutes != null && candidate.likeCount() != null) {
            double elapsed = Math.max(1.0, ageMinutes);
            return clamp((candidate.likeCount() / elapsed) / VELOCITY_LIKES_PER_MINUTE_CEILING);
        }
        Double engagementRate = candidate.resolvedEngagementRate();
        if (engagementRate != null) {
            return clamp(engagementRate / VELOCITY_ENGAGEMENT_RATE_CEILING);
        }
        return VELOCITY_DEFAULT;
    }

    double authorInfluence(Candidate candidate) {
        if (candidate.authorFollowers() != null) {
            return clamp(Math.log10(Math.max(1L, candidate.authorFollowers())) / AUTHOR_FOLLOWER_LOG_CEILING);
        }
        if (candidate.likeCount() != null) {
            return clamp(Math.log10(Math.max(1L, candidate.likeCount())) / AUTHOR_LIKES_LOG_CEILING);
        }
        return AUTHOR_DEFAULT;
    }

    double recency(Double ageMinutes) {
        if (ageMinutes == null) {
            return RECENCY_DEFAULT;
        }
        double maxAge = properties.getScoring().getMaxAgeMinutes();
        if (maxAge <= 0) {
            return ageMinutes <= 0 ? 1.0 : 0.0;
        }
        return clamp(1.0 - Math.max(0.0, ageMinutes) / maxAge);
    }

    static double spamScore(String text) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        long matches = SPAM_PATTERNS.stream().filter(p -> p.matcher(text).find()).count();
        return Math.min(1.0, (double) matches / SPAM_PATTERNS.size() * 2);
    }

    static boolean isParody(Candidate candidate) {
        return containsParodyKeyword(candidate.authorHandle()) || containsParodyKeyword(candidate.text());
    }

    private List<String> hardFilterReasons(Candidate candidate) {
        List<String> reasons = new ArrayList<>();
        if (isParody(candidate)) {
            reasons.add("parody_account");
        }
        double spam = spamScore(candidate.text());
        if (spam > properties.getScoring().getSpamThreshold()) {
            reasons.add(String.format(Locale.ROOT, "high_spam_score_%.2f", spam));
        }
        return reasons;
    }

    /**
     * Rough 24h view estimate: total engagement times a multiplier that grows
     * with engagement per minute.
     */
    static long predict24hViews(Candidate candidate, Double ageMinutes) {
        long engagement = orZero(candidate.likeCount()) + orZero(candidate.replyCount())
                + orZero(candidate.retweetCount());
        if (ageMinutes == null) {
            return engagement * 10;
        }
        double perMinute = engagement / Math.max(1.0, ageMinutes);
        int multiplier = perMinute > 1 ? 50 : perMinute > 0.5 ? 30 : 10;
        return engagement * multiplier;
    }

    static int predictedTier(long predictedViews) {
        if (predictedViews >= 5_000) {
            return 1;
        }
        if (predictedViews >= 1_000) {
            return 2;
        }
        if (predictedViews >= 500) {
            return 3;
        }
        return 4;
    }

    private static Double ageMinutes(OffsetDateTime postedAt, OffsetDateTime now) {
        if (postedAt == null) {
            return null;
        }
        return Math.max(0.0, Duration.between(postedAt, now).toMillis() / 60_000.0);
    }

    private static boolean containsParodyKeyword(String value) {
        if (value == null) {
            return false;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        return PARODY_KEYWORDS.stream().anyMatch(lower::contains);
    }

    private static long orZero(Long value) {
        return value == null ? 0L : Math.max(0L, value);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
