package com.signalloop.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for telemetry ingestion, validation, candidate scoring and the
 * strategy learning loop. The validator thresholds are empirically chosen
 * defaults and are expected to be tuned per account.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "signalloop")
public class SignalLoopProperties {

    private Account account = new Account();
    private Validation validation = new Validation();
    private Ingestion ingestion = new Ingestion();
    private Scraper scraper = new Scraper();
    private Cache cache = new Cache();
    private Retry retry = new Retry();
    private Scoring scoring = new Scoring();
    private Embedding embedding = new Embedding();
    private Selector selector = new Selector();
    private Rewards rewards = new Rewards();
    private Policy policy = new Policy();

    @Getter
    @Setter
    public static class Account {
        /**
         * Follower count of the publishing account, used when a scrape request
         * carries no follower context of its own.
         */
        private Long followerCount;

        /**
         * Trailing window for the account's average engagement.
         */
        private int averageEngagementWindowDays = 30;
    }

    @Getter
    @Setter
    public static class Validation {
        private double maxLikesPerFollower = 20.0;
        private double maxLikeViewRate = 0.5;
        private double maxRetweetsPerLike = 3.0;
        private double maxQuotesPerRetweet = 2.0;
        private double maxBookmarksPerLike = 2.0;
        private double replyRatioWarning = 0.5;
        private long replyRatioMinLikes = 100;
        private double maxLikesPerMinute = 20.0;
        private double historicalMultiplier = 50.0;
        private double storeConfidence = 0.7;
        private double alertConfidence = 0.5;
        private double cacheConfidence = 0.8;
        private double failedCheckConfidence = 0.0;
        private double warningCheckConfidence = 0.8;
    }

    @Getter
    @Setter
    public static class Ingestion {
        private boolean enabled = true;
        private boolean runOnStartup = false;
        private long intervalMs = 600_000;
        private long initialDelayMs = 60_000;
        private int recentWindowHours = 72;
        private int historicalWindowDays = 30;
        private int recentBatchSize = 15;
        private int historicalBatchSize = 5;
        private int concurrency = 4;
        private int scrapeTimeoutSeconds = 30;
        private String rewardPhase = "T_PLUS_24H";
    }

    @Getter
    @Setter
    public static class Scraper {
        /**
         * Use the deterministic fixture scraper instead of a live collaborator.
         */
        private boolean mock = true;
    }

    @Getter
    @Setter
    public static class Cache {
        private String mode = "redis";
        private String keyPrefix = "signalloop:metrics";
        private long ttlSeconds = 3_600;
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 3;
        private long baseDelayMs = 2_000;
        private double multiplier = 2.0;
        private double jitterFactor = 0.5;
    }

    @Getter
    @Setter
    public static class Scoring {
        private int topK = 10;
        private double maxAgeMinutes = 60.0;
        private int minTextLength = 20;
        private double spamThreshold = 0.7;
        private int workerThreads = 8;
        private Weights weights = new Weights();
        private List<String> topicAnchors = new ArrayList<>(List.of(
                "health and fitness research",
                "nutrition, diet and metabolism",
                "sleep, recovery and longevity",
                "exercise physiology and strength training"
        ));

        /**
         * Fails fast when the component weights do not sum to one.
         */
        public void validateWeights() {
            double sum = weights.getTopicFit()
                    + weights.getEngagementVelocity()
                    + weights.getAuthorInfluence()
                    + weights.getRecency();
            if (Math.abs(sum - 1.0) > 1e-6) {
                throw new IllegalStateException(
                        "signalloop.scoring.weights must sum to 1.0 but sum to " + sum);
            }
            if (weights.getTopicFit() < 0 || weights.getEngagementVelocity() < 0
                    || weights.getAuthorInfluence() < 0 || weights.getRecency() < 0) {
                throw new IllegalStateException("signalloop.scoring.weights must not be negative");
            }
        }
    }

    @Getter
    @Setter
    public static class Weights {
        private double topicFit = 0.25;
        private double engagementVelocity = 0.35;
        private double authorInfluence = 0.25;
        private double recency = 0.15;
    }

    @Getter
    @Setter
    public static class Embedding {
        private boolean enabled = false;
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "text-embedding-3-small";
        private long timeoutMs = 3_000;
        private long warnIntervalSeconds = 60;
    }

    @Getter
    @Setter
    public static class Selector {
        private double epsilon = 0.10;
        private long minSamples = 20;
    }

    @Getter
    @Setter
    public static class Rewards {
        /**
         * Reward store backing: "jpa" or "in_memory".
         */
        private String mode = "jpa";
        private double maxReward = 10.0;
    }

    @Getter
    @Setter
    public static class Policy {
        private boolean enabled = true;
        private String cron = "0 15 4 * * *";
        private int lookbackDays = 7;
        private double highRewardThreshold = 5.0;
        private double lowRewardThreshold = 1.0;
        private double thresholdStep = 0.01;
        private double minThreshold = 0.3;
        private double maxThreshold = 0.9;
        private double highVarianceThreshold = 4.0;
        private double lowVarianceThreshold = 0.25;
        private double explorationStep = 0.01;
        private double minExploration = 0.05;
        private double maxExploration = 0.15;
        private double minWeight = 0.5;
        private double maxWeight = 2.0;
        private double defaultAcceptanceThreshold = 0.6;
        private double defaultExplorationRate = 0.10;
        private long advisoryLockKey = 7_340_021L;
    }
}
