package com.signalloop.model;

import java.time.OffsetDateTime;

/**
 * A targeting/engagement opportunity with its raw, possibly incomplete,
 * feature inputs.
 */
public record Candidate(
        String candidateId,
        String authorHandle,
        String text,
        OffsetDateTime postedAt,
        Long likeCount,
        Long replyCount,
        Long retweetCount,
        Long views,
        Long authorFollowers,
        Double engagementRate,
        String strategyId,
        String strategyVersion
) {

    public StrategyKey strategyKey() {
        return StrategyKey.of(strategyId, strategyVersion);
    }

    /**
     * Explicit engagement rate when supplied, otherwise derived from views.
     * Null when neither is known.
     */
    public Double resolvedEngagementRate() {
        if (engagementRate != null) {
            return engagementRate;
        }
        if (views == null) {
            return null;
        }
        return MetricSnapshot.computeEngagementRate(likeCount, retweetCount, replyCount, views);
    }
}
