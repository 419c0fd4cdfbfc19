package com.signalloop.model;

/**
 * Independent feature scores, each in [0, 1].
 */
public record ScoringComponents(
        double topicFit,
        double engagementVelocity,
        double authorInfluence,
        double recency,
        boolean topicFitFallbackUsed
) {
}
