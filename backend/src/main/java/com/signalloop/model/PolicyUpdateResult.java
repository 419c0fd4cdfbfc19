package com.signalloop.model;

import java.util.Map;

/**
 * Outcome of one policy update run. {@code after} is the would-be state on a
 * dry run and the persisted state otherwise; it equals {@code before} when
 * nothing changed.
 */
public record PolicyUpdateResult(
        boolean updated,
        boolean dryRun,
        ControlPlaneSnapshot before,
        ControlPlaneSnapshot after,
        Stats stats
) {

    public record Stats(
            int decisionCount,
            double overallAverageReward,
            double rewardVariance,
            Map<String, Double> templateAverageRewards,
            Map<String, Integer> templateSampleCounts,
            double thresholdDelta,
            double explorationDelta,
            String reason
    ) {

        public Stats {
            templateAverageRewards = templateAverageRewards == null ? Map.of() : Map.copyOf(templateAverageRewards);
            templateSampleCounts = templateSampleCounts == null ? Map.of() : Map.copyOf(templateSampleCounts);
        }

        public static Stats empty(String reason) {
            return new Stats(0, 0.0, 0.0, Map.of(), Map.of(), 0.0, 0.0, reason);
        }
    }
}
