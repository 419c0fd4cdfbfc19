package com.signalloop.controller.dto;

import com.signalloop.model.StrategyRewardStats;

import java.time.OffsetDateTime;

public record StrategyRewardResponse(
        String strategyId,
        String strategyVersion,
        long sampleCount,
        double totalReward,
        double meanReward,
        OffsetDateTime updatedAt
) {
    public static StrategyRewardResponse from(StrategyRewardStats stats) {
        return new StrategyRewardResponse(
                stats.getStrategyId(),
                stats.getStrategyVersion(),
                stats.getSampleCount(),
                stats.getTotalReward(),
                stats.getMeanReward(),
                stats.getUpdatedAt()
        );
    }
}
