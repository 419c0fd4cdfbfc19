package com.signalloop.service;

import com.signalloop.model.StrategyRewardStats;

import java.util.List;
import java.util.Optional;

/**
 * Aggregated reward per (strategy, version). Recording is best effort and never
 * throws to the caller.
 */
public interface StrategyRewardTracker {

    /**
     * Adds one reward sample: sample count +1, total += reward, mean recomputed.
     * Atomic per key where the backing store allows it.
     */
    void recordReward(String strategyId, String strategyVersion, double reward);

    Optional<StrategyRewardStats> getStats(String strategyId, String strategyVersion);

    /**
     * Strategies with at least {@code minSamples} samples, best mean reward first.
     */
    List<StrategyRewardStats> getStrategiesByReward(long minSamples);
}
