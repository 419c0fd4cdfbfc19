package com.signalloop.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Aggregated reward per (strategy, version). {@code sampleCount} only grows.
 */
@Getter
@Setter
@Entity
@Table(name = "strategy_rewards", uniqueConstraints = @UniqueConstraint(
        name = "uq_strategy_rewards_strategy_version",
        columnNames = {"strategy_id", "strategy_version"}))
public class StrategyRewardStats {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "strategy_id", nullable = false, length = 128)
    private String strategyId;

    @Column(name = "strategy_version", nullable = false, length = 64)
    private String strategyVersion;

    @Column(name = "sample_count", nullable = false)
    private long sampleCount;

    @Column(name = "total_reward", nullable = false)
    private double totalReward;

    @Column(name = "mean_reward", nullable = false)
    private double meanReward;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public StrategyKey key() {
        return new StrategyKey(strategyId, strategyVersion);
    }

    /**
     * Folds one observed reward into the aggregate.
     */
    public void addSample(double reward, OffsetDateTime observedAt) {
        sampleCount += 1;
        totalReward += reward;
        meanReward = totalReward / sampleCount;
        updatedAt = observedAt;
    }

    public StrategyRewardStats copy() {
        StrategyRewardStats copy = new StrategyRewardStats();
        copy.setId(id);
        copy.setStrategyId(strategyId);
        copy.setStrategyVersion(strategyVersion);
        copy.setSampleCount(sampleCount);
        copy.setTotalReward(totalReward);
        copy.setMeanReward(meanReward);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }
}
