package com.signalloop.repository;

import com.signalloop.model.StrategyRewardStats;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface StrategyRewardRepository extends JpaRepository<StrategyRewardStats, Long> {

    Optional<StrategyRewardStats> findByStrategyIdAndStrategyVersion(String strategyId, String strategyVersion);

    List<StrategyRewardStats> findBySampleCountGreaterThanEqualOrderByMeanRewardDesc(long minSamples);

    @Modifying
    @Query(value = """
            INSERT INTO strategy_rewards (strategy_id, strategy_version, sample_count, total_reward, mean_reward, updated_at)
            VALUES (:strategyId, :strategyVersion, 1, :reward, :reward, :updatedAt)
            ON CONFLICT (strategy_id, strategy_version) DO UPDATE SET
                sample_count = strategy_rewards.sample_count + 1,
                total_reward = strategy_rewards.total_reward + EXCLUDED.total_reward,
                mean_reward = (strategy_rewards.total_reward + EXCLUDED.total_reward)
                        / (strategy_rewards.sample_count + 1),
                updated_at = EXCLUDED.updated_at
            """, nativeQuery = true)
    int upsertReward(@Param("strategyId") String strategyId,
                     @Param("strategyVersion") String strategyVersion,
                     @Param("reward") double reward,
                     @Param("updatedAt") OffsetDateTime updatedAt);
}
