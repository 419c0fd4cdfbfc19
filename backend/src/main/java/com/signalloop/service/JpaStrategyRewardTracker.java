package com.signalloop.service;

import com.signalloop.model.StrategyKey;
import com.signalloop.model.StrategyRewardStats;
import com.signalloop.repository.StrategyRewardRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Database-backed reward tracker. Increments are a single
 * {@code INSERT ... ON CONFLICT DO UPDATE}; if that statement fails the sample
 * is applied with a read-modify-write, which may lose a concurrent update.
 */
@Service
@ConditionalOnProperty(
        prefix = "signalloop.rewards",
        name = "mode",
        havingValue = "jpa",
        matchIfMissing = true
)
public class JpaStrategyRewardTracker implements StrategyRewardTracker {

    private static final Logger log = LoggerFactory.getLogger(JpaStrategyRewardTracker.class);

    private final StrategyRewardRepository strategyRewardRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JpaStrategyRewardTracker(
            StrategyRewardRepository strategyRewardRepository,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        this.strategyRewardRepository = strategyRewardRepository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    @Override
    public void recordReward(String strategyId, String strategyVersion, double reward) {
        if (!Double.isFinite(reward)) {
            log.warn("Ignoring non-finite reward {} for strategy {}/{}", reward, strategyId, strategyVersion);
            return;
        }
        StrategyKey key = StrategyKey.of(strategyId, strategyVersion);
        OffsetDateTime now = OffsetDateTime.now(clock);
        try {
            transactionTemplate.executeWithoutResult(status -> strategyRewardRepository.upsertReward(
                    key.strategyId(), key.strategyVersion(), reward, now));
            log.debug("Recorded reward {} for strategy {}", reward, key);
        } catch (RuntimeException atomicFailure) {
            log.warn("Atomic reward upsert failed for strategy {} ({}); falling back to read-modify-write",
                    key, atomicFailure.getMessage());
            recordWithReadModifyWrite(key, reward, now);
        }
    }

    private void recordWithReadModifyWrite(StrategyKey key, double reward, OffsetDateTime now) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                StrategyRewardStats stats = strategyRewardRepository
                        .findByStrategyIdAndStrategyVersion(key.strategyId(), key.strategyVersion())
                        .orElseGet(() -> {
                            StrategyRewardStats created = new StrategyRewardStats();
                            created.setStrategyId(key.strategyId());
                            created.setStrategyVersion(key.strategyVersion());
                            return created;
                        });
                stats.addSample(reward, now);
                strategyRewardRepository.save(stats);
            });
        } catch (RuntimeException ex) {
            log.warn("Dropping reward sample {} for strategy {}: {}", reward, key, ex.getMessage());
        }
    }

    @Override
    public Optional<StrategyRewardStats> getStats(String strategyId, String strategyVersion) {
        StrategyKey key = StrategyKey.of(strategyId, strategyVersion);
        return strategyRewardRepository.findByStrategyIdAndStrategyVersion(key.strategyId(), key.strategyVersion());
    }

    @Override
    public List<StrategyRewardStats> getStrategiesByReward(long minSamples) {
        return strategyRewardRepository.findBySampleCountGreaterThanEqualOrderByMeanRewardDesc(Math.max(0L, minSamples));
    }
}
