package com.signalloop.service;

import com.signalloop.model.StrategyKey;
import com.signalloop.model.StrategyRewardStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local reward tracker for simulations and tests. Per-key updates are
 * atomic through {@link ConcurrentHashMap#compute}; stored values are replaced,
 * never mutated.
 */
@Service
@ConditionalOnProperty(
        prefix = "signalloop.rewards",
        name = "mode",
        havingValue = "in_memory"
)
public class InMemoryStrategyRewardTracker implements StrategyRewardTracker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStrategyRewardTracker.class);

    private final Map<StrategyKey, StrategyRewardStats> stats = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryStrategyRewardTracker(Clock clock) {
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
        stats.compute(key, (k, existing) -> {
            StrategyRewardStats updated = existing == null ? newStats(k) : existing.copy();
            updated.addSample(reward, now);
            return updated;
        });
    }

    @Override
    public Optional<StrategyRewardStats> getStats(String strategyId, String strategyVersion) {
        StrategyRewardStats current = stats.get(StrategyKey.of(strategyId, strategyVersion));
        return current == null ? Optional.empty() : Optional.of(snapshotOf(current));
    }

    @Override
    public List<StrategyRewardStats> getStrategiesByReward(long minSamples) {
        return stats.values().stream()
                .map(InMemoryStrategyRewardTracker::snapshotOf)
                .filter(s -> s.getSampleCount() >= minSamples)
                .sorted(Comparator.comparingDouble(StrategyRewardStats::getMeanReward).reversed()
                        .thenComparing(StrategyRewardStats::getStrategyId)
                        .thenComparing(StrategyRewardStats::getStrategyVersion))
                .toList();
    }

    private static StrategyRewardStats snapshotOf(StrategyRewardStats stored) {
        return stored.copy();
    }

    private static StrategyRewardStats newStats(StrategyKey key) {
        StrategyRewardStats created = new StrategyRewardStats();
        created.setStrategyId(key.strategyId());
        created.setStrategyVersion(key.strategyVersion());
        return created;
    }
}
