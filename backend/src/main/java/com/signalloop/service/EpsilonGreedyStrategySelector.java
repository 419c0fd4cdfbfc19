package com.signalloop.service;

import com.signalloop.config.SignalLoopProperties;
import com.signalloop.model.ControlPlaneSnapshot;
import com.signalloop.model.ScoredCandidate;
import com.signalloop.model.SelectionMode;
import com.signalloop.model.StrategyKey;
import com.signalloop.model.StrategyRewardStats;
import com.signalloop.model.StrategySelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Picks which strategy's candidates to act on this cycle.
 * <p>
 * With probability epsilon, and only when several strategies are present, a
 * strategy is explored uniformly at random. Otherwise the present strategy with
 * the best mean reward among those with enough samples is exploited. With no
 * qualified strategy present the top-scoring candidate's strategy is used.
 * A supplied seed makes the decision reproducible.
 */
@Service
public class EpsilonGreedyStrategySelector {

    private static final Logger log = LoggerFactory.getLogger(EpsilonGreedyStrategySelector.class);

    private final StrategyRewardTracker strategyRewardTracker;
    private final ControlPlaneService controlPlaneService;
    private final SignalLoopProperties properties;

    public EpsilonGreedyStrategySelector(
            StrategyRewardTracker strategyRewardTracker,
            ControlPlaneService controlPlaneService,
            SignalLoopProperties properties) {
        this.strategyRewardTracker = strategyRewardTracker;
        this.controlPlaneService = controlPlaneService;
        this.properties = properties;
    }

    /**
     * @param candidates Scored candidates, each tagged with a strategy
     * @param rngSeed Optional seed for a reproducible draw
     * @return Chosen strategy, mode, reason, and the candidates to act upon
     */
    public StrategySelection select(List<ScoredCandidate> candidates, Long rngSeed) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("At least one candidate is required for strategy selection");
        }
        DoubleSupplier random = randomSource(rngSeed);

        Map<StrategyKey, List<ScoredCandidate>> groups = new LinkedHashMap<>();
        for (ScoredCandidate candidate : candidates) {
            groups.computeIfAbsent(candidate.strategyKey(), k -> new ArrayList<>()).add(candidate);
        }

        double epsilon = effectiveEpsilon();
        double draw = random.getAsDouble();
        StrategyKey chosen;
        SelectionMode mode;
        String reason;

        if (draw < epsilon && groups.size() > 1) {
            List<StrategyKey> present = new ArrayList<>(groups.keySet());
            int index = (int) Math.min(present.size() - 1L, (long) (random.getAsDouble() * present.size()));
            chosen = present.get(index);
            mode = SelectionMode.EXPLORE;
            reason = String.format(Locale.ROOT,
                    "explore: draw %.4f < epsilon %.3f, picked uniformly among %d strategies",
                    draw, epsilon, present.size());
        } else {
            long minSamples = properties.getSelector().getMinSamples();
            StrategyRewardStats best = strategyRewardTracker.getStrategiesByReward(minSamples).stream()
                    .filter(stats -> groups.containsKey(stats.key()))
                    .findFirst()
                    .orElse(null);
            mode = SelectionMode.EXPLOIT;
            if (best != null) {
                chosen = best.key();
                reason = String.format(Locale.ROOT,
                        "exploit: best mean reward %.4f over %d samples",
                        best.getMeanReward(), best.getSampleCount());
            } else {
                ScoredCandidate top = candidates.stream()
                        .max(Comparator.comparingDouble(ScoredCandidate::totalScore))
                        .orElseThrow();
                chosen = top.strategyKey();
                reason = String.format(Locale.ROOT,
                        "fallback: no present strategy has %d+ samples, using top-scoring candidate %s (%.4f)",
                        minSamples, top.candidateId(), top.totalScore());
            }
        }

        List<ScoredCandidate> actedUpon = groups.getOrDefault(chosen, List.of());
        if (actedUpon.isEmpty()) {
            log.warn("Selected strategy {} matched no candidates, acting on all {}", chosen, candidates.size());
            actedUpon = candidates;
        }
        log.debug("Selected strategy {} ({}) for {} candidate(s): {}", chosen, mode, actedUpon.size(), reason);
        return new StrategySelection(chosen, mode, reason, actedUpon);
    }

    double effectiveEpsilon() {
        return controlPlaneService.cachedActiveState()
                .map(ControlPlaneSnapshot::explorationRate)
                .orElse(properties.getSelector().getEpsilon());
    }

    private static DoubleSupplier randomSource(Long rngSeed) {
        if (rngSeed == null) {
            return () -> ThreadLocalRandom.current().nextDouble();
        }
        LinearCongruentialRandom lcg = new LinearCongruentialRandom(rngSeed);
        return lcg::nextDouble;
    }
}
