package com.signalloop.service;

import com.signalloop.config.SignalLoopProperties;
import com.signalloop.model.ControlPlaneSnapshot;
import com.signalloop.model.DecisionOutcome;
import com.signalloop.model.PolicyUpdateResult;
import com.signalloop.repository.DecisionOutcomeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Batch job folding recent decision rewards into the control-plane state.
 * <p>
 * Template weights follow each template's average reward relative to the
 * overall average, clamped to the configured weight range and rescaled so the
 * weights average 1.0. Prompt-version weights are derived the same way within
 * each template. The acceptance threshold and exploration rate move by one
 * small step per run and stay within their configured bounds.
 */
@Service
public class PolicyUpdaterService {

    static final String ACTOR = "policy_updater";

    private static final Logger log = LoggerFactory.getLogger(PolicyUpdaterService.class);
    private static final int NORMALIZATION_ITERATIONS = 200;

    private final DecisionOutcomeRepository decisionOutcomeRepository;
    private final ControlPlaneService controlPlaneService;
    private final SignalLoopProperties properties;
    private final Clock clock;
    private final ReentrantLock runLock = new ReentrantLock();

    public PolicyUpdaterService(
            DecisionOutcomeRepository decisionOutcomeRepository,
            ControlPlaneService controlPlaneService,
            SignalLoopProperties properties,
            Clock clock) {
        this.decisionOutcomeRepository = decisionOutcomeRepository;
        this.controlPlaneService = controlPlaneService;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${signalloop.policy.cron:0 15 4 * * *}")
    public void scheduledPolicyUpdate() {
        if (!properties.getPolicy().isEnabled()) {
            log.debug("Scheduled policy update skipped: policy updates disabled");
            return;
        }
        try {
            runPolicyUpdate(false);
        } catch (PolicyUpdateException ex) {
            log.error("Scheduled policy update failed; active policy left unchanged", ex);
        }
    }

    /**
     * Recomputes the policy from the lookback window.
     *
     * @param dryRun When true, compute and return the would-be state without writing
     * @return Before/after states plus the statistics behind them
     * @throws PolicyUpdateException when the run cannot complete
     */
    public PolicyUpdateResult runPolicyUpdate(boolean dryRun) {
        if (!runLock.tryLock()) {
            throw new PolicyUpdateException("A policy update is already running");
        }
        try {
            return doRunPolicyUpdate(dryRun);
        } catch (DataAccessException ex) {
            throw new PolicyUpdateException("Policy update failed: " + ex.getMessage(), ex);
        } finally {
            runLock.unlock();
        }
    }

    private PolicyUpdateResult doRunPolicyUpdate(boolean dryRun) {
        SignalLoopProperties.Policy policy = properties.getPolicy();
        ControlPlaneSnapshot before = controlPlaneService.getActiveState();
        OffsetDateTime since = OffsetDateTime.now(clock).minusDays(policy.getLookbackDays());

        List<DecisionOutcome> outcomes = decisionOutcomeRepository
                .findByDecidedAtGreaterThanEqualAndRewardIsNotNull(since).stream()
                .filter(o -> o.getReward() != null && Double.isFinite(o.getReward()))
                .toList();
        if (outcomes.isEmpty()) {
            String reason = "no reward-bearing decisions in the last " + policy.getLookbackDays() + " days";
            log.info("Policy update skipped: {}", reason);
            return new PolicyUpdateResult(false, dryRun, before, before, PolicyUpdateResult.Stats.empty(reason));
        }

        List<Double> allRewards = outcomes.stream().map(DecisionOutcome::getReward).toList();
        double overallAverage = mean(allRewards);
        double variance = variance(allRewards, overallAverage);

        Map<String, List<Double>> byTemplate = new TreeMap<>();
        Map<String, Map<String, List<Double>>> byTemplateAndVersion = new TreeMap<>();
        for (DecisionOutcome outcome : outcomes) {
            // Untagged decisions count toward the threshold and exploration only.
            if (outcome.getTemplateId() == null || outcome.getTemplateId().isBlank()) {
                continue;
            }
            String template = outcome.getTemplateId().trim();
            byTemplate.computeIfAbsent(template, k -> new ArrayList<>()).add(outcome.getReward());
            if (outcome.getPromptVersion() != null && !outcome.getPromptVersion().isBlank()) {
                byTemplateAndVersion
                        .computeIfAbsent(template, k -> new TreeMap<>())
                        .computeIfAbsent(outcome.getPromptVersion().trim(), k -> new ArrayList<>())
                        .add(outcome.getReward());
            }
        }

        Map<String, Double> templateAverages = new LinkedHashMap<>();
        Map<String, Integer> templateCounts = new LinkedHashMap<>();
        Map<String, Double> observedTemplateWeights = new LinkedHashMap<>();
        byTemplate.forEach((template, rewards) -> {
            double average = mean(rewards);
            templateAverages.put(template, average);
            templateCounts.put(template, rewards.size());
            observedTemplateWeights.put(template, clampWeight(relativePerformance(average, overallAverage)));
        });

        Map<String, Double> mergedTemplateWeights = new LinkedHashMap<>(before.templateWeights());
        mergedTemplateWeights.putAll(observedTemplateWeights);
        Map<String, Double> templateWeights = normalizeWeights(mergedTemplateWeights);

        Map<String, Map<String, Double>> promptVersionWeights = new LinkedHashMap<>();
        before.promptVersionWeights().forEach((template, weights) ->
                promptVersionWeights.put(template, new LinkedHashMap<>(weights)));
        byTemplateAndVersion.forEach((template, versions) -> {
            double templateAverage = templateAverages.get(template);
            Map<String, Double> merged = new LinkedHashMap<>(promptVersionWeights.getOrDefault(template, Map.of()));
            versions.forEach((version, rewards) ->
                    merged.put(version, clampWeight(relativePerformance(mean(rewards), templateAverage))));
            promptVersionWeights.put(template, normalizeWeights(merged));
        });

        double thresholdStep = 0.0;
        if (overallAverage >= policy.getHighRewardThreshold()) {
            thresholdStep = policy.getThresholdStep();
        } else if (overallAverage <= policy.getLowRewardThreshold()) {
            thresholdStep = -policy.getThresholdStep();
        }
        double threshold = clamp(before.acceptanceThreshold() + thresholdStep,
                policy.getMinThreshold(), policy.getMaxThreshold());

        double explorationStep = 0.0;
        if (variance >= policy.getHighVarianceThreshold()) {
            explorationStep = policy.getExplorationStep();
        } else if (variance <= policy.getLowVarianceThreshold()) {
            explorationStep = -policy.getExplorationStep();
        }
        double explorationRate = clamp(before.explorationRate() + explorationStep,
                policy.getMinExploration(), policy.getMaxExploration());

        String reason = String.format(Locale.ROOT,
                "%d decisions over %d days: avg reward %.3f, variance %.3f, %d template(s)",
                outcomes.size(), policy.getLookbackDays(), overallAverage, variance, byTemplate.size());
        PolicyUpdateResult.Stats stats = new PolicyUpdateResult.Stats(
                outcomes.size(),
                overallAverage,
                variance,
                templateAverages,
                templateCounts,
                threshold - before.acceptanceThreshold(),
                explorationRate - before.explorationRate(),
                reason);
        ControlPlaneSnapshot proposed = new ControlPlaneSnapshot(
                null, null, null, threshold, explorationRate,
                templateWeights, promptVersionWeights, ACTOR, reason);

        if (dryRun) {
            log.info("Policy update dry run: {} (threshold {} -> {}, exploration {} -> {})",
                    reason, before.acceptanceThreshold(), threshold, before.explorationRate(), explorationRate);
            return new PolicyUpdateResult(false, true, before, proposed, stats);
        }

        ControlPlaneSnapshot after = controlPlaneService.transition(proposed, ACTOR, reason);
        log.info("Policy updated: {} (threshold {} -> {}, exploration {} -> {}, state {} -> {})",
                reason, before.acceptanceThreshold(), threshold, before.explorationRate(), explorationRate,
                before.id(), after.id());
        return new PolicyUpdateResult(true, false, before, after, stats);
    }

    /**
     * Rescales weights so their mean is 1.0 while every weight stays within the
     * configured range. Clamping after scaling is monotone in the scale factor,
     * so the factor is found by bisection.
     */
    Map<String, Double> normalizeWeights(Map<String, Double> weights) {
        if (weights.isEmpty()) {
            return new LinkedHashMap<>();
        }
        double minWeight = properties.getPolicy().getMinWeight();
        double maxWeight = properties.getPolicy().getMaxWeight();
        Map<String, Double> sanitized = new LinkedHashMap<>();
        weights.forEach((key, value) -> sanitized.put(key,
                value == null || !Double.isFinite(value) || value <= 0 ? 1.0 : value));

        double smallest = sanitized.values().stream().mapToDouble(Double::doubleValue).min().orElse(1.0);
        double low = 0.0;
        double high = maxWeight / smallest;
        for (int i = 0; i < NORMALIZATION_ITERATIONS; i++) {
            double mid = (low + high) / 2;
            if (scaledMean(sanitized.values(), mid, minWeight, maxWeight) < 1.0) {
                low = mid;
            } else {
                high = mid;
            }
        }
        double scale = (low + high) / 2;
        Map<String, Double> normalized = new LinkedHashMap<>();
        sanitized.forEach((key, value) -> normalized.put(key, clamp(value * scale, minWeight, maxWeight)));
        return normalized;
    }

    private static double scaledMean(Collection<Double> weights, double scale, double min, double max) {
        double sum = 0.0;
        for (double weight : weights) {
            sum += clamp(weight * scale, min, max);
        }
        return sum / weights.size();
    }

    private double clampWeight(double weight) {
        return clamp(weight, properties.getPolicy().getMinWeight(), properties.getPolicy().getMaxWeight());
    }

    private static double relativePerformance(double average, double baseline) {
        if (baseline <= 0.0) {
            return 1.0;
        }
        return average / baseline;
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static double variance(List<Double> values, double mean) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            double diff = value - mean;
            sum += diff * diff;
        }
        return sum / values.size();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
