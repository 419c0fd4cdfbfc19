package com.signalloop.service;

import com.signalloop.config.SignalLoopProperties;
import com.signalloop.model.ControlPlaneSnapshot;
import com.signalloop.model.DecisionOutcome;
import com.signalloop.model.PolicyUpdateResult;
import com.signalloop.repository.DecisionOutcomeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PolicyUpdaterServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T04:15:00Z");
    private static final OffsetDateTime NOW_UTC = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private DecisionOutcomeRepository decisionOutcomeRepository;

    @Mock
    private ControlPlaneService controlPlaneService;

    private SignalLoopProperties properties;
    private PolicyUpdaterService policyUpdaterService;

    @BeforeEach
    void setUp() {
        properties = new SignalLoopProperties();
        policyUpdaterService = new PolicyUpdaterService(
                decisionOutcomeRepository, controlPlaneService, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void runPolicyUpdate_returnsUnchangedStateWhenNoRewardsInWindow() {
        ControlPlaneSnapshot active = active(0.6, 0.10, Map.of());
        when(controlPlaneService.getActiveState()).thenReturn(active);
        when(decisionOutcomeRepository.findByDecidedAtGreaterThanEqualAndRewardIsNotNull(NOW_UTC.minusDays(7)))
                .thenReturn(List.of());

        PolicyUpdateResult result = policyUpdaterService.runPolicyUpdate(false);

        assertFalse(result.updated());
        assertSame(result.before(), result.after());
        assertEquals(0, result.stats().decisionCount());
        verify(controlPlaneService, never()).transition(any(), anyString(), anyString());
    }

    @Test
    void runPolicyUpdate_untaggedRewardsMoveThresholdButNotTemplateWeights() {
        when(controlPlaneService.getActiveState()).thenReturn(active(0.6, 0.10, Map.of("listicle", 1.0)));
        when(decisionOutcomeRepository.findByDecidedAtGreaterThanEqualAndRewardIsNotNull(any()))
                .thenReturn(List.of(outcome(null, null, 6.0), outcome(" ", null, 6.0)));

        PolicyUpdateResult result = policyUpdaterService.runPolicyUpdate(true);

        assertEquals(2, result.stats().decisionCount());
        assertEquals(6.0, result.stats().overallAverageReward(), 1e-9);
        assertEquals(0.61, result.after().acceptanceThreshold(), 1e-9);
        assertEquals(0.09, result.after().explorationRate(), 1e-9);
        assertTrue(result.stats().templateAverageRewards().isEmpty());
        assertEquals(Map.of("listicle", 1.0), result.after().templateWeights());
    }

    @Test
    void runPolicyUpdate_untaggedRewardsCountTowardOverallAverage() {
        List<DecisionOutcome> outcomes = new ArrayList<>(highRewardOutcomes());
        outcomes.add(outcome(null, null, 0.0));
        when(controlPlaneService.getActiveState()).thenReturn(active(0.6, 0.10, Map.of()));
        when(decisionOutcomeRepository.findByDecidedAtGreaterThanEqualAndRewardIsNotNull(any()))
                .thenReturn(outcomes);

        PolicyUpdateResult result = policyUpdaterService.runPolicyUpdate(true);

        assertEquals(5, result.stats().decisionCount());
        assertEquals(4.8, result.stats().overallAverageReward(), 1e-9);
        assertEquals(0.6, result.after().acceptanceThreshold(), 1e-9);
        assertEquals(2, result.stats().templateSampleCounts().get("contrarian"));
    }

    @Test
    void runPolicyUpdate_dryRunComputesProposalWithoutWriting() {
        when(controlPlaneService.getActiveState()).thenReturn(active(0.6, 0.10, Map.of()));
        when(decisionOutcomeRepository.findByDecidedAtGreaterThanEqualAndRewardIsNotNull(any()))
                .thenReturn(highRewardOutcomes());

        PolicyUpdateResult result = policyUpdaterService.runPolicyUpdate(true);

        assertFalse(result.updated());
        assertTrue(result.dryRun());
        assertEquals(0.61, result.after().acceptanceThreshold(), 1e-9);
        assertEquals(0.11, result.after().explorationRate(), 1e-9);
        assertEquals(4.0 / 3.0, result.after().templateWeights().get("contrarian"), 1e-6);
        assertEquals(2.0 / 3.0, result.after().templateWeights().get("listicle"), 1e-6);
        assertEquals(6.0, result.stats().overallAverageReward(), 1e-9);
        assertEquals(5.28, result.stats().rewardVariance(), 1e-9);
        assertEquals(4, result.stats().decisionCount());
        verify(controlPlaneService, never()).transition(any(), anyString(), anyString());
    }

    @Test
    void runPolicyUpdate_transitionsControlPlaneAndReportsBeforeAndAfter() {
        ControlPlaneSnapshot before = active(0.6, 0.10, Map.of());
        when(controlPlaneService.getActiveState()).thenReturn(before);
        when(decisionOutcomeRepository.findByDecidedAtGreaterThanEqualAndRewardIsNotNull(any()))
                .thenReturn(highRewardOutcomes());
        when(controlPlaneService.transition(any(), eq(PolicyUpdaterService.ACTOR), anyString()))
                .thenAnswer(invocation -> {
                    ControlPlaneSnapshot next = invocation.getArgument(0);
                    return new ControlPlaneSnapshot(2L, NOW_UTC, null, next.acceptanceThreshold(),
                            next.explorationRate(), next.templateWeights(), next.promptVersionWeights(),
                            PolicyUpdaterService.ACTOR, invocation.getArgument(2));
                });

        PolicyUpdateResult result = policyUpdaterService.runPolicyUpdate(false);

        assertTrue(result.updated());
        assertFalse(result.dryRun());
        assertEquals(1L, result.before().id());
        assertEquals(2L, result.after().id());
        assertEquals(0.01, result.stats().thresholdDelta(), 1e-9);
        assertEquals(0.01, result.stats().explorationDelta(), 1e-9);
    }

    @Test
    void runPolicyUpdate_lowersThresholdAndExplorationForLowSteadyRewards() {
        when(controlPlaneService.getActiveState()).thenReturn(active(0.6, 0.10, Map.of()));
        when(decisionOutcomeRepository.findByDecidedAtGreaterThanEqualAndRewardIsNotNull(any()))
                .thenReturn(List.of(
                        outcome("contrarian", "v1", 0.5),
                        outcome("contrarian", "v1", 0.5),
                        outcome("listicle", "v2", 0.5)));

        PolicyUpdateResult result = policyUpdaterService.runPolicyUpdate(true);

        assertEquals(0.59, result.after().acceptanceThreshold(), 1e-9);
        assertEquals(0.09, result.after().explorationRate(), 1e-9);
    }

    @Test
    void runPolicyUpdate_keepsThresholdAndExplorationWithinBounds() {
        when(controlPlaneService.getActiveState()).thenReturn(active(0.9, 0.15, Map.of()));
        when(decisionOutcomeRepository.findByDecidedAtGreaterThanEqualAndRewardIsNotNull(any()))
                .thenReturn(highRewardOutcomes());

        PolicyUpdateResult result = policyUpdaterService.runPolicyUpdate(true);

        assertEquals(0.9, result.after().acceptanceThreshold(), 1e-9);
        assertEquals(0.15, result.after().explorationRate(), 1e-9);
        assertEquals(0.0, result.stats().thresholdDelta(), 1e-9);
    }

    @Test
    void runPolicyUpdate_derivesPromptVersionWeightsWithinTemplate() {
        when(controlPlaneService.getActiveState()).thenReturn(active(0.6, 0.10, Map.of()));
        when(decisionOutcomeRepository.findByDecidedAtGreaterThanEqualAndRewardIsNotNull(any()))
                .thenReturn(highRewardOutcomes());

        PolicyUpdateResult result = policyUpdaterService.runPolicyUpdate(true);

        Map<String, Double> contrarianVersions = result.after().promptVersionWeights().get("contrarian");
        assertEquals(1.2, contrarianVersions.get("v2"), 1e-6);
        assertEquals(0.8, contrarianVersions.get("v1"), 1e-6);
    }

    @Test
    void runPolicyUpdate_keepsUnobservedTemplatesAndRenormalizes() {
        when(controlPlaneService.getActiveState()).thenReturn(active(0.6, 0.10, Map.of("legacy", 2.0)));
        when(decisionOutcomeRepository.findByDecidedAtGreaterThanEqualAndRewardIsNotNull(any()))
                .thenReturn(highRewardOutcomes());

        PolicyUpdateResult result = policyUpdaterService.runPolicyUpdate(true);

        Map<String, Double> weights = result.after().templateWeights();
        assertTrue(weights.containsKey("legacy"));
        assertEquals(1.0, mean(weights), 1e-6);
    }

    @Test
    void runPolicyUpdate_wrapsDataAccessFailures() {
        when(controlPlaneService.getActiveState()).thenThrow(new QueryTimeoutException("statement timeout"));

        assertThrows(PolicyUpdateException.class, () -> policyUpdaterService.runPolicyUpdate(false));
    }

    @Test
    void normalizeWeights_meanIsOneAndEveryWeightWithinBounds() {
        Map<String, Double> raw = new LinkedHashMap<>();
        raw.put("a", 10.0);
        raw.put("b", 1.0);
        raw.put("c", 1.0);
        raw.put("d", 0.05);

        Map<String, Double> normalized = policyUpdaterService.normalizeWeights(raw);

        assertEquals(1.0, mean(normalized), 1e-6);
        normalized.values().forEach(weight -> assertTrue(weight >= 0.5 - 1e-9 && weight <= 2.0 + 1e-9,
                "weight out of range: " + weight));
        assertTrue(normalized.get("a") >= normalized.get("b"));
        assertTrue(normalized.get("b") >= normalized.get("d"));
    }

    @Test
    void normalizeWeights_leavesBalancedWeightsAtOne() {
        Map<String, Double> normalized = policyUpdaterService.normalizeWeights(Map.of("a", 3.0, "b", 3.0));

        assertEquals(1.0, normalized.get("a"), 1e-6);
        assertEquals(1.0, normalized.get("b"), 1e-6);
    }

    @Test
    void scheduledPolicyUpdate_skipsWhenDisabled() {
        properties.getPolicy().setEnabled(false);

        policyUpdaterService.scheduledPolicyUpdate();

        verify(controlPlaneService, never()).getActiveState();
    }

    private static List<DecisionOutcome> highRewardOutcomes() {
        return List.of(
                outcome("contrarian", "v1", 6.4),
                outcome("contrarian", "v2", 9.6),
                outcome("listicle", "v1", 4.0),
                outcome("listicle", null, 4.0));
    }

    private static ControlPlaneSnapshot active(double threshold, double exploration, Map<String, Double> weights) {
        return new ControlPlaneSnapshot(1L, NOW_UTC.minusDays(1), null, threshold, exploration,
                weights, Map.of(), ControlPlaneService.BOOTSTRAP_ACTOR, "initial default policy");
    }

    private static DecisionOutcome outcome(String templateId, String promptVersion, double reward) {
        DecisionOutcome outcome = new DecisionOutcome();
        outcome.setPostId("post-" + templateId + "-" + promptVersion + "-" + reward);
        outcome.setTemplateId(templateId);
        outcome.setPromptVersion(promptVersion);
        outcome.setReward(reward);
        outcome.setDecidedAt(NOW_UTC.minusDays(2));
        return outcome;
    }

    private static double mean(Map<String, Double> weights) {
        return weights.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
