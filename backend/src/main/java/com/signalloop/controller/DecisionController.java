package com.signalloop.controller;

import com.signalloop.controller.dto.DecisionRequests;
import com.signalloop.controller.dto.StrategyRewardResponse;
import com.signalloop.model.ScoredCandidate;
import com.signalloop.model.StrategySelection;
import com.signalloop.service.CandidateScorer;
import com.signalloop.service.EpsilonGreedyStrategySelector;
import com.signalloop.service.StrategyRewardTracker;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for candidate scoring and strategy selection.
 */
@RestController
@RequestMapping("/api")
public class DecisionController {

    private final CandidateScorer candidateScorer;
    private final EpsilonGreedyStrategySelector strategySelector;
    private final StrategyRewardTracker strategyRewardTracker;

    public DecisionController(
            CandidateScorer candidateScorer,
            EpsilonGreedyStrategySelector strategySelector,
            StrategyRewardTracker strategyRewardTracker) {
        this.candidateScorer = candidateScorer;
        this.strategySelector = strategySelector;
        this.strategyRewardTracker = strategyRewardTracker;
    }

    @PostMapping("/decisions/score")
    public ResponseEntity<List<ScoredCandidate>> score(
            @Valid @RequestBody DecisionRequests.CandidateBatchRequest request) {
        return ResponseEntity.ok(candidateScorer.score(request.toCandidates()));
    }

    /**
     * Scores the candidates and picks the strategy to act on.
     *
     * @param seed Optional seed for a reproducible selection
     */
    @PostMapping("/decisions/select")
    public ResponseEntity<StrategySelection> select(
            @RequestParam(required = false) Long seed,
            @Valid @RequestBody DecisionRequests.CandidateBatchRequest request) {
        List<ScoredCandidate> scored = candidateScorer.score(request.toCandidates());
        if (scored.isEmpty()) {
            throw new IllegalArgumentException("No eligible candidates to select from");
        }
        return ResponseEntity.ok(strategySelector.select(scored, seed));
    }

    @GetMapping("/strategies/rewards")
    public ResponseEntity<List<StrategyRewardResponse>> rewards(
            @RequestParam(defaultValue = "0") long minSamples) {
        return ResponseEntity.ok(strategyRewardTracker.getStrategiesByReward(minSamples).stream()
                .map(StrategyRewardResponse::from)
                .toList());
    }
}
