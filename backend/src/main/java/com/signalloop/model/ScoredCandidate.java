package com.signalloop.model;

public record ScoredCandidate(
        Candidate candidate,
        ScoringComponents scoringComponents,
        double totalScore,
        boolean eligible,
        String eligibilityReason,
        long predicted24hViews,
        int predictedTier
) {

    public String candidateId() {
        return candidate.candidateId();
    }

    public StrategyKey strategyKey() {
        return candidate.strategyKey();
    }
}
