package com.signalloop.model;

import java.util.List;

/**
 * Strategy chosen for one cycle plus the candidates to act upon. The acted-upon
 * list is never empty when the input was not.
 */
public record StrategySelection(
        StrategyKey strategy,
        SelectionMode selectionMode,
        String reason,
        List<ScoredCandidate> actedUpon
) {

    public StrategySelection {
        actedUpon = List.copyOf(actedUpon);
    }

    public String strategyId() {
        return strategy.strategyId();
    }

    public String strategyVersion() {
        return strategy.strategyVersion();
    }
}
