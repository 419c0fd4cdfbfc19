package com.signalloop.model;

import java.util.Objects;

public record StrategyKey(String strategyId, String strategyVersion) {

    public static final StrategyKey BASELINE = new StrategyKey("baseline", "1");

    public StrategyKey {
        Objects.requireNonNull(strategyId, "strategyId is required");
        Objects.requireNonNull(strategyVersion, "strategyVersion is required");
    }

    /**
     * Untagged candidates and outcomes fall back to the baseline strategy.
     */
    public static StrategyKey of(String strategyId, String strategyVersion) {
        if (strategyId == null || strategyId.isBlank()) {
            return BASELINE;
        }
        String version = strategyVersion == null || strategyVersion.isBlank() ? "1" : strategyVersion.trim();
        return new StrategyKey(strategyId.trim(), version);
    }

    @Override
    public String toString() {
        return strategyId + "/" + strategyVersion;
    }
}
