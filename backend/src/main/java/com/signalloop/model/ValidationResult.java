package com.signalloop.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of validating one scraped measurement. {@code anomalies} lists the
 * hard anomalies followed by the soft warnings; {@code warnings} holds the soft
 * subset only.
 */
public record ValidationResult(
        boolean valid,
        double confidence,
        List<String> anomalies,
        List<String> warnings,
        boolean shouldStore,
        boolean shouldAlert
) {

    public ValidationResult {
        anomalies = List.copyOf(anomalies);
        warnings = List.copyOf(warnings);
    }

    public List<String> hardAnomalies() {
        List<String> hard = new ArrayList<>(anomalies);
        hard.removeAll(warnings);
        return hard;
    }
}
