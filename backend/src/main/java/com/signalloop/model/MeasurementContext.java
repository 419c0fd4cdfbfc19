package com.signalloop.model;

import java.time.OffsetDateTime;

/**
 * Historical context for validating one measurement. Every field except
 * {@code measuredAt} is optional.
 */
public record MeasurementContext(
        Long accountFollowerCount,
        Double accountAvgEngagement,
        MetricSnapshot previousSnapshot,
        Double hoursSincePost,
        OffsetDateTime measuredAt
) {

    public static MeasurementContext empty(OffsetDateTime measuredAt) {
        return new MeasurementContext(null, null, null, null, measuredAt);
    }
}
