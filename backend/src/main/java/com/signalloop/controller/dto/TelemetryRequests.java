package com.signalloop.controller.dto;

import com.signalloop.model.CollectionPhase;
import com.signalloop.model.ScrapeMetadata;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.OffsetDateTime;
import java.util.Map;

public final class TelemetryRequests {

    private TelemetryRequests() {
    }

    public record ScrapeRequest(
            CollectionPhase phase,

            OffsetDateTime postedAt,

            @PositiveOrZero(message = "accountFollowerCount must be non-negative")
            Long accountFollowerCount,

            @Size(max = 128, message = "templateId must be at most 128 characters")
            String templateId,

            @Size(max = 64, message = "promptVersion must be at most 64 characters")
            String promptVersion,

            @Size(max = 128, message = "strategyId must be at most 128 characters")
            String strategyId,

            @Size(max = 64, message = "strategyVersion must be at most 64 characters")
            String strategyVersion,

            Map<String, Object> attributes
    ) {
        public ScrapeMetadata toMetadata() {
            return new ScrapeMetadata(phase, postedAt, accountFollowerCount,
                    templateId, promptVersion, strategyId, strategyVersion, attributes);
        }
    }
}
