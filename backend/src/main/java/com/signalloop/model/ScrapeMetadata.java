package com.signalloop.model;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Context attached to one scrape request: the lifecycle stage being collected,
 * account context when the caller has it, and the decision tags that produced
 * the post.
 */
public record ScrapeMetadata(
        CollectionPhase phase,
        OffsetDateTime postedAt,
        Long accountFollowerCount,
        String templateId,
        String promptVersion,
        String strategyId,
        String strategyVersion,
        Map<String, Object> attributes
) {

    public ScrapeMetadata {
        phase = phase == null ? CollectionPhase.SCHEDULED : phase;
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static ScrapeMetadata forPhase(CollectionPhase phase) {
        return new ScrapeMetadata(phase, null, null, null, null, null, null, Map.of());
    }

    public static ScrapeMetadata forPublishedPost(PublishedPost post, CollectionPhase phase) {
        return new ScrapeMetadata(
                phase,
                post.getPublishedAt(),
                null,
                post.getTemplateId(),
                post.getPromptVersion(),
                post.getStrategyId(),
                post.getStrategyVersion(),
                Map.of());
    }

    public boolean hasDecisionTags() {
        return hasText(templateId) || hasText(strategyId);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
