package com.signalloop.service;

import com.signalloop.config.SignalLoopProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Topic fit as the best cosine similarity between a text and the configured
 * topic anchors. Falls back to a neutral 0.5 for short text, disabled
 * embeddings, or any embedding failure. Failures log one warning per interval.
 */
@Component
public class TopicFitScorer {

    static final double FALLBACK_SCORE = 0.5;

    private static final Logger log = LoggerFactory.getLogger(TopicFitScorer.class);

    private final SignalLoopProperties properties;
    private final TopicEmbeddingClient embeddingClient;
    private final Clock clock;
    private final AtomicLong lastWarnAtMillis = new AtomicLong(-1L);
    private final AtomicLong suppressedWarnings = new AtomicLong();

    private volatile List<double[]> anchorEmbeddings;

    public TopicFitScorer(
            SignalLoopProperties properties,
            ObjectProvider<TopicEmbeddingClient> embeddingClient,
            Clock clock) {
        this.properties = properties;
        this.embeddingClient = embeddingClient.getIfAvailable();
        this.clock = clock;
    }

    public TopicFit score(String text) {
        if (text == null || text.trim().length() < properties.getScoring().getMinTextLength()) {
            return TopicFit.fallback();
        }
        if (embeddingClient == null || !properties.getEmbedding().isEnabled()) {
            return TopicFit.fallback();
        }
        try {
            List<double[]> anchors = anchors();
            if (anchors.isEmpty()) {
                return TopicFit.fallback();
            }
            double[] vector = embeddingClient.embed(List.of(text.trim())).get(0);
            double best = 0.0;
            for (double[] anchor : anchors) {
                best = Math.max(best, cosine(vector, anchor));
            }
            return new TopicFit(clamp(best), false);
        } catch (RuntimeException ex) {
            warnRateLimited(ex);
            return TopicFit.fallback();
        }
    }

    private List<double[]> anchors() {
        List<double[]> cached = anchorEmbeddings;
        if (cached != null) {
            return cached;
        }
        synchronized (this) {
            if (anchorEmbeddings == null) {
                List<String> topics = properties.getScoring().getTopicAnchors();
                anchorEmbeddings = topics == null || topics.isEmpty()
                        ? List.of()
                        : List.copyOf(embeddingClient.embed(topics));
                log.info("Embedded {} topic anchor(s) for topic fit scoring", anchorEmbeddings.size());
            }
            return anchorEmbeddings;
        }
    }

    private void warnRateLimited(RuntimeException ex) {
        long now = clock.millis();
        long intervalMillis = Math.max(0L, properties.getEmbedding().getWarnIntervalSeconds()) * 1_000L;
        long last = lastWarnAtMillis.get();
        if ((last < 0 || now - last >= intervalMillis) && lastWarnAtMillis.compareAndSet(last, now)) {
            long suppressed = suppressedWarnings.getAndSet(0L);
            log.warn("Topic embedding unavailable, using neutral topic fit {} ({} similar failure(s) suppressed): {}",
                    FALLBACK_SCORE, suppressed, ex.getMessage());
        } else {
            suppressedWarnings.incrementAndGet();
        }
    }

    static double cosine(double[] a, double[] b) {
        int length = Math.min(a.length, b.length);
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return FALLBACK_SCORE;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public record TopicFit(double score, boolean fallbackUsed) {
        static TopicFit fallback() {
            return new TopicFit(FALLBACK_SCORE, true);
        }
    }
}
