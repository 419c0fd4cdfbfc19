package com.signalloop.service;

import com.signalloop.model.DiagnosticEvent;
import com.signalloop.model.ScrapedMetrics;
import com.signalloop.model.ValidationResult;
import com.signalloop.repository.DiagnosticEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Side channel for implausible measurements. Every step is best effort: a
 * failed evidence capture still writes the alert, and a failed write is only
 * logged.
 */
@Service
public class DiagnosticAlertService {

    static final String EVENT_TYPE = "metrics_validation_alert";
    static final String SEVERITY = "warning";

    private static final Logger log = LoggerFactory.getLogger(DiagnosticAlertService.class);

    private final DiagnosticEventRepository diagnosticEventRepository;
    private final MetricScraperClient metricScraperClient;
    private final Clock clock;

    public DiagnosticAlertService(
            DiagnosticEventRepository diagnosticEventRepository,
            MetricScraperClient metricScraperClient,
            Clock clock) {
        this.diagnosticEventRepository = diagnosticEventRepository;
        this.metricScraperClient = metricScraperClient;
        this.clock = clock;
    }

    /**
     * Records an alert for a suspicious measurement.
     *
     * @return true when the alert was persisted
     */
    public boolean raise(String postId, ScrapedMetrics metrics, ValidationResult validation) {
        log.warn("Metrics validation alert for post {}: confidence={} anomalies={}",
                postId, String.format("%.2f", validation.confidence()), validation.anomalies());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("metrics", rawMetrics(metrics));
        payload.put("anomalies", validation.anomalies());
        payload.put("confidence", validation.confidence());
        captureEvidence(postId).ifPresent(reference -> payload.put("evidence", reference));

        DiagnosticEvent event = new DiagnosticEvent();
        event.setEventType(EVENT_TYPE);
        event.setSeverity(SEVERITY);
        event.setPostId(postId);
        event.setMessage(truncate("Suspicious metrics for post " + postId + ": "
                + String.join("; ", validation.anomalies())));
        event.setPayload(payload);
        event.setCreatedAt(OffsetDateTime.now(clock));
        try {
            diagnosticEventRepository.save(event);
            return true;
        } catch (RuntimeException ex) {
            log.warn("Failed to persist metrics validation alert for post {}: {}", postId, ex.getMessage());
            return false;
        }
    }

    private Optional<String> captureEvidence(String postId) {
        try {
            return metricScraperClient.captureEvidence(postId);
        } catch (RuntimeException ex) {
            log.warn("Evidence capture failed for post {}: {}", postId, ex.getMessage());
            return Optional.empty();
        }
    }

    private static Map<String, Object> rawMetrics(ScrapedMetrics metrics) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("likes", metrics.likes());
        raw.put("retweets", metrics.retweets());
        raw.put("quoteTweets", metrics.quoteTweets());
        raw.put("replies", metrics.replies());
        raw.put("bookmarks", metrics.bookmarks());
        raw.put("views", metrics.views());
        raw.put("profileClicks", metrics.profileClicks());
        return raw;
    }

    private static String truncate(String message) {
        return message.length() <= 1024 ? message : message.substring(0, 1021) + "...";
    }
}
