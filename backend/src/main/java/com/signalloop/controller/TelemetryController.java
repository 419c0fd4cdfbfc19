package com.signalloop.controller;

import com.signalloop.controller.dto.TelemetryRequests;
import com.signalloop.model.CollectionPhase;
import com.signalloop.model.ScrapeMetadata;
import com.signalloop.model.ScrapeOutcome;
import com.signalloop.service.IngestionHealthService;
import com.signalloop.service.MetricsCollectionScheduler;
import com.signalloop.service.ScrapingOrchestratorService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for metric ingestion.
 */
@RestController
@RequestMapping("/api/telemetry")
public class TelemetryController {

    private final ScrapingOrchestratorService scrapingOrchestratorService;
    private final MetricsCollectionScheduler metricsCollectionScheduler;
    private final IngestionHealthService ingestionHealthService;

    public TelemetryController(
            ScrapingOrchestratorService scrapingOrchestratorService,
            MetricsCollectionScheduler metricsCollectionScheduler,
            IngestionHealthService ingestionHealthService) {
        this.scrapingOrchestratorService = scrapingOrchestratorService;
        this.metricsCollectionScheduler = metricsCollectionScheduler;
        this.ingestionHealthService = ingestionHealthService;
    }

    /**
     * Scrapes, validates and conditionally stores metrics for one post.
     * Per-post failures are reported in the body, not as an error status.
     */
    @PostMapping("/posts/{postId}/scrape")
    public ResponseEntity<ScrapeOutcome> scrapePost(
            @PathVariable String postId,
            @Valid @RequestBody(required = false) TelemetryRequests.ScrapeRequest request) {
        ScrapeMetadata metadata = request == null
                ? ScrapeMetadata.forPhase(CollectionPhase.SCHEDULED)
                : request.toMetadata();
        return ResponseEntity.ok(scrapingOrchestratorService.scrapeAndStore(postId, metadata));
    }

    @PostMapping("/collect")
    public ResponseEntity<MetricsCollectionScheduler.CycleSummary> runCollection() {
        return ResponseEntity.ok(metricsCollectionScheduler.runCollectionCycle("manual"));
    }

    @GetMapping("/health")
    public ResponseEntity<IngestionHealthService.HealthSnapshot> health() {
        return ResponseEntity.ok(ingestionHealthService.snapshot());
    }
}
