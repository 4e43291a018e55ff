package io.esgradar.materiality.api;

import io.esgradar.materiality.api.dto.AnalysisRequest;
import io.esgradar.materiality.api.dto.CollectRequest;
import io.esgradar.materiality.api.dto.analysis.Article;
import io.esgradar.materiality.api.dto.analysis.MaterialityAssessment;
import io.esgradar.materiality.api.dto.analysis.MaterialityReport;
import io.esgradar.materiality.api.service.EventPublisherService;
import io.esgradar.materiality.api.service.MaterialityAnalysisService;
import io.esgradar.materiality.api.service.NewsCollectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/materiality")
public class MaterialityController {

    private static final Logger logger = LoggerFactory.getLogger(MaterialityController.class);

    private final MaterialityAnalysisService analysisService;
    private final NewsCollectionService collectionService;
    private final EventPublisherService eventPublisher;

    public MaterialityController(MaterialityAnalysisService analysisService,
                                 NewsCollectionService collectionService,
                                 EventPublisherService eventPublisher) {
        this.analysisService = analysisService;
        this.collectionService = collectionService;
        this.eventPublisher = eventPublisher;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        var stats = eventPublisher.getStats();

        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "service", "Materiality Update Service",
                "timestamp", LocalDateTime.now().toString(),
                "messaging", Map.of(
                        "totalPublished", stats.published(),
                        "totalFailed", stats.failed(),
                        "successRate", String.format("%.2f%%", stats.getSuccessRate() * 100)
                )
        ));
    }

    /**
     * Analyses caller-supplied, already-labelled articles against a prior assessment.
     */
    @PostMapping("/analysis")
    public ResponseEntity<MaterialityReport> analyze(@RequestBody AnalysisRequest request) {
        MaterialityAssessment assessment = request.toAssessment();
        List<Article> articles = request.toArticles();

        logger.info("Analysis requested for {} ({}) with {} articles",
                assessment.companyName(), assessment.year(), articles.size());

        return ResponseEntity.ok(analyzeAndPublish(assessment, articles));
    }

    /**
     * Collects the year's news from the configured feeds, labels it and analyses it.
     */
    @PostMapping("/analysis/collect")
    public ResponseEntity<MaterialityReport> collectAndAnalyze(@RequestBody CollectRequest request) {
        MaterialityAssessment assessment = request.toAssessment();

        List<Article> articles = collectionService.collect(
                assessment.companyName(), assessment.topics(), assessment.year(), request.limit());

        return ResponseEntity.ok(analyzeAndPublish(assessment, articles));
    }

    private MaterialityReport analyzeAndPublish(MaterialityAssessment assessment, List<Article> articles) {
        MaterialityReport report = analysisService.analyze(assessment, articles);
        eventPublisher.publish(report);
        return report;
    }
}
