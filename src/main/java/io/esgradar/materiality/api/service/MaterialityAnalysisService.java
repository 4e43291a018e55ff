package io.esgradar.materiality.api.service;

import io.esgradar.materiality.api.dto.analysis.Article;
import io.esgradar.materiality.api.dto.analysis.ArticleStats;
import io.esgradar.materiality.api.dto.analysis.MaterialityAssessment;
import io.esgradar.materiality.api.dto.analysis.MaterialityReport;
import io.esgradar.materiality.api.dto.analysis.NewIssueCandidate;
import io.esgradar.materiality.api.dto.analysis.OverallTrend;
import io.esgradar.materiality.api.dto.analysis.Recommendation;
import io.esgradar.materiality.api.dto.analysis.Topic;
import io.esgradar.materiality.api.dto.analysis.TopicChange;
import io.esgradar.materiality.api.dto.analysis.TopicNewsAnalysis;
import io.esgradar.materiality.api.dto.analysis.TrendSummary;
import io.esgradar.materiality.api.dto.analysis.UpdatePriority;
import io.esgradar.materiality.api.exception.InsufficientDataException;
import io.esgradar.materiality.config.KeywordDictionary;
import io.esgradar.materiality.config.MaterialityConfig;
import io.esgradar.materiality.config.ScoringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Runs one analysis of a prior assessment against a batch of news:
 * validation, deduplication, per-topic scoring and change detection, new-issue discovery,
 * trend aggregation and recommendations.
 */
@Service
public class MaterialityAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(MaterialityAnalysisService.class);

    private final ArticleValidator articleValidator;
    private final ArticleDeduplicationService deduplicationService;
    private final TopicNewsAnalyzer topicNewsAnalyzer;
    private final ChangeDetector changeDetector;
    private final NewIssueDiscoverer newIssueDiscoverer;
    private final TrendAggregator trendAggregator;
    private final RecommendationEngine recommendationEngine;
    private final StandardMapper standardMapper;
    private final ExecutorService topicAnalysisExecutor;
    private final KeywordDictionary dictionary;
    private final ScoringConfig scoring;
    private final Clock clock;

    public MaterialityAnalysisService(ArticleValidator articleValidator,
                                      ArticleDeduplicationService deduplicationService,
                                      TopicNewsAnalyzer topicNewsAnalyzer,
                                      ChangeDetector changeDetector,
                                      NewIssueDiscoverer newIssueDiscoverer,
                                      TrendAggregator trendAggregator,
                                      RecommendationEngine recommendationEngine,
                                      StandardMapper standardMapper,
                                      ExecutorService topicAnalysisExecutor,
                                      MaterialityConfig config,
                                      Clock clock) {
        this.articleValidator = articleValidator;
        this.deduplicationService = deduplicationService;
        this.topicNewsAnalyzer = topicNewsAnalyzer;
        this.changeDetector = changeDetector;
        this.newIssueDiscoverer = newIssueDiscoverer;
        this.trendAggregator = trendAggregator;
        this.recommendationEngine = recommendationEngine;
        this.standardMapper = standardMapper;
        this.topicAnalysisExecutor = topicAnalysisExecutor;
        this.dictionary = config.keywords();
        this.scoring = config.scoring();
        this.clock = clock;
    }

    /**
     * @throws InsufficientDataException when no article, or no well-formed article, is supplied
     */
    public MaterialityReport analyze(MaterialityAssessment assessment, List<Article> articles) {
        if (articles == null || articles.isEmpty()) {
            throw new InsufficientDataException("No articles supplied for " + assessment.companyName()
                    + " (" + assessment.year() + ")");
        }

        logger.info("Starting materiality analysis for {} ({}): {} topics, {} articles",
                assessment.companyName(), assessment.year(), assessment.topics().size(), articles.size());

        ArticleValidator.Validation validation = articleValidator.validate(articles);
        if (validation.accepted().isEmpty()) {
            throw new InsufficientDataException("None of the " + articles.size()
                    + " supplied articles has both a title and a body");
        }

        List<Article> deduplicated = deduplicationService.dedupe(validation.accepted());

        MaterialityAssessment mapped = assessment.withTopics(resolveStandardCodes(assessment.topics()));
        int maxPriorityRank = mapped.maxPriorityRank();

        List<TopicResult> topicResults = analyzeTopics(mapped, deduplicated, maxPriorityRank);

        List<TopicNewsAnalysis> analyses = topicResults.stream().map(TopicResult::analysis).toList();
        List<TopicChange> changes = changeDetector.rankByMentions(
                topicResults.stream().map(TopicResult::change).toList());

        List<NewIssueCandidate> newIssues = discoverNewIssues(mapped, deduplicated);
        OverallTrend overallTrend = trendAggregator.aggregate(changes, newIssues);
        List<UpdatePriority> priorities = trendAggregator.priorities(changes, newIssues);
        List<Recommendation> recommendations = recommendationEngine.recommend(changes, newIssues, overallTrend);
        List<String> guidance = trendAggregator.guidance(overallTrend, newIssues);

        logger.info("Finished analysis for {}: {} changes, {} new issues, {} recommendations, necessity {}",
                assessment.companyName(), changes.size(), newIssues.size(), recommendations.size(),
                overallTrend.updateNecessity());

        return new MaterialityReport(
                assessment.companyName(),
                assessment.year(),
                LocalDateTime.now(clock),
                new ArticleStats(articles.size(), validation.accepted().size(), deduplicated.size()),
                validation.rejected(),
                analyses,
                changes,
                newIssues,
                overallTrend,
                priorities,
                recommendations,
                guidance
        );
    }

    private List<Topic> resolveStandardCodes(List<Topic> topics) {
        return topics.stream()
                .map(topic -> topic.isMapped()
                        ? topic
                        : standardMapper.mapTopicToCode(topic.name()).map(topic::withStandardCode).orElse(topic))
                .toList();
    }

    // one task per topic, all joined before aggregation
    private List<TopicResult> analyzeTopics(MaterialityAssessment assessment, List<Article> articles,
                                            int maxPriorityRank) {
        List<CompletableFuture<TopicResult>> futures = new ArrayList<>();

        for (Topic topic : assessment.topics()) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> analyzeTopic(topic, articles, assessment.companyName(), maxPriorityRank),
                            topicAnalysisExecutor)
                    .exceptionally(ex -> {
                        logger.error("Analysis of topic '{}' failed, treating it as uncovered", topic.name(), ex);
                        TopicNewsAnalysis empty = emptyAnalysis(topic, articles.size());
                        return new TopicResult(empty, changeDetector.detect(topic, empty, maxPriorityRank));
                    }));
        }

        return futures.stream().map(CompletableFuture::join).toList();
    }

    private TopicResult analyzeTopic(Topic topic, List<Article> articles, String companyName, int maxPriorityRank) {
        Set<String> keywords = dictionary.keywordsFor(topic.name());
        TopicNewsAnalysis analysis = topicNewsAnalyzer.analyze(
                articles, topic, keywords, companyName, scoring.relevanceThreshold());

        return new TopicResult(analysis, changeDetector.detect(topic, analysis, maxPriorityRank));
    }

    private List<NewIssueCandidate> discoverNewIssues(MaterialityAssessment assessment, List<Article> articles) {
        List<String> excluded = new ArrayList<>(assessment.topicNames());
        excluded.addAll(dictionary.aliasesFor(assessment.companyName()));

        return newIssueDiscoverer.discover(articles, excluded).stream()
                .map(issue -> standardMapper.mapTopicToCode(issue.keyword())
                        .map(issue::withStandardCode)
                        .orElse(issue))
                .toList();
    }

    private static TopicNewsAnalysis emptyAnalysis(Topic topic, int totalArticles) {
        return new TopicNewsAnalysis(topic, Set.of(), Set.of(), totalArticles, 0, 0.0, 0.0,
                TrendSummary.empty(), Map.of(), List.of());
    }

    private record TopicResult(TopicNewsAnalysis analysis, TopicChange change) {}
}
