package io.esgradar.materiality.api.service;

import io.esgradar.materiality.api.dto.analysis.NewIssueCandidate;
import io.esgradar.materiality.api.dto.analysis.OverallTrend;
import io.esgradar.materiality.api.dto.analysis.Recommendation;
import io.esgradar.materiality.api.dto.analysis.RecommendationEvidence;
import io.esgradar.materiality.api.dto.analysis.RecommendationType;
import io.esgradar.materiality.api.dto.analysis.TopicChange;
import io.esgradar.materiality.api.dto.analysis.UpdateNecessity;
import io.esgradar.materiality.config.MaterialityConfig;
import io.esgradar.materiality.config.RecommendationConfig;
import io.esgradar.materiality.config.ScoringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns detected changes, discovered issues and the overall trend into a ranked list of
 * recommendations with unique subjects.
 */
@Service
public class RecommendationEngine {

    private static final Logger logger = LoggerFactory.getLogger(RecommendationEngine.class);

    static final String ASSESSMENT_SUBJECT = "materiality assessment";
    private static final int MAX_RANK_SHIFT = 3;

    private final ScoringConfig scoring;
    private final RecommendationConfig recommendation;

    public RecommendationEngine(MaterialityConfig config) {
        this.scoring = config.scoring();
        this.recommendation = config.recommendation();
    }

    public List<Recommendation> recommend(List<TopicChange> changes, List<NewIssueCandidate> newIssues,
                                          OverallTrend overallTrend) {
        return recommend(changes, newIssues, overallTrend, recommendation.maxRecommendations());
    }

    public List<Recommendation> recommend(List<TopicChange> changes, List<NewIssueCandidate> newIssues,
                                          OverallTrend overallTrend, int maxRecommendations) {
        List<Recommendation> candidates = new ArrayList<>();

        for (TopicChange change : changes) {
            if (Math.abs(change.changeMagnitude()) > scoring.significantChange()) {
                candidates.add(priorityReview(change));
            }
        }

        for (NewIssueCandidate issue : newIssues) {
            candidates.add(newIssueReview(issue));
        }

        if (overallTrend.updateNecessity() == UpdateNecessity.HIGH) {
            candidates.add(overallReview(overallTrend));
        }

        // List.sort is stable, equal confidences keep generation order
        candidates.sort(Comparator.comparingDouble(Recommendation::confidence).reversed());

        Set<String> subjects = new HashSet<>();
        List<Recommendation> result = new ArrayList<>();
        for (Recommendation candidate : candidates) {
            if (result.size() >= maxRecommendations) break;

            if (subjects.add(candidate.subject().toLowerCase(Locale.ROOT))) {
                result.add(candidate);
            }
        }

        logger.info("Generated {} recommendations from {} candidates", result.size(), candidates.size());
        return result;
    }

    private Recommendation priorityReview(TopicChange change) {
        double magnitude = change.changeMagnitude();
        boolean upward = magnitude > 0;

        String rationale = String.format(Locale.ROOT, "news activity %s (%+.2f)",
                upward ? "increased" : "decreased", magnitude);

        return new Recommendation(
                change.topicName(),
                RecommendationType.PRIORITY_REVIEW,
                upward ? "upward priority review" : "downward priority review",
                rationale,
                change.confidence(),
                new RecommendationEvidence(
                        change.newsMetrics().totalArticles(),
                        change.newsMetrics().relevantArticles(),
                        change.newsMetrics().sentimentMix(),
                        change.newsMetrics().relevantArticles()),
                change.topic().standardCode(),
                rankShift(magnitude)
        );
    }

    private Recommendation newIssueReview(NewIssueCandidate issue) {
        String rationale = String.format(Locale.ROOT, "mentioned %d times in news, issue score %.2f",
                issue.frequency(), issue.issueScore());

        return new Recommendation(
                issue.keyword(),
                RecommendationType.NEW_ISSUE,
                "review for inclusion",
                rationale,
                issue.confidence(),
                new RecommendationEvidence(0, 0, null, issue.relatedArticleIds().size()),
                issue.standardCode(),
                0
        );
    }

    private Recommendation overallReview(OverallTrend trend) {
        String rationale = String.format(Locale.ROOT, "high overall change intensity (%.2f)", trend.meanMagnitude());

        return new Recommendation(
                ASSESSMENT_SUBJECT,
                RecommendationType.OVERALL_REVIEW,
                "comprehensive review",
                rationale,
                trend.meanConfidence(),
                RecommendationEvidence.none(),
                null,
                0
        );
    }

    /**
     * Five ranks per unit of magnitude, truncated toward zero and capped at three.
     */
    static int rankShift(double magnitude) {
        int shift = (int) (magnitude * 5);
        return Math.max(-MAX_RANK_SHIFT, Math.min(MAX_RANK_SHIFT, shift));
    }
}
