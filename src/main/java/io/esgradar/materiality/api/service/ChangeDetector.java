package io.esgradar.materiality.api.service;

import io.esgradar.materiality.api.dto.analysis.ChangeType;
import io.esgradar.materiality.api.dto.analysis.NewsMetrics;
import io.esgradar.materiality.api.dto.analysis.SentimentLabel;
import io.esgradar.materiality.api.dto.analysis.Topic;
import io.esgradar.materiality.api.dto.analysis.TopicChange;
import io.esgradar.materiality.api.dto.analysis.TopicNewsAnalysis;
import io.esgradar.materiality.api.dto.analysis.TrendDirection;
import io.esgradar.materiality.api.util.TextSimilarity;
import io.esgradar.materiality.config.MaterialityConfig;
import io.esgradar.materiality.config.ScoringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Compares a topic's prior priority with its current news relevance.
 *
 * <p>The prior priority is normalized to {@code (maxRank - priority + 1) / maxRank}, so rank 1
 * maps to 1.0, and the change magnitude is the comprehensive score minus that value. A magnitude
 * beyond {@code significantChange} in either direction decides EMERGING or DECLINING; otherwise the
 * absolute score separates ONGOING from MATURING. A high-scoring topic can therefore be ONGOING
 * with a negative magnitude.
 */
@Service
public class ChangeDetector {

    private static final Logger logger = LoggerFactory.getLogger(ChangeDetector.class);

    static final String INSUFFICIENT_COVERAGE = "insufficient news coverage";
    static final double NO_COVERAGE_MAGNITUDE = -1.0;
    static final double NO_COVERAGE_CONFIDENCE = 0.3;

    private static final int LIMITED_NEWS = 5;
    private static final int ABUNDANT_NEWS = 10;

    private final ScoringConfig scoring;

    public ChangeDetector(MaterialityConfig config) {
        this.scoring = config.scoring();
    }

    public TopicChange detect(Topic topic, TopicNewsAnalysis analysis, int maxPriorityRank) {
        NewsMetrics metrics = NewsMetrics.from(analysis);

        if (!analysis.hasRelevantCoverage()) {
            logger.info("No relevant coverage for topic '{}', marking as declining", topic.name());
            return new TopicChange(topic, topic.priority(), 0.0, NO_COVERAGE_MAGNITUDE, ChangeType.DECLINING,
                    NO_COVERAGE_CONFIDENCE, List.of(INSUFFICIENT_COVERAGE), TrendDirection.STABLE, metrics, 0);
        }

        double currentScore = analysis.comprehensiveScore();
        double magnitude = changeMagnitude(currentScore, topic.priority(), maxPriorityRank);
        ChangeType changeType = classify(magnitude, currentScore);
        double confidence = confidence(analysis);

        logger.debug("Topic '{}': prior rank {}, score {}, magnitude {} -> {}",
                topic.name(), topic.priority(), currentScore, magnitude, changeType);

        return new TopicChange(
                topic,
                topic.priority(),
                currentScore,
                magnitude,
                changeType,
                confidence,
                reasons(changeType, analysis, magnitude),
                analysis.trend().direction(),
                metrics,
                0
        );
    }

    /**
     * Ranks changes by relevant-article count, most mentioned first, keeping input order on ties,
     * and records the rank movement as the leading reason.
     *
     * @return the changes in their original order with mention ranks attached
     */
    public List<TopicChange> rankByMentions(List<TopicChange> changes) {
        List<TopicChange> byMentions = new ArrayList<>(changes);
        byMentions.sort(Comparator.comparingInt(
                (TopicChange change) -> change.newsMetrics().relevantArticles()).reversed());

        List<TopicChange> ranked = new ArrayList<>();
        for (TopicChange change : changes) {
            int rank = byMentions.indexOf(change) + 1;
            ranked.add(withRankReason(change.withMentionRank(rank)));
        }
        return ranked;
    }

    public static double normalizedPriorScore(int priority, int maxPriorityRank) {
        if (maxPriorityRank <= 0) return 0.0;
        return (double) (maxPriorityRank - priority + 1) / maxPriorityRank;
    }

    public static double changeMagnitude(double currentScore, int priority, int maxPriorityRank) {
        double magnitude = TextSimilarity.round3(currentScore - normalizedPriorScore(priority, maxPriorityRank));
        return Math.max(-1.0, Math.min(1.0, magnitude));
    }

    public ChangeType classify(double magnitude, double currentScore) {
        if (magnitude > scoring.significantChange()) return ChangeType.EMERGING;
        if (magnitude < -scoring.significantChange()) return ChangeType.DECLINING;
        if (currentScore > scoring.emergingIssueThreshold()) return ChangeType.ONGOING;
        return ChangeType.MATURING;
    }

    double confidence(TopicNewsAnalysis analysis) {
        int relevant = analysis.relevantArticleCount();
        double volume = Math.min((double) relevant / Math.max(1, scoring.confidenceArticleSaturation()), 1.0);
        double ratio = analysis.relevantRatio();
        double strength = Math.min(analysis.comprehensiveScore(), 1.0);

        return TextSimilarity.round3(0.3 * volume + 0.4 * ratio + 0.3 * strength);
    }

    private List<String> reasons(ChangeType changeType, TopicNewsAnalysis analysis, double magnitude) {
        List<String> reasons = new ArrayList<>();
        int relevant = analysis.relevantArticleCount();
        SentimentLabel sentiment = analysis.trend().dominantSentiment();

        switch (changeType) {
            case EMERGING -> {
                reasons.add(String.format(Locale.ROOT, "news relevance score up (%+.2f)", magnitude));
                if (analysis.trend().recentIncrease()) reasons.add("recent rise in news volume");
                if (sentiment == SentimentLabel.POSITIVE) reasons.add("growing positive coverage");
            }
            case DECLINING -> {
                reasons.add(String.format(Locale.ROOT, "news relevance score down (%+.2f)", magnitude));
                if (relevant < LIMITED_NEWS) reasons.add("limited related news");
                if (sentiment == SentimentLabel.NEGATIVE) reasons.add("growing negative coverage");
            }
            case ONGOING -> {
                reasons.add("sustained news exposure");
                if (relevant > ABUNDANT_NEWS) reasons.add("abundant news coverage");
            }
            case MATURING -> {
                reasons.add("stable issue profile");
                if (analysis.trend().direction() == TrendDirection.STABLE) reasons.add("stable trend");
            }
        }
        return reasons;
    }

    private TopicChange withRankReason(TopicChange change) {
        int mentions = change.newsMetrics().relevantArticles();
        if (mentions == 0) return change;

        int shift = change.priorityShift();
        String rankReason;
        if (shift < -1) {
            rankReason = String.format(Locale.ROOT, "mentions up, %d ranks higher (%d relevant articles)", -shift, mentions);
        } else if (shift > 1) {
            rankReason = String.format(Locale.ROOT, "mentions down, %d ranks lower (%d relevant articles)", shift, mentions);
        } else if (shift == 0) {
            rankReason = String.format(Locale.ROOT, "rank held (%d relevant articles)", mentions);
        } else {
            return change;
        }

        List<String> reasons = new ArrayList<>();
        reasons.add(rankReason);
        reasons.addAll(change.reasons());

        return new TopicChange(change.topic(), change.previousPriority(), change.currentScore(),
                change.changeMagnitude(), change.changeType(), change.confidence(), reasons,
                change.trendDirection(), change.newsMetrics(), change.mentionRank());
    }
}
