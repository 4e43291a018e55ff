package io.esgradar.materiality.api.service;

import io.esgradar.materiality.api.dto.analysis.Article;
import io.esgradar.materiality.api.dto.analysis.ScoredArticle;
import io.esgradar.materiality.api.dto.analysis.SentimentLabel;
import io.esgradar.materiality.api.dto.analysis.Topic;
import io.esgradar.materiality.api.dto.analysis.TopicNewsAnalysis;
import io.esgradar.materiality.api.dto.analysis.TrendDirection;
import io.esgradar.materiality.api.dto.analysis.TrendSummary;
import io.esgradar.materiality.api.util.TextSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@Service
public class TopicNewsAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(TopicNewsAnalyzer.class);

    private static final int TOP_ARTICLES = 5;
    private static final double INCREASE_FACTOR = 1.5;
    private static final double DECREASE_FACTOR = 0.5;

    private final RelevanceScorer relevanceScorer;

    public TopicNewsAnalyzer(RelevanceScorer relevanceScorer) {
        this.relevanceScorer = relevanceScorer;
    }

    /**
     * Scores every article against the topic and aggregates the ones strictly above
     * {@code relevanceThreshold}.
     */
    public TopicNewsAnalysis analyze(List<Article> articles, Topic topic, Set<String> keywords,
                                     String companyName, double relevanceThreshold) {
        List<ScoredArticle> relevant = new ArrayList<>();

        for (Article article : articles) {
            double score = relevanceScorer.score(article, keywords, companyName);
            if (score > relevanceThreshold) {
                relevant.add(new ScoredArticle(article, score, relevanceScorer.matchedKeywords(article, keywords)));
            }
        }

        relevant.sort(Comparator.comparingDouble(ScoredArticle::relevanceScore).reversed());

        double average = relevant.stream()
                .mapToDouble(ScoredArticle::relevanceScore)
                .average()
                .orElse(0.0);

        Set<String> matched = new HashSet<>();
        relevant.forEach(scored -> matched.addAll(scored.matchedKeywords()));

        double comprehensive = comprehensiveScore(average, relevant.size(), matched.size(), keywords.size());
        Map<SentimentLabel, Integer> sentiments = sentimentDistribution(relevant);

        logger.debug("Topic '{}': {} of {} articles relevant, score {}",
                topic.name(), relevant.size(), articles.size(), comprehensive);

        return new TopicNewsAnalysis(
                topic,
                keywords,
                matched,
                articles.size(),
                relevant.size(),
                TextSimilarity.round3(average),
                comprehensive,
                trend(relevant, sentiments),
                sentiments,
                relevant.stream().limit(TOP_ARTICLES).toList()
        );
    }

    static double comprehensiveScore(double averageRelevance, int relevantCount,
                                     int matchedKeywords, int totalKeywords) {
        if (relevantCount == 0) return 0.0;

        double coverage = totalKeywords > 0 ? (double) matchedKeywords / totalKeywords : 0.0;
        double score = 0.4 * averageRelevance
                + 0.3 * Math.log(relevantCount + 1)
                + 0.3 * coverage;

        return TextSimilarity.round3(score);
    }

    TrendSummary trend(List<ScoredArticle> relevant, Map<SentimentLabel, Integer> sentiments) {
        if (relevant.isEmpty()) return TrendSummary.empty();

        TreeMap<YearMonth, Integer> monthly = new TreeMap<>();
        for (ScoredArticle scored : relevant) {
            if (scored.article().publishedAt() != null) {
                monthly.merge(YearMonth.from(scored.article().publishedAt()), 1, Integer::sum);
            }
        }

        TrendDirection direction = TrendDirection.STABLE;
        if (monthly.size() >= 2) {
            int latest = monthly.lastEntry().getValue();
            int previous = monthly.lowerEntry(monthly.lastKey()).getValue();

            if (latest > previous * INCREASE_FACTOR) {
                direction = TrendDirection.INCREASING;
            } else if (latest < previous * DECREASE_FACTOR) {
                direction = TrendDirection.DECREASING;
            }
        }

        YearMonth peak = null;
        int peakCount = 0;
        for (Map.Entry<YearMonth, Integer> bucket : monthly.entrySet()) {
            if (bucket.getValue() > peakCount) {
                peak = bucket.getKey();
                peakCount = bucket.getValue();
            }
        }

        return new TrendSummary(direction, direction == TrendDirection.INCREASING, peak,
                dominantSentiment(sentiments), monthly);
    }

    /**
     * Majority label; a tie for the top count or no votes at all yields NEUTRAL.
     */
    static SentimentLabel dominantSentiment(Map<SentimentLabel, Integer> sentiments) {
        SentimentLabel dominant = SentimentLabel.NEUTRAL;
        int best = 0;
        boolean tied = false;

        for (Map.Entry<SentimentLabel, Integer> entry : sentiments.entrySet()) {
            if (entry.getValue() > best) {
                dominant = entry.getKey();
                best = entry.getValue();
                tied = false;
            } else if (entry.getValue() == best && best > 0) {
                tied = true;
            }
        }

        return tied || best == 0 ? SentimentLabel.NEUTRAL : dominant;
    }

    private static Map<SentimentLabel, Integer> sentimentDistribution(List<ScoredArticle> relevant) {
        Map<SentimentLabel, Integer> distribution = new EnumMap<>(SentimentLabel.class);
        for (SentimentLabel label : SentimentLabel.values()) {
            distribution.put(label, 0);
        }
        relevant.forEach(scored -> distribution.merge(scored.article().sentiment(), 1, Integer::sum));
        return distribution;
    }
}
