package io.esgradar.materiality.api.dto.analysis;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aggregated news evidence for one topic in one analysis run.
 *
 * @param keywords           keywords the topic was searched and scored with
 * @param matchedKeywords    keywords actually found in relevant articles
 * @param comprehensiveScore blended relevance, non-negative and unbounded above
 * @param topArticles        best scoring relevant articles, highest first
 */
public record TopicNewsAnalysis(
        Topic topic,
        Set<String> keywords,
        Set<String> matchedKeywords,
        int totalArticleCount,
        int relevantArticleCount,
        double averageRelevance,
        double comprehensiveScore,
        TrendSummary trend,
        Map<SentimentLabel, Integer> sentimentDistribution,
        List<ScoredArticle> topArticles
) {
    public TopicNewsAnalysis {
        keywords = keywords == null ? Set.of() : Set.copyOf(keywords);
        matchedKeywords = matchedKeywords == null ? Set.of() : Set.copyOf(matchedKeywords);
        trend = trend == null ? TrendSummary.empty() : trend;
        sentimentDistribution = sentimentDistribution == null ? Map.of() : Map.copyOf(sentimentDistribution);
        topArticles = topArticles == null ? List.of() : List.copyOf(topArticles);
    }

    public boolean hasRelevantCoverage() {
        return relevantArticleCount > 0;
    }

    public double relevantRatio() {
        return totalArticleCount > 0 ? (double) relevantArticleCount / totalArticleCount : 0.0;
    }
}
