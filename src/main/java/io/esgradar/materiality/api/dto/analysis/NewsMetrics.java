package io.esgradar.materiality.api.dto.analysis;

import java.util.Map;

public record NewsMetrics(
        int totalArticles,
        int relevantArticles,
        SentimentLabel dominantSentiment,
        Map<SentimentLabel, Integer> sentimentMix
) {
    public NewsMetrics {
        dominantSentiment = dominantSentiment == null ? SentimentLabel.NEUTRAL : dominantSentiment;
        sentimentMix = sentimentMix == null ? Map.of() : Map.copyOf(sentimentMix);
    }

    public static NewsMetrics from(TopicNewsAnalysis analysis) {
        return new NewsMetrics(
                analysis.totalArticleCount(),
                analysis.relevantArticleCount(),
                analysis.trend().dominantSentiment(),
                analysis.sentimentDistribution()
        );
    }
}
