package io.esgradar.materiality.api.dto.analysis;

import java.util.Map;

public record RecommendationEvidence(
        int totalArticles,
        int relevantArticles,
        Map<SentimentLabel, Integer> sentimentMix,
        int relatedArticleCount
) {
    public RecommendationEvidence {
        sentimentMix = sentimentMix == null ? Map.of() : Map.copyOf(sentimentMix);
    }

    public static RecommendationEvidence none() {
        return new RecommendationEvidence(0, 0, Map.of(), 0);
    }
}
