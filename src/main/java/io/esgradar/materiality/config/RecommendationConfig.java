package io.esgradar.materiality.config;

import org.springframework.boot.context.properties.bind.DefaultValue;

public record RecommendationConfig(
        @DefaultValue("10") int maxRecommendations,
        @DefaultValue("0.4") double fullReviewMagnitude
) {
    public static RecommendationConfig defaults() {
        return new RecommendationConfig(10, 0.4);
    }
}
