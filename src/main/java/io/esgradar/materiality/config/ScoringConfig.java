package io.esgradar.materiality.config;

import io.esgradar.materiality.api.dto.analysis.SentimentLabel;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Weights and thresholds shared by relevance scoring and change detection.
 */
public record ScoringConfig(
        @DefaultValue("5.0") double titleWeight,
        @DefaultValue("2.0") double contentWeight,
        @DefaultValue("3.0") double exactMatch,
        @DefaultValue("1.0") double partialMatch,
        @DefaultValue("2.0") double companyMention,
        @DefaultValue("1.3") double positiveSentiment,
        @DefaultValue("0.9") double negativeSentiment,
        @DefaultValue("1.0") double neutralSentiment,
        @DefaultValue("1.5") double recencyBoost,
        @DefaultValue("30d") Duration recencyWindow,
        @DefaultValue("2.5") double keywordDensity,
        @DefaultValue("0.3") double relevanceThreshold,
        @DefaultValue("0.3") double significantChange,
        @DefaultValue("0.5") double emergingIssueThreshold,
        @DefaultValue("10") int confidenceArticleSaturation
) {

    public static ScoringConfig defaults() {
        return new ScoringConfig(
                5.0, 2.0, 3.0, 1.0,
                2.0,
                1.3, 0.9, 1.0,
                1.5, Duration.ofDays(30),
                2.5,
                0.3, 0.3, 0.5,
                10
        );
    }

    public double sentimentMultiplier(SentimentLabel label) {
        if (label == null) return neutralSentiment;

        return switch (label) {
            case POSITIVE -> positiveSentiment;
            case NEGATIVE -> negativeSentiment;
            case NEUTRAL -> neutralSentiment;
        };
    }
}
