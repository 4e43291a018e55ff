package io.esgradar.materiality.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "materiality")
public record MaterialityConfig(
        ScoringConfig scoring,
        DedupConfig dedup,
        DiscoveryConfig discovery,
        RecommendationConfig recommendation,
        ProcessingConfig processing,
        KeywordDictionary keywords,
        StandardMapping standards
) {
    public MaterialityConfig {
        scoring = scoring == null ? ScoringConfig.defaults() : scoring;
        dedup = dedup == null ? DedupConfig.defaults() : dedup;
        discovery = discovery == null ? DiscoveryConfig.defaults() : discovery;
        recommendation = recommendation == null ? RecommendationConfig.defaults() : recommendation;
        processing = processing == null ? ProcessingConfig.defaults() : processing;
        keywords = keywords == null ? KeywordDictionary.empty() : keywords;
        standards = standards == null ? StandardMapping.empty() : standards;
    }

    public static MaterialityConfig defaults() {
        return new MaterialityConfig(null, null, null, null, null, null, null);
    }
}
