package io.esgradar.materiality.config;

import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Set;

public record DiscoveryConfig(
        @DefaultValue("3") int minFrequency,
        @DefaultValue("0.4") double scoreThreshold,
        @DefaultValue("20") int topKeywords,
        @DefaultValue("5") int maxCandidates,
        @DefaultValue("3") int minTokenLength,
        Set<String> stopwords
) {
    public DiscoveryConfig {
        stopwords = stopwords == null ? Set.of() : Set.copyOf(stopwords);
    }

    public static DiscoveryConfig defaults() {
        return new DiscoveryConfig(3, 0.4, 20, 5, 3, Set.of());
    }

    public boolean isStopword(String token) {
        return stopwords.contains(token);
    }
}
