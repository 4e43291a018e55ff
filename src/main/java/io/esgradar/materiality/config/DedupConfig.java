package io.esgradar.materiality.config;

import org.springframework.boot.context.properties.bind.DefaultValue;

public record DedupConfig(
        @DefaultValue("0.6") double similarityThreshold,
        @DefaultValue("100") int batchSize
) {
    public static DedupConfig defaults() {
        return new DedupConfig(0.6, 100);
    }
}
