package io.esgradar.materiality.config;

import org.springframework.boot.context.properties.bind.DefaultValue;

public record ProcessingConfig(
        @DefaultValue("4") int parallelism,
        @DefaultValue("500") int collectLimit
) {
    public static ProcessingConfig defaults() {
        return new ProcessingConfig(4, 500);
    }

    public int effectiveParallelism() {
        return Math.max(1, parallelism);
    }
}
