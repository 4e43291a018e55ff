package io.esgradar.materiality.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "sentiment")
public record SentimentConfig(
        boolean enabled,
        String url,
        Duration connectTimeout,
        Duration readTimeout
) {}
