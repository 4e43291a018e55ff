package io.esgradar.materiality.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "kafka.topics")
public record KafkaProperties(
        String analysisCompleted,
        String updateRequired
) {}
