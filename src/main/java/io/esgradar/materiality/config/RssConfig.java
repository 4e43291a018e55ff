package io.esgradar.materiality.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "rss")
public record RssConfig(
        List<RssSource> sources,
        HttpConfig http
) {
    public RssConfig {
        sources = sources == null ? List.of() : List.copyOf(sources);
        http = http == null ? new HttpConfig(10000, 15000, 3, 1000, null) : http;
    }

    public List<RssSource> getEnabledSources() {
        return sources.stream()
                .filter(RssSource::enabled)
                .toList();
    }
}
