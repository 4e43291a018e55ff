package io.esgradar.materiality.config;

public record RssSource(
        String url,
        String name,
        boolean enabled
) {}
