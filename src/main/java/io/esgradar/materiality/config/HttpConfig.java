package io.esgradar.materiality.config;

import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

public record HttpConfig(
        @DefaultValue("10000") int connectTimeout,
        @DefaultValue("15000") int readTimeout,
        @DefaultValue("3") int maxRetries,
        @DefaultValue("1000") int retryDelay,
        List<String> userAgents
) {
    private static final String DEFAULT_USER_AGENT = "MaterialityRadar/1.0";

    public HttpConfig {
        userAgents = userAgents == null || userAgents.isEmpty()
                ? List.of(DEFAULT_USER_AGENT)
                : List.copyOf(userAgents);
    }

    public String userAgent(int index) {
        return userAgents.get(Math.floorMod(index, userAgents.size()));
    }
}
