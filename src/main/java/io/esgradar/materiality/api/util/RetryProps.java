package io.esgradar.materiality.api.util;

import io.esgradar.materiality.config.RssConfig;
import org.springframework.stereotype.Component;

@Component
public class RetryProps {
    private final int maxAttempts;
    private final long retryDelay;

    public RetryProps(RssConfig config) {
        this.maxAttempts = Math.max(1, config.http().maxRetries());
        this.retryDelay = Math.max(0, config.http().retryDelay());
    }

    public int getMaxAttempts() { return maxAttempts; }
    public long getRetryDelay() { return retryDelay; }
}
