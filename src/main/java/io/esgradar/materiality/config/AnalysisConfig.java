package io.esgradar.materiality.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AnalysisConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService topicAnalysisExecutor(MaterialityConfig config) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "topic-analysis-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };

        return Executors.newFixedThreadPool(config.processing().effectiveParallelism(), threadFactory);
    }
}
